package de.bsommerfeld.tutoria.db;

import java.util.Objects;

/**
 * The single failure type raised by the database layer. Callers of
 * {@link Database#call} receive the instance the unit of work threw, never a
 * wrapper around it.
 */
public class DatabaseException extends RuntimeException {

    private final ErrorCategory category;

    public DatabaseException(ErrorCategory category, String message) {
        this(category, message, null);
    }

    public DatabaseException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category");
    }

    public static DatabaseException notFound(String what) {
        return new DatabaseException(ErrorCategory.NOT_FOUND, what + " not found");
    }

    public ErrorCategory category() {
        return category;
    }

    public boolean isConnectionClass() {
        return category == ErrorCategory.CONNECTION;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + category + "]: " + getMessage();
    }
}
