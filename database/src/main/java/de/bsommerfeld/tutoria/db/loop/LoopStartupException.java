package de.bsommerfeld.tutoria.db.loop;

/**
 * The background loop did not signal readiness in time. Fatal for the caller:
 * without a loop no database-backed request can be served.
 */
public class LoopStartupException extends RuntimeException {

    public LoopStartupException(String message) {
        super(message);
    }

    public LoopStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
