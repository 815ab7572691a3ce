package de.bsommerfeld.tutoria.db;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;

/**
 * Maps driver exceptions onto {@link ErrorCategory}. Order of evidence: typed
 * JDBC subclasses, then the SQLState class ({@code 08} connection, {@code 23}
 * integrity), then SQLite result codes, then the state of the client itself.
 */
public final class SqlErrors {

    private SqlErrors() {
    }

    /**
     * Wraps {@code e} into a {@link DatabaseException} for {@code operation}.
     * A failure on a client that is no longer connected is always
     * connection-class, whatever the driver reported.
     */
    public static DatabaseException translate(String operation, SQLException e, DatabaseClient client) {
        ErrorCategory category = classify(e);
        if (category != ErrorCategory.CONNECTION && client != null && !client.isConnected()) {
            category = ErrorCategory.CONNECTION;
        }
        return new DatabaseException(category, operation + " failed: " + e.getMessage(), e);
    }

    public static ErrorCategory classify(SQLException e) {
        if (e instanceof SQLNonTransientConnectionException
                || e instanceof SQLTransientConnectionException
                || e instanceof SQLRecoverableException) {
            return ErrorCategory.CONNECTION;
        }
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return ErrorCategory.CONSTRAINT;
        }

        String state = e.getSQLState();
        if (state != null && state.length() >= 2) {
            String stateClass = state.substring(0, 2);
            if ("08".equals(stateClass)) {
                return ErrorCategory.CONNECTION;
            }
            if ("23".equals(stateClass)) {
                return ErrorCategory.CONSTRAINT;
            }
        }

        if (e instanceof SQLiteException sqlite) {
            return classify(sqlite.getResultCode());
        }
        return ErrorCategory.OPERATION;
    }

    static ErrorCategory classify(SQLiteErrorCode code) {
        if (code == null) {
            return ErrorCategory.OPERATION;
        }
        String name = code.name();
        if (name.startsWith("SQLITE_CONSTRAINT")) {
            return ErrorCategory.CONSTRAINT;
        }
        if (name.startsWith("SQLITE_IOERR")
                || name.startsWith("SQLITE_CANTOPEN")
                || code == SQLiteErrorCode.SQLITE_NOTADB
                || code == SQLiteErrorCode.SQLITE_MISUSE) {
            return ErrorCategory.CONNECTION;
        }
        return ErrorCategory.OPERATION;
    }
}
