package de.bsommerfeld.tutoria.db;

/**
 * Classification of every failure that crosses the database boundary. The
 * {@link ConnectionGuard} dispatches on this instead of inspecting messages.
 */
public enum ErrorCategory {

    /** Transport or session is unusable; the guard repairs once and rethrows. */
    CONNECTION,

    /** The connection could not be established even after one reset. */
    STARTUP,

    /** The addressed row does not exist. */
    NOT_FOUND,

    /** Unique, foreign-key, not-null or check constraint violated. */
    CONSTRAINT,

    /** The waiting caller was interrupted; the unit of work itself kept running. */
    INTERRUPTED,

    /** Anything else the store rejected. */
    OPERATION
}
