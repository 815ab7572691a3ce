package de.bsommerfeld.tutoria.db;

import java.sql.Connection;

/**
 * The single shared handle to the relational store. The connection it owns
 * lives for the whole process; it is opened on demand by the
 * {@link ConnectionGuard} and closed by {@link DatabaseLifecycle#close()}.
 *
 * <p>
 * Not thread-safe. Every method is only ever invoked from the database loop
 * thread, which serializes all connection state changes.
 */
public interface DatabaseClient {

    /**
     * Opens the connection and applies the schema. No-op when already
     * connected.
     *
     * @throws DatabaseException with {@link ErrorCategory#CONNECTION} on failure
     */
    void connect();

    /** Closes the connection. No-op when not connected. */
    void disconnect();

    boolean isConnected();

    /**
     * Returns the open JDBC connection.
     *
     * @throws DatabaseException with {@link ErrorCategory#CONNECTION} when not
     *                           connected
     */
    Connection connection();

    /** Location of the store, for logs and health output. */
    String url();
}
