package de.bsommerfeld.tutoria.db;

import de.bsommerfeld.tutoria.core.event.ApplicationEventBus;
import de.bsommerfeld.tutoria.core.event.DatabaseEvents.ConnectedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite-backed {@link DatabaseClient}.
 *
 * <h3>Connection strategy</h3>
 * A single JDBC {@link Connection} is opened on {@link #connect()} and kept
 * until {@link #disconnect()}. All access happens on the database loop thread,
 * so the connection is never shared between threads and SQLite sees one
 * writer.
 *
 * <h3>Schema</h3>
 * {@code sql/schema.sql} is applied on every connect. Every DDL statement uses
 * {@code IF NOT EXISTS}, so this is safe on an existing file and also
 * rebuilds an in-memory database after a reconnect.
 */
public class SqliteDatabaseClient implements DatabaseClient {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabaseClient.class);

    private final String url;
    private final boolean foreignKeys;
    private final ApplicationEventBus eventBus;

    private Connection connection;

    public SqliteDatabaseClient(String url, boolean foreignKeys, ApplicationEventBus eventBus) {
        this.url = url;
        this.foreignKeys = foreignKeys;
        this.eventBus = eventBus;
    }

    Connection openConnection() throws SQLException {
        return DriverManager.getConnection(url);
    }

    @Override
    public void connect() {
        if (isConnected()) {
            return;
        }
        Connection opened = null;
        try {
            opened = openConnection();
            try (Statement stmt = opened.createStatement()) {
                stmt.execute("PRAGMA foreign_keys = " + (foreignKeys ? "ON" : "OFF"));
            }
            applySchema(opened);
            connection = opened;
        } catch (SQLException e) {
            closeAfterFailedConnect(opened);
            throw new DatabaseException(ErrorCategory.CONNECTION, "Connecting to " + url + " failed", e);
        }
        LOG.info("Connected to {}", url);
        eventBus.post(new ConnectedEvent(url));
    }

    private void applySchema(Connection conn) throws SQLException {
        String schema = SqlLoader.load("schema");
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.split(schema)) {
                stmt.execute(sql);
            }
        }
        LOG.debug("Schema applied.");
    }

    private void closeAfterFailedConnect(Connection opened) {
        if (opened == null) {
            return;
        }
        try {
            opened.close();
        } catch (SQLException closeFailure) {
            LOG.debug("Closing half-open connection failed: {}", closeFailure.getMessage());
        }
    }

    @Override
    public void disconnect() {
        Connection conn = connection;
        if (conn == null) {
            return;
        }
        connection = null;
        try {
            conn.close();
        } catch (SQLException e) {
            throw new DatabaseException(ErrorCategory.CONNECTION, "Closing connection to " + url + " failed", e);
        }
    }

    @Override
    public boolean isConnected() {
        Connection conn = connection;
        if (conn == null) {
            return false;
        }
        try {
            return !conn.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    @Override
    public Connection connection() {
        if (!isConnected()) {
            throw new DatabaseException(ErrorCategory.CONNECTION, "Not connected to " + url);
        }
        return connection;
    }

    @Override
    public String url() {
        return url;
    }
}
