package de.bsommerfeld.tutoria.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.db.loop.PersistentLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup and shutdown hooks for the hosting process.
 *
 * <p>
 * {@link #init()} is idempotent and safe to race from several first requests.
 * {@link #close()} disconnects on the loop and only then stops it: the
 * disconnect is itself loop work and would have nowhere to run afterwards.
 */
@Singleton
public class DatabaseLifecycle {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseLifecycle.class);

    private final PersistentLoop loop;
    private final Database database;
    private final DatabaseClient client;

    private final Object lock = new Object();
    private boolean initialized;

    @Inject
    public DatabaseLifecycle(PersistentLoop loop, Database database, DatabaseClient client) {
        this.loop = loop;
        this.database = database;
        this.client = client;
    }

    /**
     * Starts the loop and connects the client, which applies the schema.
     *
     * @throws de.bsommerfeld.tutoria.db.loop.LoopStartupException if the loop
     *                                                             does not come up
     * @throws DatabaseException with {@link ErrorCategory#STARTUP} if the
     *                           store is unreachable
     */
    public void init() {
        synchronized (lock) {
            if (initialized) {
                return;
            }
            LOG.info("Initializing database at {}", client.url());
            loop.ensureLoop();
            database.call(c -> null);
            initialized = true;
            LOG.info("Database ready.");
        }
    }

    /**
     * Disconnects the client if connected, then shuts the loop down. Failures
     * of the disconnect are logged; the loop is stopped regardless.
     */
    public void close() {
        synchronized (lock) {
            // A loop stopped behind our back is recreated by submit, so the connection still gets closed.
            if (initialized || loop.isRunning()) {
                try {
                    loop.submit(() -> {
                        if (client.isConnected()) {
                            client.disconnect();
                            LOG.info("Disconnected from {}", client.url());
                        }
                        return null;
                    });
                } catch (RuntimeException e) {
                    LOG.warn("Disconnect during shutdown failed: {}", e.getMessage());
                }
            }
            loop.shutdown();
            initialized = false;
        }
    }

    public boolean isInitialized() {
        synchronized (lock) {
            return initialized;
        }
    }
}
