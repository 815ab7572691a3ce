package de.bsommerfeld.tutoria.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.db.DatabaseClient;
import de.bsommerfeld.tutoria.db.loop.PersistentLoop;

/**
 * Reports the state of the loop and the connection without changing either.
 * A stopped loop is reported, not restarted.
 */
@Singleton
public class HealthService {

    private final PersistentLoop loop;
    private final DatabaseClient client;

    @Inject
    public HealthService(PersistentLoop loop, DatabaseClient client) {
        this.loop = loop;
        this.client = client;
    }

    public HealthStatus check() {
        if (!loop.isRunning()) {
            return new HealthStatus(false, false, loop.creationCount());
        }
        // Connection state is owned by the loop thread, so read it there.
        boolean connected = loop.submit(client::isConnected);
        return new HealthStatus(true, connected, loop.creationCount());
    }
}
