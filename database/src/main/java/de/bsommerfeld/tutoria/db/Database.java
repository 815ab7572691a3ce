package de.bsommerfeld.tutoria.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.db.loop.PersistentLoop;

/**
 * Entry point for domain services: runs a body on the loop thread under the
 * {@link ConnectionGuard} and blocks until it is done. One call is one unit of
 * work; several store operations inside one body share the connection and run
 * back to back without other submissions interleaving.
 */
@Singleton
public class Database {

    private final PersistentLoop loop;
    private final ConnectionGuard guard;

    @Inject
    public Database(PersistentLoop loop, ConnectionGuard guard) {
        this.loop = loop;
        this.guard = guard;
    }

    /**
     * @throws DatabaseException exactly as raised inside {@code body}
     */
    public <T> T call(ConnectionBody<T> body) {
        return loop.submit(() -> guard.withConnection(body));
    }
}
