package de.bsommerfeld.tutoria.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.event.ApplicationEventBus;
import de.bsommerfeld.tutoria.core.event.DatabaseEvents.CleanupFailedEvent;
import de.bsommerfeld.tutoria.core.event.DatabaseEvents.ConnectionRepairedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped access to the shared {@link DatabaseClient}.
 *
 * <p>
 * Before the body runs the client is connected, with one reset-and-retry if
 * the first connect fails. After the body the connection is left open: it is
 * process-lifetime, and closing it per call would throw away the point of
 * keeping a persistent loop.
 *
 * <p>
 * A body failing with a {@link ErrorCategory#CONNECTION} error triggers exactly
 * one disconnect/reconnect cycle, after which the original exception is
 * rethrown unchanged. Every other failure passes through untouched.
 *
 * <p>
 * Must only be used from the database loop thread.
 */
@Singleton
public class ConnectionGuard {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionGuard.class);

    private final DatabaseClient client;
    private final ApplicationEventBus eventBus;

    @Inject
    public ConnectionGuard(DatabaseClient client, ApplicationEventBus eventBus) {
        this.client = client;
        this.eventBus = eventBus;
    }

    public <T> T withConnection(ConnectionBody<T> body) {
        ensureConnected();
        try {
            return body.apply(client);
        } catch (DatabaseException e) {
            if (e.isConnectionClass()) {
                repair(e);
            }
            throw e;
        }
    }

    private void ensureConnected() {
        if (client.isConnected()) {
            return;
        }
        try {
            client.connect();
        } catch (DatabaseException first) {
            LOG.warn("Connecting to {} failed ({}), resetting and retrying once", client.url(), first.getMessage());
            disconnectQuietly("reset before reconnect");
            try {
                client.connect();
            } catch (DatabaseException second) {
                DatabaseException startup = new DatabaseException(ErrorCategory.STARTUP,
                        "Database at " + client.url() + " is unavailable", second);
                startup.addSuppressed(first);
                throw startup;
            }
        }
    }

    private void repair(DatabaseException failure) {
        LOG.warn("Connection-class failure, reconnecting: {}", failure.getMessage());
        disconnectQuietly("disconnect after connection failure");

        boolean reconnected = false;
        try {
            client.connect();
            reconnected = true;
            LOG.info("Reconnected to {}", client.url());
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
            LOG.error("Reconnect to {} failed", client.url(), e);
        }
        eventBus.post(new ConnectionRepairedEvent(failure.getMessage(), reconnected));
    }

    private void disconnectQuietly(String step) {
        try {
            client.disconnect();
        } catch (RuntimeException e) {
            LOG.warn("Ignoring failure during {}: {}", step, e.getMessage());
            eventBus.post(new CleanupFailedEvent(step, e.getMessage()));
        }
    }
}
