package de.bsommerfeld.tutoria.core.event;

import java.time.Instant;

/**
 * Events the database layer posts on the {@link ApplicationEventBus}.
 */
public final class DatabaseEvents {

    private DatabaseEvents() {
    }

    /** A background loop thread came up and signalled readiness. */
    public record LoopStartedEvent(String threadName, Instant createdAt) {
    }

    /**
     * A loop was stopped. {@code drained} is false when the join timed out and
     * the thread was still working through its queue.
     */
    public record LoopStoppedEvent(String threadName, boolean drained) {
    }

    /** The shared client was (re)connected. */
    public record ConnectedEvent(String url) {
    }

    /**
     * The guard ran a disconnect/reconnect cycle. {@code reconnected} is false
     * when the reconnect attempt itself failed.
     */
    public record ConnectionRepairedEvent(String reason, boolean reconnected) {
    }

    /** A best-effort cleanup step failed and was swallowed. */
    public record CleanupFailedEvent(String step, String message) {
    }
}
