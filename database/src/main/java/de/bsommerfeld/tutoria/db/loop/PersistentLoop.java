package de.bsommerfeld.tutoria.db.loop;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.config.LoopConfig;
import de.bsommerfeld.tutoria.core.event.ApplicationEventBus;
import de.bsommerfeld.tutoria.core.event.DatabaseEvents.LoopStartedEvent;
import de.bsommerfeld.tutoria.core.event.DatabaseEvents.LoopStoppedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gives synchronous callers blocking access to the single background database
 * thread.
 *
 * <h3>Threading model</h3>
 * <ul>
 * <li>Exactly one {@link EventLoop} is live at a time. It is created lazily
 * by the first {@link #submit} (or an explicit {@link #ensureLoop}) and
 * recreated on demand after {@link #shutdown()}.</li>
 * <li>Any number of request threads may call {@link #submit} concurrently.
 * Each call is queued, executed on the loop thread, and handed back through
 * its own result slot, so results never cross between callers. No ordering
 * is promised between independent submissions.</li>
 * <li>The check-and-create in {@link #ensureLoop} and the whole of
 * {@link #shutdown} run under one monitor; the fast path of
 * {@code ensureLoop} reads a volatile field and takes no lock.</li>
 * <li>A loop whose thread outlived the shutdown join keeps draining its
 * queue. No replacement is started until that thread has ended, so two
 * threads never share the connection; {@code ensureLoop} waits for it up to
 * the startup timeout.</li>
 * </ul>
 *
 * <p>
 * {@code submit} waits without a timeout. Callers that need a deadline must
 * impose it themselves; a unit of work that has started always runs to
 * completion.
 */
@Singleton
public class PersistentLoop {

    private static final Logger LOG = LoggerFactory.getLogger(PersistentLoop.class);

    private final Duration startupTimeout;
    private final Duration shutdownTimeout;
    private final String threadName;
    private final ThreadFactory threadFactory;
    private final ApplicationEventBus eventBus;

    private final Object lifecycleLock = new Object();
    private final AtomicInteger creations = new AtomicInteger();
    private volatile EventLoop current;
    private EventLoop retiring;

    @Inject
    public PersistentLoop(LoopConfig config, ApplicationEventBus eventBus) {
        this(config.startupTimeout(), config.shutdownTimeout(), config.getThreadName(),
                Executors.defaultThreadFactory(), eventBus);
    }

    public PersistentLoop(Duration startupTimeout, Duration shutdownTimeout, String threadName,
            ThreadFactory threadFactory, ApplicationEventBus eventBus) {
        this.startupTimeout = Objects.requireNonNull(startupTimeout, "startupTimeout");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        this.threadName = Objects.requireNonNull(threadName, "threadName");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    /**
     * Returns the live loop, starting a new one if there is none or the
     * previous one was stopped.
     *
     * @throws LoopStartupException if a new loop does not become ready within
     *                              the startup timeout, or the thread of the
     *                              previous loop is still running by then
     */
    public EventLoop ensureLoop() {
        EventLoop loop = current;
        if (loop != null && loop.isRunning()) {
            return loop;
        }
        synchronized (lifecycleLock) {
            loop = current;
            if (loop != null && loop.isRunning()) {
                return loop;
            }
            if (loop != null) {
                LOG.warn("Database loop {} is no longer running, replacing it", loop.name());
                retiring = loop;
            }
            awaitRetiring();
            int generation = creations.incrementAndGet();
            EventLoop created = new EventLoop(threadName + "-" + generation, threadFactory);
            created.start(startupTimeout);
            current = created;
            LOG.info("Started database loop {}", created.name());
            eventBus.post(new LoopStartedEvent(created.name(), created.createdAt()));
            return created;
        }
    }

    private void awaitRetiring() {
        EventLoop previous = retiring;
        if (previous == null || previous.isTerminated()) {
            retiring = null;
            return;
        }
        if (previous.isLoopThread()) {
            throw new LoopStartupException(
                    "Cannot start a new database loop from " + previous.name() + " while it is stopping");
        }
        LOG.info("Waiting for database loop {} to finish before starting a new one", previous.name());
        if (!previous.awaitTermination(startupTimeout)) {
            throw new LoopStartupException("Database loop " + previous.name() + " still running after "
                    + startupTimeout.toMillis() + " ms, not starting a second one");
        }
        retiring = null;
    }

    /**
     * Runs {@code work} on the loop thread and blocks until it finished.
     *
     * @return whatever {@code work} returned
     * @throws RuntimeException the exact exception {@code work} threw
     * @throws LoopStartupException if no loop could be started
     */
    public <T> T submit(UnitOfWork<T> work) {
        Objects.requireNonNull(work, "work");
        while (true) {
            EventLoop loop = ensureLoop();
            if (loop.isLoopThread()) {
                // Queueing behind ourselves would never complete.
                return work.execute();
            }
            PendingCall<T> call = new PendingCall<>(work);
            if (loop.execute(call)) {
                return call.await();
            }
            LOG.debug("Database loop {} closed before accepting work, retrying", loop.name());
        }
    }

    /**
     * Stops the live loop after its queue drained and waits for the thread,
     * bounded by the shutdown timeout. A timeout is logged, not thrown. No-op
     * when no loop exists; a later {@link #submit} starts a fresh one.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            EventLoop loop = current;
            if (loop == null) {
                LOG.debug("No database loop to shut down");
                return;
            }
            current = null;
            retiring = loop;

            if (loop.isLoopThread()) {
                loop.requestStop();
                LOG.info("Database loop {} stopping itself", loop.name());
                return;
            }

            boolean drained = loop.stop(shutdownTimeout);
            if (drained) {
                LOG.info("Database loop {} stopped", loop.name());
            } else {
                LOG.warn("Database loop {} did not terminate within {} ms, {} calls still queued",
                        loop.name(), shutdownTimeout.toMillis(), loop.backlog());
            }
            eventBus.post(new LoopStoppedEvent(loop.name(), drained));
        }
    }

    public boolean isRunning() {
        EventLoop loop = current;
        return loop != null && loop.isRunning();
    }

    public Optional<EventLoop> currentLoop() {
        return Optional.ofNullable(current);
    }

    /** How many loops were created over the lifetime of this instance. */
    public int creationCount() {
        return creations.get();
    }
}
