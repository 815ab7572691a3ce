package de.bsommerfeld.tutoria.db.loop;

import de.bsommerfeld.tutoria.db.DatabaseException;
import de.bsommerfeld.tutoria.db.ErrorCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Handle to one background database thread and its task queue.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li>{@link #start} launches the thread and blocks until it signals
 * readiness, bounded by a timeout</li>
 * <li>{@link #execute} enqueues calls while the loop accepts work</li>
 * <li>{@link #stop} closes intake, lets the thread finish everything already
 * queued and joins it, again bounded</li>
 * </ol>
 * A stopped loop is never restarted; {@link PersistentLoop} creates a new one.
 *
 * <p>
 * Intake and the stop marker share one monitor, so nothing can be enqueued
 * behind the marker and be left without a thread to run it.
 */
public final class EventLoop {

    private static final Logger LOG = LoggerFactory.getLogger(EventLoop.class);

    private static final Runnable STOP = () -> {
    };

    private final String name;
    private final Instant createdAt;
    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
    private final CountDownLatch ready = new CountDownLatch(1);
    private final Object intake = new Object();
    private final Thread thread;

    private volatile boolean accepting;
    private volatile boolean aborted;

    EventLoop(String name, ThreadFactory threadFactory) {
        this.name = name;
        this.createdAt = Instant.now();
        this.thread = threadFactory.newThread(this::runLoop);
        this.thread.setName(name);
        this.thread.setDaemon(true);
    }

    /**
     * Starts the thread and waits for its readiness signal.
     *
     * @throws LoopStartupException if the signal does not arrive within
     *                              {@code timeout} or the wait is interrupted
     */
    void start(Duration timeout) {
        accepting = true;
        thread.start();
        try {
            if (!ready.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                abort();
                throw new LoopStartupException(
                        "Database loop " + name + " did not start within " + timeout.toMillis() + " ms");
            }
        } catch (InterruptedException e) {
            abort();
            Thread.currentThread().interrupt();
            throw new LoopStartupException("Interrupted while starting database loop " + name, e);
        }
        LOG.debug("Database loop {} ready", name);
    }

    private void abort() {
        synchronized (intake) {
            accepting = false;
            aborted = true;
        }
        thread.interrupt();
    }

    private void runLoop() {
        ready.countDown();
        try {
            while (!aborted) {
                Runnable task = queue.take();
                if (task == STOP) {
                    break;
                }
                task.run();
                // Only abort() ends the loop by interrupt.
                if (Thread.interrupted() && !aborted) {
                    LOG.debug("Cleared interrupt flag left by a unit of work on {}", name);
                }
            }
        } catch (InterruptedException e) {
            LOG.warn("Database loop {} interrupted, abandoning queued work", name);
            Thread.currentThread().interrupt();
        } finally {
            synchronized (intake) {
                accepting = false;
            }
            abandonRemaining();
        }
    }

    private void abandonRemaining() {
        List<Runnable> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        for (Runnable task : leftovers) {
            if (task instanceof PendingCall<?> call) {
                call.abandon(new DatabaseException(ErrorCategory.OPERATION,
                        "Database loop " + name + " terminated before running the call"));
            }
        }
    }

    /**
     * Enqueues {@code task}.
     *
     * @return {@code false} if the loop no longer accepts work
     */
    boolean execute(Runnable task) {
        synchronized (intake) {
            if (!accepting) {
                return false;
            }
            queue.add(task);
            return true;
        }
    }

    /**
     * Closes intake and queues the stop marker behind all pending work. Does
     * not wait.
     */
    void requestStop() {
        synchronized (intake) {
            if (!accepting) {
                return;
            }
            accepting = false;
            queue.add(STOP);
        }
    }

    /**
     * Requests a stop and joins the thread for at most {@code timeout}.
     *
     * @return {@code true} if the thread terminated in time
     */
    boolean stop(Duration timeout) {
        requestStop();
        return awaitTermination(timeout);
    }

    /**
     * Waits for the thread to end, at most {@code timeout}.
     *
     * @return {@code true} if the thread has terminated
     */
    boolean awaitTermination(Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    /** True once the thread has ended, whether or not it drained its queue. */
    public boolean isTerminated() {
        return !thread.isAlive();
    }

    /** True while the loop accepts work and its thread is alive. */
    public boolean isRunning() {
        return accepting && thread.isAlive();
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == thread;
    }

    public String name() {
        return name;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** Number of queued calls not yet picked up. */
    public int backlog() {
        return queue.size();
    }

    @Override
    public String toString() {
        return "EventLoop[" + name + ", running=" + isRunning() + ", createdAt=" + createdAt + "]";
    }
}
