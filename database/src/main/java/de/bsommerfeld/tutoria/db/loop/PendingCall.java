package de.bsommerfeld.tutoria.db.loop;

import de.bsommerfeld.tutoria.db.DatabaseException;
import de.bsommerfeld.tutoria.db.ErrorCategory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * One in-flight submission: the unit of work plus the one-shot result slot
 * the submitting thread blocks on. Completed exactly once, either by
 * {@link #run()} on the loop thread or by {@link #abandon} when the loop dies
 * before reaching it.
 */
final class PendingCall<T> implements Runnable {

    private final UnitOfWork<T> work;
    private final CompletableFuture<T> result = new CompletableFuture<>();

    PendingCall(UnitOfWork<T> work) {
        this.work = work;
    }

    @Override
    public void run() {
        if (result.isDone()) {
            return;
        }
        try {
            result.complete(work.execute());
        } catch (Throwable t) {
            result.completeExceptionally(t);
        }
    }

    void abandon(Throwable reason) {
        result.completeExceptionally(reason);
    }

    boolean isDone() {
        return result.isDone();
    }

    /**
     * Blocks until the call completed and returns its value, or rethrows the
     * exact exception the unit of work raised.
     */
    T await() {
        try {
            return result.get();
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DatabaseException(ErrorCategory.INTERRUPTED,
                    "Interrupted while waiting for database work", e);
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        // Only reachable through sneaky throws, UnitOfWork declares no checked exceptions.
        return new DatabaseException(ErrorCategory.OPERATION, "Unit of work failed", cause);
    }
}
