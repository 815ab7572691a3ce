package de.bsommerfeld.tutoria.db.loop;

import de.bsommerfeld.tutoria.db.DatabaseException;
import de.bsommerfeld.tutoria.db.ErrorCategory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventLoopTest {

    @Test
    void start_shouldNameThreadAndAcceptWork() throws Exception {
        EventLoop loop = new EventLoop("unit-loop-1", Executors.defaultThreadFactory());
        loop.start(Duration.ofSeconds(5));
        try {
            PendingCall<String> call = new PendingCall<>(() -> Thread.currentThread().getName());
            assertTrue(loop.execute(call));

            assertEquals("unit-loop-1", call.await());
            assertTrue(loop.isRunning());
        } finally {
            assertTrue(loop.stop(Duration.ofSeconds(2)));
        }
    }

    @Test
    void execute_afterStop_shouldBeRefused() {
        EventLoop loop = new EventLoop("unit-loop-2", Executors.defaultThreadFactory());
        loop.start(Duration.ofSeconds(5));

        assertTrue(loop.stop(Duration.ofSeconds(2)));

        assertFalse(loop.execute(new PendingCall<>(() -> 1)));
        assertFalse(loop.isRunning());
    }

    @Test
    void requestStop_shouldRunQueuedWorkFirst() throws Exception {
        EventLoop loop = new EventLoop("unit-loop-3", Executors.defaultThreadFactory());
        loop.start(Duration.ofSeconds(5));
        CountDownLatch gate = new CountDownLatch(1);

        PendingCall<Integer> blocker = new PendingCall<>(() -> {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 1;
        });
        PendingCall<Integer> queued = new PendingCall<>(() -> 2);
        loop.execute(blocker);
        loop.execute(queued);
        loop.requestStop();

        assertFalse(loop.execute(new PendingCall<>(() -> 3)));
        gate.countDown();

        assertEquals(1, blocker.await());
        assertEquals(2, queued.await());
        assertTrue(loop.stop(Duration.ofSeconds(2)));
    }

    @Test
    void pendingCall_shouldRethrowRuntimeFailureUnwrapped() {
        IllegalArgumentException failure = new IllegalArgumentException("bad input");
        PendingCall<Object> call = new PendingCall<>(() -> {
            throw failure;
        });

        call.run();

        assertTrue(call.isDone());
        assertSame(failure, assertThrows(IllegalArgumentException.class, call::await));
    }

    @Test
    void pendingCall_abandoned_shouldNotRunAnymore() {
        boolean[] ran = { false };
        PendingCall<Object> call = new PendingCall<>(() -> {
            ran[0] = true;
            return null;
        });

        call.abandon(new DatabaseException(ErrorCategory.OPERATION, "loop gone"));
        call.run();

        assertFalse(ran[0]);
        DatabaseException e = assertThrows(DatabaseException.class, call::await);
        assertEquals(ErrorCategory.OPERATION, e.category());
    }
}
