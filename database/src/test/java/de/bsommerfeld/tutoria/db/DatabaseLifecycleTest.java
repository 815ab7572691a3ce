package de.bsommerfeld.tutoria.db;

import de.bsommerfeld.tutoria.core.event.ApplicationEventBus;
import de.bsommerfeld.tutoria.db.loop.PersistentLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseLifecycleTest {

    @TempDir
    Path tempDir;

    private PersistentLoop loop;
    private SqliteDatabaseClient client;
    private DatabaseLifecycle lifecycle;

    @AfterEach
    void tearDown() {
        if (lifecycle != null) {
            lifecycle.close();
        }
    }

    @Test
    void init_shouldStartLoopAndConnect() {
        setUp("jdbc:sqlite:" + tempDir.resolve("life.db").toAbsolutePath());

        lifecycle.init();

        assertTrue(lifecycle.isInitialized());
        assertTrue(loop.isRunning());
        boolean connected = loop.submit(client::isConnected);
        assertTrue(connected);
    }

    @Test
    void init_concurrentCallers_shouldStartOneLoop() throws Exception {
        setUp("jdbc:sqlite:" + tempDir.resolve("life.db").toAbsolutePath());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch go = new CountDownLatch(1);
            List<Future<?>> calls = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                calls.add(pool.submit(() -> {
                    go.await();
                    lifecycle.init();
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> call : calls) {
                call.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, loop.creationCount());
    }

    @Test
    void close_shouldDisconnectThenStopLoop() {
        setUp("jdbc:sqlite:" + tempDir.resolve("life.db").toAbsolutePath());
        lifecycle.init();

        lifecycle.close();

        assertFalse(lifecycle.isInitialized());
        assertFalse(loop.isRunning());
        assertFalse(client.isConnected());
    }

    @Test
    void close_afterLoopStoppedDirectly_shouldStillDisconnect() {
        setUp("jdbc:sqlite:" + tempDir.resolve("life.db").toAbsolutePath());
        lifecycle.init();
        loop.shutdown();
        assertFalse(loop.isRunning());
        assertTrue(client.isConnected());

        lifecycle.close();

        assertFalse(client.isConnected());
        assertFalse(loop.isRunning());
        assertFalse(lifecycle.isInitialized());
    }

    @Test
    void close_thenInit_shouldStartAgain() {
        setUp("jdbc:sqlite:" + tempDir.resolve("life.db").toAbsolutePath());
        lifecycle.init();
        lifecycle.close();

        lifecycle.init();

        assertTrue(loop.isRunning());
        assertEquals(2, loop.creationCount());
    }

    @Test
    void close_withoutInit_shouldBeNoOp() {
        setUp("jdbc:sqlite:" + tempDir.resolve("life.db").toAbsolutePath());

        assertDoesNotThrow(lifecycle::close);
        assertEquals(0, loop.creationCount());
    }

    @Test
    void init_unreachableStore_shouldFailWithStartupCategory() {
        setUp("jdbc:sqlite:" + tempDir.resolve("no").resolve("such").resolve("dir.db"));

        DatabaseException e = assertThrows(DatabaseException.class, lifecycle::init);

        assertEquals(ErrorCategory.STARTUP, e.category());
        assertFalse(lifecycle.isInitialized());
    }

    private void setUp(String url) {
        ApplicationEventBus eventBus = new ApplicationEventBus();
        loop = new PersistentLoop(Duration.ofSeconds(5), Duration.ofSeconds(2), "life-loop",
                Executors.defaultThreadFactory(), eventBus);
        client = new SqliteDatabaseClient(url, true, eventBus);
        Database database = new Database(loop, new ConnectionGuard(client, eventBus));
        lifecycle = new DatabaseLifecycle(loop, database, client);
    }
}
