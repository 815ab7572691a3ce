package de.bsommerfeld.tutoria.server;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.tutoria.core.config.ApplicationMode;
import de.bsommerfeld.tutoria.core.util.StorageUtils;
import de.bsommerfeld.tutoria.db.DatabaseException;
import de.bsommerfeld.tutoria.db.DatabaseLifecycle;
import de.bsommerfeld.tutoria.db.loop.LoopStartupException;
import de.bsommerfeld.tutoria.server.config.AppModule;
import de.bsommerfeld.tutoria.service.DemoDataSeeder;
import de.bsommerfeld.tutoria.service.HealthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Brings the database layer up before anything else,
 * seeds demo data in TEST mode, then parks the main thread until the JVM is
 * asked to exit; the shutdown hook disconnects and stops the loop.
 */
public class TutoriaApplication {

    private static final Logger LOG;

    static {
        // Must run before the first logger is created; logback.xml reads it.
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            StorageUtils.ensureDirectory(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (RuntimeException e) {
            System.err.println("Failed to create log directory: " + logDir + " (" + e.getMessage() + ")");
        }
        LOG = LoggerFactory.getLogger(TutoriaApplication.class);
    }

    private final Injector injector;
    private final CountDownLatch stopped = new CountDownLatch(1);

    TutoriaApplication(Injector injector) {
        this.injector = injector;
    }

    public static void main(String[] args) {
        TutoriaApplication app = new TutoriaApplication(Guice.createInjector(new AppModule()));
        if (!app.start()) {
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "tutoria-shutdown"));
        app.awaitStop();
    }

    /** @return {@code false} if the database layer could not be brought up */
    boolean start() {
        DatabaseLifecycle lifecycle = injector.getInstance(DatabaseLifecycle.class);
        try {
            lifecycle.init();
        } catch (LoopStartupException e) {
            LOG.error("Database loop failed to start, aborting.", e);
            return false;
        } catch (DatabaseException e) {
            LOG.error("Database unavailable ({}), aborting.", e.category(), e);
            return false;
        }

        if (injector.getInstance(ApplicationMode.class).isTest()) {
            injector.getInstance(DemoDataSeeder.class).seedIfEmpty();
        }
        LOG.info("Tutoria backend started: {}", injector.getInstance(HealthService.class).check());
        return true;
    }

    void stop() {
        LOG.info("Shutting down...");
        try {
            injector.getInstance(DatabaseLifecycle.class).close();
        } finally {
            stopped.countDown();
        }
    }

    void awaitStop() {
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for shutdown");
        }
    }
}
