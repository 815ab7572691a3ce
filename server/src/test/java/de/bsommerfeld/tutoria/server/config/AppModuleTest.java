package de.bsommerfeld.tutoria.server.config;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.tutoria.core.config.ApplicationMode;
import de.bsommerfeld.tutoria.core.config.TutoriaConfig;
import de.bsommerfeld.tutoria.db.Database;
import de.bsommerfeld.tutoria.db.DatabaseClient;
import de.bsommerfeld.tutoria.db.SqliteDatabaseClient;
import de.bsommerfeld.tutoria.db.loop.PersistentLoop;
import de.bsommerfeld.tutoria.service.PasswordHasher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppModuleTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty("tutoria.home");
    }

    // -- Store URL --

    @Test
    void resolveUrl_testMode_shouldUseInMemoryStore() {
        TutoriaConfig config = new TutoriaConfig();
        config.getDatabase().setUrl("jdbc:sqlite:/ignored.db");

        assertEquals("jdbc:sqlite::memory:", new AppModule(config, ApplicationMode.TEST).resolveUrl());
    }

    @Test
    void resolveUrl_customUrl_shouldWinInProd() {
        TutoriaConfig config = new TutoriaConfig();
        config.getDatabase().setUrl("jdbc:sqlite:/srv/tutoria/main.db");

        assertEquals("jdbc:sqlite:/srv/tutoria/main.db", new AppModule(config, ApplicationMode.PROD).resolveUrl());
    }

    @Test
    void resolveUrl_default_shouldPointIntoAppDataDir() {
        Path home = tempDir.resolve("home");
        System.setProperty("tutoria.home", home.toString());

        String url = new AppModule(new TutoriaConfig(), ApplicationMode.PROD).resolveUrl();

        assertEquals("jdbc:sqlite:" + home.toAbsolutePath().resolve("tutoria.db"), url);
        assertTrue(Files.isDirectory(home));
    }

    // -- Wiring --

    @Test
    void injector_shouldShareOneLoopAndClient() {
        Injector injector = Guice.createInjector(new AppModule(new TutoriaConfig(), ApplicationMode.TEST));

        assertSame(injector.getInstance(PersistentLoop.class), injector.getInstance(PersistentLoop.class));
        assertSame(injector.getInstance(Database.class), injector.getInstance(Database.class));
        DatabaseClient client = injector.getInstance(DatabaseClient.class);
        assertSame(client, injector.getInstance(DatabaseClient.class));
        assertEquals("jdbc:sqlite::memory:", assertInstanceOf(SqliteDatabaseClient.class, client).url());
        assertNotNull(injector.getInstance(PasswordHasher.class));
        assertFalse(injector.getInstance(PersistentLoop.class).isRunning());
    }
}
