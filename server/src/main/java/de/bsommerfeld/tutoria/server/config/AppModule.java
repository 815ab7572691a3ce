package de.bsommerfeld.tutoria.server.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.config.ApplicationMode;
import de.bsommerfeld.tutoria.core.config.ConfigLoader;
import de.bsommerfeld.tutoria.core.config.DatabaseConfig;
import de.bsommerfeld.tutoria.core.config.LoopConfig;
import de.bsommerfeld.tutoria.core.config.SecurityConfig;
import de.bsommerfeld.tutoria.core.config.TutoriaConfig;
import de.bsommerfeld.tutoria.core.event.ApplicationEventBus;
import de.bsommerfeld.tutoria.core.util.StorageUtils;
import de.bsommerfeld.tutoria.db.DatabaseClient;
import de.bsommerfeld.tutoria.db.SqliteDatabaseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice wiring for the backend process.
 *
 * <p>
 * The mode decides the store: {@link ApplicationMode#PROD} uses the
 * configured URL or the SQLite file in the application data directory,
 * {@link ApplicationMode#TEST} a private in-memory database.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    static final String IN_MEMORY_URL = "jdbc:sqlite::memory:";

    private final TutoriaConfig config;
    private final ApplicationMode mode;

    /** Loads {@code config.toml} from the application data directory. */
    public AppModule() {
        this(loadConfig(), ApplicationMode.get());
    }

    public AppModule(TutoriaConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    private static TutoriaConfig loadConfig() {
        Path configPath = StorageUtils.getConfigFile(StorageUtils.APP_NAME);
        LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());
        return new ConfigLoader().load(configPath);
    }

    @Override
    protected void configure() {
        LOG.info("Application Mode initialized: {}", mode);

        bind(ApplicationMode.class).toInstance(mode);
        bind(TutoriaConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(LoopConfig.class).toInstance(config.getLoop());
        bind(SecurityConfig.class).toInstance(config.getSecurity());
        bind(Clock.class).toInstance(Clock.systemDefaultZone());
    }

    @Provides
    @Singleton
    DatabaseClient databaseClient(ApplicationEventBus eventBus) {
        return new SqliteDatabaseClient(resolveUrl(), config.getDatabase().isForeignKeys(), eventBus);
    }

    String resolveUrl() {
        if (mode.isTest()) {
            return IN_MEMORY_URL;
        }
        if (config.getDatabase().hasCustomUrl()) {
            return config.getDatabase().getUrl();
        }
        Path dbFile = StorageUtils.getDatabaseFile(StorageUtils.APP_NAME);
        StorageUtils.ensureDirectory(dbFile.getParent());
        return "jdbc:sqlite:" + dbFile.toAbsolutePath();
    }
}
