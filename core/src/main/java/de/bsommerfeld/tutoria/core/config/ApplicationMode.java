package de.bsommerfeld.tutoria.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the backend. Decides which store the database module opens:
 * the configured SQLite file in {@link #PROD}, a private in-memory database
 * seeded with demo data in {@link #TEST}.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code app.mode} system property, then the
     * {@code APP_MODE} environment variable. Unknown or missing values resolve
     * to {@link #PROD}.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("app.mode");
        if (mode == null || mode.isBlank()) {
            mode = System.getenv("APP_MODE");
        }

        if (mode == null || mode.isBlank()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', falling back to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
