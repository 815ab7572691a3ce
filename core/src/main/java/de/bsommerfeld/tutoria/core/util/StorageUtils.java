package de.bsommerfeld.tutoria.core.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves where the backend keeps its files: configuration, the SQLite
 * database and logs. Follows each platform's convention for per-user
 * application data:
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}}</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}}, else
 * {@code ~/.local/share/{appName}}</li>
 * </ul>
 * The {@code tutoria.home} system property overrides all of the above, which
 * is what containers and tests use.
 */
public final class StorageUtils {

    public static final String APP_NAME = "tutoria";

    private StorageUtils() {
    }

    /**
     * Returns the application data directory. Not created here, see
     * {@link #ensureDirectory(Path)}.
     */
    public static Path getAppDataDir(String appName) {
        String override = System.getProperty("tutoria.home");
        if (override != null && !override.isBlank()) {
            return Paths.get(override).toAbsolutePath();
        }

        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(home, "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(home, ".local", "share", appName);
    }

    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve("config.toml");
    }

    public static Path getDatabaseFile(String appName) {
        return getAppDataDir(appName).resolve(appName + ".db");
    }

    /**
     * Creates {@code dir} and its parents if missing.
     *
     * @return the same path, for chaining
     */
    public static Path ensureDirectory(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + dir, e);
        }
    }
}
