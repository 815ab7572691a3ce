package de.bsommerfeld.tutoria.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql},
 * e.g. {@code insert-user.sql}, {@code select-sessions.sql}. Files used as a
 * query base end without a {@code WHERE} so filters can be appended.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL from {@code sql/<name>.sql} on the classpath, trimmed
     * and without a trailing semicolon.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Splits a multi-statement script on semicolons that end a line. Blank
     * fragments and {@code --} comment lines are dropped.
     */
    public static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        for (String fragment : script.split(";\\s*(\\r?\\n|$)")) {
            StringBuilder sql = new StringBuilder();
            for (String line : fragment.split("\\r?\\n")) {
                if (!line.trim().startsWith("--")) {
                    sql.append(line).append('\n');
                }
            }
            String statement = sql.toString().trim();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            String sql = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            return sql.endsWith(";") ? sql.substring(0, sql.length() - 1).trim() : sql;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
