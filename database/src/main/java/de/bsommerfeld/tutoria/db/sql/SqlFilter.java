package de.bsommerfeld.tutoria.db.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Collects optional {@code WHERE} conditions. Every method ignores a
 * {@code null} (or blank search) value, so callers can pass filter fields
 * through without checking them first.
 *
 * <pre>{@code
 * SqlStatement stmt = new SqlFilter()
 *         .eq("u.role", filter.role())
 *         .contains(filter.search(), "u.email", "u.name")
 *         .applyTo(SqlLoader.load("select-users"));
 * }</pre>
 */
public final class SqlFilter {

    private final List<String> conditions = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    public SqlFilter eq(String column, Object value) {
        if (value != null) {
            conditions.add(column + " = ?");
            params.add(value);
        }
        return this;
    }

    /** Adds {@code column op ?}; for ranges such as {@code >=} or {@code <}. */
    public SqlFilter compare(String column, String operator, Object value) {
        if (value != null) {
            conditions.add(column + " " + operator + " ?");
            params.add(value);
        }
        return this;
    }

    /**
     * Case-insensitive substring match of {@code search} against any of
     * {@code columns}. LIKE wildcards in the search text match literally.
     */
    public SqlFilter contains(String search, String... columns) {
        if (search == null || search.isBlank() || columns.length == 0) {
            return this;
        }
        String pattern = "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%";
        List<String> alternatives = new ArrayList<>();
        for (String column : columns) {
            alternatives.add("LOWER(" + column + ") LIKE ? ESCAPE '\\'");
            params.add(pattern);
        }
        conditions.add("(" + String.join(" OR ", alternatives) + ")");
        return this;
    }

    /** Adds a raw condition; {@code values} must match its placeholders. */
    public SqlFilter where(String condition, Object... values) {
        conditions.add(condition);
        for (Object value : values) {
            params.add(value);
        }
        return this;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /** Appends {@code WHERE ...} (if any condition was added) to {@code baseSql}. */
    public SqlStatement applyTo(String baseSql) {
        if (conditions.isEmpty()) {
            return new SqlStatement(baseSql, params);
        }
        return new SqlStatement(baseSql + " WHERE " + String.join(" AND ", conditions), params);
    }

    static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
