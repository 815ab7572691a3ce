package de.bsommerfeld.tutoria.db.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a partial {@code UPDATE}. Columns set to {@code null} are skipped,
 * which is how optional fields of an update request stay untouched.
 */
public final class SqlUpdate {

    private final String table;
    private final List<String> assignments = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    public SqlUpdate(String table) {
        this.table = table;
    }

    public SqlUpdate set(String column, Object value) {
        if (value != null) {
            assignments.add(column + " = ?");
            params.add(value);
        }
        return this;
    }

    /** Sets {@code column} even when {@code value} is {@code null}. */
    public SqlUpdate setNullable(String column, Object value) {
        assignments.add(column + " = ?");
        params.add(value);
        return this;
    }

    public boolean hasAssignments() {
        return !assignments.isEmpty();
    }

    /**
     * @throws IllegalStateException if nothing was assigned
     */
    public SqlStatement where(String condition, Object... values) {
        if (assignments.isEmpty()) {
            throw new IllegalStateException("UPDATE " + table + " without assignments");
        }
        List<Object> all = new ArrayList<>(params);
        for (Object value : values) {
            all.add(value);
        }
        return new SqlStatement("UPDATE " + table + " SET " + String.join(", ", assignments)
                + " WHERE " + condition, all);
    }
}
