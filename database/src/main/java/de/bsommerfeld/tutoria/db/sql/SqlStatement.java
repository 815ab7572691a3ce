package de.bsommerfeld.tutoria.db.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A SQL string together with the values for its {@code ?} placeholders, in
 * order. Parameter values may be {@code null}.
 */
public record SqlStatement(String sql, List<Object> params) {

    public SqlStatement {
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static SqlStatement of(String sql, Object... params) {
        return new SqlStatement(sql, Arrays.asList(params));
    }

    /** Appends a fragment and its parameters. */
    public SqlStatement append(String fragment, Object... more) {
        List<Object> combined = new ArrayList<>(params);
        combined.addAll(Arrays.asList(more));
        return new SqlStatement(sql + fragment, combined);
    }
}
