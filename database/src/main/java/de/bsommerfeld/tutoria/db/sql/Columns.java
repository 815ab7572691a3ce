package de.bsommerfeld.tutoria.db.sql;

import de.bsommerfeld.tutoria.core.domain.Coded;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.function.Function;

/**
 * Null-aware column readers. SQLite's JDBC driver returns {@code 0} for a
 * {@code NULL} integer, so nullable columns go through {@code getObject}.
 */
public final class Columns {

    private Columns() {
    }

    public static Boolean nullableBoolean(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        if (value == null) {
            return null;
        }
        return ((Number) value).intValue() != 0;
    }

    public static boolean bool(ResultSet rs, String column) throws SQLException {
        return rs.getInt(column) != 0;
    }

    public static boolean isNull(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column) == null;
    }

    public static LocalDateTime timestamp(ResultSet rs, String column) throws SQLException {
        return Timestamps.parse(rs.getString(column));
    }

    public static <E extends Enum<E> & Coded> E coded(ResultSet rs, String column,
            Function<String, E> parser) throws SQLException {
        String code = rs.getString(column);
        return code == null ? null : parser.apply(code);
    }
}
