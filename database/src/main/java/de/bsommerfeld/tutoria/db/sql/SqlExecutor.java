package de.bsommerfeld.tutoria.db.sql;

import de.bsommerfeld.tutoria.core.domain.Coded;
import de.bsommerfeld.tutoria.db.DatabaseClient;
import de.bsommerfeld.tutoria.db.SqlErrors;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs {@link SqlStatement}s on the client's connection. Every
 * {@link SQLException} leaves as a categorized
 * {@link de.bsommerfeld.tutoria.db.DatabaseException}.
 *
 * <p>
 * Parameter binding: {@link Coded} enums as their code, booleans as
 * {@code 0/1}, {@link LocalDateTime} via {@link Timestamps}, {@link LocalDate}
 * as ISO text, everything else through {@code setObject}.
 */
public final class SqlExecutor {

    private final DatabaseClient client;

    public SqlExecutor(DatabaseClient client) {
        this.client = client;
    }

    public static SqlExecutor on(DatabaseClient client) {
        return new SqlExecutor(client);
    }

    public <T> List<T> query(String operation, SqlStatement stmt, RowMapper<T> mapper) {
        Connection conn = client.connection();
        try (PreparedStatement ps = conn.prepareStatement(stmt.sql())) {
            bind(ps, stmt.params());
            List<T> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, e, client);
        }
    }

    public <T> Optional<T> queryOne(String operation, SqlStatement stmt, RowMapper<T> mapper) {
        List<T> rows = query(operation, stmt, mapper);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** Runs a single-value {@code SELECT COUNT(*)}-style query. */
    public long count(String operation, SqlStatement stmt) {
        return queryOne(operation, stmt, rs -> rs.getLong(1)).orElse(0L);
    }

    /** @return the number of affected rows */
    public int update(String operation, SqlStatement stmt) {
        Connection conn = client.connection();
        try (PreparedStatement ps = conn.prepareStatement(stmt.sql())) {
            bind(ps, stmt.params());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, e, client);
        }
    }

    /** Executes an {@code INSERT} and returns the new row id. */
    public long insert(String operation, SqlStatement stmt) {
        Connection conn = client.connection();
        try (PreparedStatement ps = conn.prepareStatement(stmt.sql())) {
            bind(ps, stmt.params());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, e, client);
        }
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, e, client);
        }
    }

    static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            int index = i + 1;
            if (value == null) {
                ps.setNull(index, Types.NULL);
            } else if (value instanceof Coded coded) {
                ps.setString(index, coded.code());
            } else if (value instanceof Boolean flag) {
                ps.setInt(index, flag ? 1 : 0);
            } else if (value instanceof LocalDateTime dateTime) {
                ps.setString(index, Timestamps.format(dateTime));
            } else if (value instanceof LocalDate date) {
                ps.setString(index, date.toString());
            } else {
                ps.setObject(index, value);
            }
        }
    }
}
