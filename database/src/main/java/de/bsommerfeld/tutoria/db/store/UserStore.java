package de.bsommerfeld.tutoria.db.store;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.domain.EnrollmentStatus;
import de.bsommerfeld.tutoria.core.domain.NewUser;
import de.bsommerfeld.tutoria.core.domain.User;
import de.bsommerfeld.tutoria.core.domain.UserFilter;
import de.bsommerfeld.tutoria.core.domain.UserRole;
import de.bsommerfeld.tutoria.core.domain.UserUpdate;
import de.bsommerfeld.tutoria.db.DatabaseClient;
import de.bsommerfeld.tutoria.db.DatabaseException;
import de.bsommerfeld.tutoria.db.SqlLoader;
import de.bsommerfeld.tutoria.db.sql.Columns;
import de.bsommerfeld.tutoria.db.sql.SqlExecutor;
import de.bsommerfeld.tutoria.db.sql.SqlFilter;
import de.bsommerfeld.tutoria.db.sql.SqlStatement;
import de.bsommerfeld.tutoria.db.sql.SqlUpdate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Table access for {@code users}. Password hashes are written here and read
 * back only through {@link #findCredentials}; the {@link User} record never
 * carries them.
 */
@Singleton
public class UserStore {

    private final Clock clock;

    @Inject
    public UserStore(Clock clock) {
        this.clock = clock;
    }

    public Optional<User> findById(DatabaseClient client, long id) {
        SqlStatement stmt = new SqlFilter().eq("u.id", id).applyTo(SqlLoader.load("select-users"));
        return SqlExecutor.on(client).queryOne("find user " + id, stmt, rs -> map(rs, ""));
    }

    public boolean exists(DatabaseClient client, long id) {
        return SqlExecutor.on(client).count("check user " + id,
                SqlStatement.of("SELECT COUNT(*) FROM users WHERE id = ?", id)) > 0;
    }

    public List<User> findMany(DatabaseClient client, UserFilter filter) {
        SqlStatement stmt = new SqlFilter()
                .eq("u.role", filter.role())
                .eq("u.status", filter.active())
                .contains(filter.search(), "u.email", "u.name")
                .applyTo(SqlLoader.load("select-users"))
                .append(" ORDER BY u.name ASC, u.id ASC");
        return SqlExecutor.on(client).query("list users", stmt, rs -> map(rs, ""));
    }

    /**
     * Students enrolled in {@code sessionId}, optionally narrowed by their
     * enrollment status and a search over email and name.
     */
    public List<User> findBySession(DatabaseClient client, long sessionId, String search,
            EnrollmentStatus status) {
        SqlStatement stmt = new SqlFilter()
                .eq("e.session_id", sessionId)
                .eq("e.status", status)
                .contains(search, "u.email", "u.name")
                .applyTo(SqlLoader.load("select-users-by-session"))
                .append(" ORDER BY u.name ASC, u.id ASC");
        return SqlExecutor.on(client).query("list students of session " + sessionId, stmt, rs -> map(rs, ""));
    }

    public Optional<StoredCredentials> findCredentials(DatabaseClient client, String email) {
        return SqlExecutor.on(client).queryOne("load credentials",
                SqlStatement.of(SqlLoader.load("select-user-credentials"), email),
                rs -> new StoredCredentials(rs.getLong("id"), rs.getString("password"),
                        Columns.bool(rs, "status")));
    }

    /**
     * @return the stored row
     * @throws de.bsommerfeld.tutoria.db.DatabaseException with
     *                                                     {@code CONSTRAINT} on
     *                                                     a duplicate email
     */
    public User insert(DatabaseClient client, NewUser user, String passwordHash) {
        LocalDateTime now = LocalDateTime.now(clock);
        SqlExecutor sql = SqlExecutor.on(client);
        long id = sql.insert("create user", SqlStatement.of(SqlLoader.load("insert-user"),
                user.email().trim(), passwordHash, user.name(), user.secondName(), user.secondSurname(),
                user.phoneNumber(), user.roleOrDefault(), user.activeOrDefault(), now, now));
        return findById(client, id).orElseThrow(() -> DatabaseException.notFound("user " + id));
    }

    /**
     * Applies the non-null fields of {@code update}. {@code passwordHash}
     * replaces the stored hash when non-null.
     *
     * @return the row after the update, empty if no such user exists
     */
    public Optional<User> update(DatabaseClient client, long id, UserUpdate update, String passwordHash) {
        SqlUpdate sqlUpdate = new SqlUpdate("users")
                .set("email", update.email() == null ? null : update.email().trim())
                .set("password", passwordHash)
                .set("name", update.name())
                .set("phone_number", update.phoneNumber())
                .set("role", update.role());
        return applyUpdate(client, id, sqlUpdate);
    }

    public Optional<User> updateStatus(DatabaseClient client, long id, boolean active) {
        return applyUpdate(client, id, new SqlUpdate("users").set("status", active));
    }

    private Optional<User> applyUpdate(DatabaseClient client, long id, SqlUpdate sqlUpdate) {
        if (!sqlUpdate.hasAssignments()) {
            return findById(client, id);
        }
        sqlUpdate.set("updated_at", LocalDateTime.now(clock));
        int changed = SqlExecutor.on(client).update("update user " + id, sqlUpdate.where("id = ?", id));
        return changed == 0 ? Optional.empty() : findById(client, id);
    }

    /**
     * Maps a user whose columns carry {@code prefix}. Returns {@code null}
     * when the id column is null, which is what an unmatched LEFT JOIN
     * yields.
     */
    static User map(ResultSet rs, String prefix) throws SQLException {
        if (Columns.isNull(rs, prefix + "id")) {
            return null;
        }
        return new User(
                rs.getLong(prefix + "id"),
                rs.getString(prefix + "email"),
                rs.getString(prefix + "name"),
                rs.getString(prefix + "second_name"),
                rs.getString(prefix + "second_surname"),
                rs.getString(prefix + "phone_number"),
                Columns.coded(rs, prefix + "role", UserRole::of),
                Columns.bool(rs, prefix + "status"),
                Columns.timestamp(rs, prefix + "created_at"),
                Columns.timestamp(rs, prefix + "updated_at"));
    }
}
