package de.bsommerfeld.tutoria.db.store;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.domain.Course;
import de.bsommerfeld.tutoria.core.domain.CourseFilter;
import de.bsommerfeld.tutoria.core.domain.CourseUpdate;
import de.bsommerfeld.tutoria.core.domain.NewCourse;
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

/** Table access for {@code courses}. */
@Singleton
public class CourseStore {

    private final Clock clock;

    @Inject
    public CourseStore(Clock clock) {
        this.clock = clock;
    }

    public Optional<Course> findById(DatabaseClient client, long id) {
        SqlStatement stmt = new SqlFilter().eq("c.id", id).applyTo(SqlLoader.load("select-courses"));
        return SqlExecutor.on(client).queryOne("find course " + id, stmt, rs -> map(rs, ""));
    }

    public List<Course> findMany(DatabaseClient client, CourseFilter filter) {
        SqlStatement stmt = new SqlFilter()
                .eq("c.status", filter.active())
                .eq("c.semester", filter.semester())
                .contains(filter.search(), "c.name", "c.description", "c.code")
                .applyTo(SqlLoader.load("select-courses"))
                .append(" ORDER BY c.id ASC");
        return SqlExecutor.on(client).query("list courses", stmt, rs -> map(rs, ""));
    }

    public Course insert(DatabaseClient client, NewCourse course) {
        LocalDateTime now = LocalDateTime.now(clock);
        long id = SqlExecutor.on(client).insert("create course", SqlStatement.of(SqlLoader.load("insert-course"),
                course.code(), course.name(), course.description(), course.semester(), course.active(), now, now));
        return findById(client, id).orElseThrow(() -> DatabaseException.notFound("course " + id));
    }

    /** @return the row after the update, empty if no such course exists */
    public Optional<Course> update(DatabaseClient client, long id, CourseUpdate update) {
        SqlUpdate sqlUpdate = new SqlUpdate("courses")
                .set("name", update.name())
                .set("description", update.description())
                .set("semester", update.semester())
                .set("status", update.active());
        if (!sqlUpdate.hasAssignments()) {
            return findById(client, id);
        }
        sqlUpdate.set("updated_at", LocalDateTime.now(clock));
        int changed = SqlExecutor.on(client).update("update course " + id, sqlUpdate.where("id = ?", id));
        return changed == 0 ? Optional.empty() : findById(client, id);
    }

    static Course map(ResultSet rs, String prefix) throws SQLException {
        if (Columns.isNull(rs, prefix + "id")) {
            return null;
        }
        return new Course(
                rs.getLong(prefix + "id"),
                rs.getString(prefix + "code"),
                rs.getString(prefix + "name"),
                rs.getString(prefix + "description"),
                rs.getInt(prefix + "semester"),
                Columns.bool(rs, prefix + "status"),
                Columns.timestamp(rs, prefix + "created_at"),
                Columns.timestamp(rs, prefix + "updated_at"));
    }
}
