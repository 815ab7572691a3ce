package de.bsommerfeld.tutoria.db.store;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.domain.Enrollment;
import de.bsommerfeld.tutoria.core.domain.NewSession;
import de.bsommerfeld.tutoria.core.domain.SessionFilter;
import de.bsommerfeld.tutoria.core.domain.SessionLevel;
import de.bsommerfeld.tutoria.core.domain.SessionStatus;
import de.bsommerfeld.tutoria.core.domain.SessionType;
import de.bsommerfeld.tutoria.core.domain.TutoringSession;
import de.bsommerfeld.tutoria.db.DatabaseClient;
import de.bsommerfeld.tutoria.db.DatabaseException;
import de.bsommerfeld.tutoria.db.SqlLoader;
import de.bsommerfeld.tutoria.db.sql.Columns;
import de.bsommerfeld.tutoria.db.sql.SqlExecutor;
import de.bsommerfeld.tutoria.db.sql.SqlFilter;
import de.bsommerfeld.tutoria.db.sql.SqlStatement;
import de.bsommerfeld.tutoria.db.sql.SqlUpdate;
import de.bsommerfeld.tutoria.db.sql.Timestamps;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Table access for {@code sessions}. Every session is returned with its
 * course, its tutor and all of its enrollments; the enrollments are fetched in
 * one extra query per listing, not per row.
 */
@Singleton
public class SessionStore {

    private final Clock clock;
    private final EnrollmentStore enrollments;

    @Inject
    public SessionStore(Clock clock, EnrollmentStore enrollments) {
        this.clock = clock;
        this.enrollments = enrollments;
    }

    public Optional<TutoringSession> findById(DatabaseClient client, long id) {
        SqlStatement stmt = new SqlFilter().eq("s.id", id).applyTo(SqlLoader.load("select-sessions"));
        List<TutoringSession> found = load(client, "find session " + id, stmt);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public boolean exists(DatabaseClient client, long id) {
        return SqlExecutor.on(client).count("check session " + id,
                SqlStatement.of("SELECT COUNT(*) FROM sessions WHERE id = ?", id)) > 0;
    }

    /**
     * Catalogue listing ordered by start date. {@code startDate} bounds the
     * session start, {@code endDate} bounds the session end, both inclusive
     * whole days.
     */
    public List<TutoringSession> findMany(DatabaseClient client, SessionFilter filter) {
        SqlFilter where = common(filter)
                .compare("s.start_date", ">=", Timestamps.startOfDay(filter.startDate()))
                .compare("s.end_date", "<=", Timestamps.endOfDay(filter.endDate()));
        if (filter.excludeStudentId() != null) {
            where.where("s.id NOT IN (SELECT session_id FROM session_students WHERE student_id = ?)",
                    filter.excludeStudentId());
        }
        return load(client, "list sessions", ordered(where, filter));
    }

    public List<TutoringSession> findByTutor(DatabaseClient client, long tutorId, SessionFilter filter) {
        SqlFilter where = common(filter)
                .eq("s.tutor_id", tutorId)
                .compare("s.start_date", ">=", Timestamps.startOfDay(filter.startDate()))
                .compare("s.end_date", "<=", Timestamps.endOfDay(filter.endDate()));
        return load(client, "list sessions of tutor " + tutorId, ordered(where, filter));
    }

    /**
     * Sessions {@code studentId} is enrolled in. Unlike the other listings,
     * both date bounds apply to the session start.
     */
    public List<TutoringSession> findByStudent(DatabaseClient client, long studentId, SessionFilter filter) {
        SqlFilter where = common(filter)
                .where("s.id IN (SELECT session_id FROM session_students WHERE student_id = ?)", studentId)
                .compare("s.start_date", ">=", Timestamps.startOfDay(filter.startDate()))
                .compare("s.start_date", "<=", Timestamps.endOfDay(filter.endDate()));
        return load(client, "list sessions of student " + studentId, ordered(where, filter));
    }

    public TutoringSession insert(DatabaseClient client, NewSession session) {
        LocalDateTime now = LocalDateTime.now(clock);
        long id = SqlExecutor.on(client).insert("create session", SqlStatement.of(SqlLoader.load("insert-session"),
                session.title(), session.description(), session.courseId(), session.tutorId(),
                session.startDate(), session.endDate(), session.duration(), session.seats(),
                session.type(), session.level(), session.statusOrDefault(), session.classRoom(), now, now));
        return findById(client, id).orElseThrow(() -> DatabaseException.notFound("session " + id));
    }

    /** @return the session after the update, empty if it does not exist */
    public Optional<TutoringSession> updateStatus(DatabaseClient client, long id, SessionStatus status) {
        SqlStatement stmt = new SqlUpdate("sessions")
                .set("status", status)
                .set("updated_at", LocalDateTime.now(clock))
                .where("id = ?", id);
        int changed = SqlExecutor.on(client).update("update session " + id, stmt);
        return changed == 0 ? Optional.empty() : findById(client, id);
    }

    private static SqlFilter common(SessionFilter filter) {
        return new SqlFilter()
                .eq("s.level", filter.level())
                .eq("s.status", filter.status())
                .contains(filter.search(), "s.title", "c.name");
    }

    private static SqlStatement ordered(SqlFilter where, SessionFilter filter) {
        SqlStatement stmt = where.applyTo(SqlLoader.load("select-sessions"))
                .append(" ORDER BY s.start_date ASC, s.id ASC");
        if (filter.limit() != null && filter.limit() > 0) {
            stmt = stmt.append(" LIMIT ?", filter.limit());
        }
        return stmt;
    }

    private List<TutoringSession> load(DatabaseClient client, String operation, SqlStatement stmt) {
        List<TutoringSession> sessions = SqlExecutor.on(client).query(operation, stmt, SessionStore::map);
        if (sessions.isEmpty()) {
            return sessions;
        }
        List<Long> ids = new ArrayList<>(sessions.size());
        for (TutoringSession session : sessions) {
            ids.add(session.id());
        }
        Map<Long, List<Enrollment>> grouped = EnrollmentStore.bySession(enrollments.findBySessions(client, ids));

        List<TutoringSession> result = new ArrayList<>(sessions.size());
        for (TutoringSession session : sessions) {
            result.add(session.withStudents(grouped.getOrDefault(session.id(), List.of())));
        }
        return result;
    }

    static TutoringSession map(ResultSet rs) throws SQLException {
        return new TutoringSession(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getLong("course_id"),
                rs.getLong("tutor_id"),
                Columns.timestamp(rs, "start_date"),
                Columns.timestamp(rs, "end_date"),
                rs.getInt("duration"),
                rs.getInt("seats"),
                Columns.coded(rs, "type", SessionType::of),
                Columns.coded(rs, "level", SessionLevel::of),
                Columns.coded(rs, "status", SessionStatus::of),
                rs.getString("class_room"),
                Columns.timestamp(rs, "created_at"),
                Columns.timestamp(rs, "updated_at"),
                CourseStore.map(rs, "c_"),
                UserStore.map(rs, "t_"),
                List.of());
    }
}
