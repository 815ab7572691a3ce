package de.bsommerfeld.tutoria.db.store;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.domain.Enrollment;
import de.bsommerfeld.tutoria.core.domain.EnrollmentStatus;
import de.bsommerfeld.tutoria.core.domain.SessionStatus;
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
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/** Table access for {@code session_students}, one row per enrollment. */
@Singleton
public class EnrollmentStore {

    private final Clock clock;

    @Inject
    public EnrollmentStore(Clock clock) {
        this.clock = clock;
    }

    public Optional<Enrollment> find(DatabaseClient client, long sessionId, long studentId) {
        SqlStatement stmt = new SqlFilter()
                .eq("e.session_id", sessionId)
                .eq("e.student_id", studentId)
                .applyTo(SqlLoader.load("select-enrollments"));
        return SqlExecutor.on(client).queryOne("find enrollment", stmt, EnrollmentStore::map);
    }

    /** Enrollments of all {@code sessionIds}, in insertion order. */
    public List<Enrollment> findBySessions(DatabaseClient client, Collection<Long> sessionIds) {
        if (sessionIds.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(sessionIds.size(), "?"));
        SqlStatement stmt = new SqlFilter()
                .where("e.session_id IN (" + placeholders + ")", sessionIds.toArray())
                .applyTo(SqlLoader.load("select-enrollments"))
                .append(" ORDER BY e.id ASC");
        return SqlExecutor.on(client).query("load enrollments", stmt, EnrollmentStore::map);
    }

    /**
     * @throws de.bsommerfeld.tutoria.db.DatabaseException with
     *                                                     {@code CONSTRAINT} if
     *                                                     the pair is already
     *                                                     enrolled or a key is
     *                                                     dangling
     */
    public Enrollment insert(DatabaseClient client, long sessionId, long studentId, EnrollmentStatus status,
            Boolean attended) {
        LocalDateTime now = LocalDateTime.now(clock);
        EnrollmentStatus effective = status == null ? EnrollmentStatus.REQUESTED : status;
        SqlExecutor.on(client).insert("enroll student " + studentId,
                SqlStatement.of(SqlLoader.load("insert-enrollment"), sessionId, studentId, effective, attended,
                        now, now));
        return find(client, sessionId, studentId)
                .orElseThrow(() -> DatabaseException.notFound("enrollment of student " + studentId));
    }

    /**
     * Sets the status and, when non-null, the attendance flag.
     *
     * @return the row after the update, empty if the student is not enrolled
     */
    public Optional<Enrollment> updateStatus(DatabaseClient client, long sessionId, long studentId,
            EnrollmentStatus status, Boolean attended) {
        SqlStatement stmt = new SqlUpdate("session_students")
                .set("status", status)
                .set("attended", attended)
                .set("updated_at", LocalDateTime.now(clock))
                .where("session_id = ? AND student_id = ?", sessionId, studentId);
        int changed = SqlExecutor.on(client).update("update enrollment", stmt);
        return changed == 0 ? Optional.empty() : find(client, sessionId, studentId);
    }

    /** Every enrollment of {@code studentId} joined with its session, ordered by session start. */
    public List<StudentActivity> findActivity(DatabaseClient client, long studentId) {
        return SqlExecutor.on(client).query("load activity of student " + studentId,
                SqlStatement.of(SqlLoader.load("select-student-activity"), studentId),
                rs -> new StudentActivity(
                        rs.getLong("session_id"),
                        Columns.coded(rs, "status", EnrollmentStatus::of),
                        Columns.nullableBoolean(rs, "attended"),
                        Columns.timestamp(rs, "created_at"),
                        Columns.timestamp(rs, "start_date"),
                        rs.getInt("duration"),
                        Columns.coded(rs, "session_status", SessionStatus::of),
                        rs.getString("course_name")));
    }

    /** Groups {@code enrollments} by their session id. */
    static Map<Long, List<Enrollment>> bySession(List<Enrollment> enrollments) {
        return enrollments.stream().collect(Collectors.groupingBy(Enrollment::sessionId));
    }

    static Enrollment map(ResultSet rs) throws SQLException {
        return new Enrollment(
                rs.getLong("id"),
                rs.getLong("session_id"),
                rs.getLong("student_id"),
                Columns.coded(rs, "status", EnrollmentStatus::of),
                Columns.nullableBoolean(rs, "attended"),
                Columns.timestamp(rs, "created_at"),
                Columns.timestamp(rs, "updated_at"));
    }
}
