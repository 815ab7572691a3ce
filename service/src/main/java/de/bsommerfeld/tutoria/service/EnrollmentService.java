package de.bsommerfeld.tutoria.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.domain.Enrollment;
import de.bsommerfeld.tutoria.core.domain.EnrollmentStatus;
import de.bsommerfeld.tutoria.db.Database;
import de.bsommerfeld.tutoria.db.DatabaseClient;
import de.bsommerfeld.tutoria.db.store.EnrollmentStore;
import de.bsommerfeld.tutoria.db.store.SessionStore;
import de.bsommerfeld.tutoria.db.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Student enrollment in sessions. The existence checks and the insert run in
 * one unit of work, so no other submission can slip in between them.
 */
@Singleton
public class EnrollmentService {

    private static final Logger LOG = LoggerFactory.getLogger(EnrollmentService.class);

    private final Database database;
    private final EnrollmentStore enrollments;
    private final SessionStore sessions;
    private final UserStore users;

    @Inject
    public EnrollmentService(Database database, EnrollmentStore enrollments, SessionStore sessions,
            UserStore users) {
        this.database = database;
        this.enrollments = enrollments;
        this.sessions = sessions;
        this.users = users;
    }

    /**
     * Enrolls a student. {@code status} defaults to
     * {@link EnrollmentStatus#REQUESTED}; {@code attended} may be null.
     *
     * @return empty if the session or the student does not exist, or the
     *         student is already enrolled
     */
    public Optional<Enrollment> enroll(long sessionId, long studentId, EnrollmentStatus status, Boolean attended) {
        Optional<Enrollment> created = database.call(c -> enrollIn(c, sessionId, studentId, status, attended));
        if (created.isPresent()) {
            LOG.info("Student {} enrolled in session {}", studentId, sessionId);
        } else {
            LOG.debug("Enrollment of student {} in session {} refused", studentId, sessionId);
        }
        return created;
    }

    public Optional<Enrollment> enroll(long sessionId, long studentId) {
        return enroll(sessionId, studentId, null, null);
    }

    private Optional<Enrollment> enrollIn(DatabaseClient c, long sessionId, long studentId,
            EnrollmentStatus status, Boolean attended) {
        if (!sessions.exists(c, sessionId) || !users.exists(c, studentId)) {
            return Optional.empty();
        }
        if (enrollments.find(c, sessionId, studentId).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(enrollments.insert(c, sessionId, studentId, status, attended));
    }

    /**
     * Sets the enrollment status and, when non-null, the attendance flag.
     *
     * @return empty if the student is not enrolled in the session
     */
    public Optional<Enrollment> updateStatus(long sessionId, long studentId, EnrollmentStatus status,
            Boolean attended) {
        Objects.requireNonNull(status, "status");
        return database.call(c -> enrollments.updateStatus(c, sessionId, studentId, status, attended));
    }
}
