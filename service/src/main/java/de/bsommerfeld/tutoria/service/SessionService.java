package de.bsommerfeld.tutoria.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.domain.Enrollment;
import de.bsommerfeld.tutoria.core.domain.Listing;
import de.bsommerfeld.tutoria.core.domain.NewSession;
import de.bsommerfeld.tutoria.core.domain.SessionFilter;
import de.bsommerfeld.tutoria.core.domain.SessionStatus;
import de.bsommerfeld.tutoria.core.domain.TutoringSession;
import de.bsommerfeld.tutoria.db.Database;
import de.bsommerfeld.tutoria.db.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Scheduling and listing of tutoring sessions. Every returned session carries
 * its course, tutor and enrollments.
 */
@Singleton
public class SessionService {

    private static final Logger LOG = LoggerFactory.getLogger(SessionService.class);

    private final Database database;
    private final SessionStore sessions;

    @Inject
    public SessionService(Database database, SessionStore sessions) {
        this.database = database;
        this.sessions = sessions;
    }

    public Optional<TutoringSession> findOne(long id) {
        return database.call(c -> sessions.findById(c, id));
    }

    public Listing<TutoringSession> findMany(SessionFilter filter) {
        return new Listing<>(database.call(c -> sessions.findMany(c, filter)));
    }

    public Listing<TutoringSession> findManyByTutor(long tutorId, SessionFilter filter) {
        return new Listing<>(database.call(c -> sessions.findByTutor(c, tutorId, filter)));
    }

    /**
     * Sessions the student is enrolled in. Each session's enrollment list is
     * narrowed to the student's own enrollment.
     */
    public Listing<TutoringSession> findManyByStudent(long studentId, SessionFilter filter) {
        List<TutoringSession> found = database.call(c -> sessions.findByStudent(c, studentId, filter));
        return new Listing<>(found.stream()
                .map(s -> s.withStudents(s.enrollmentOf(studentId).map(e -> List.of(e)).orElse(List.<Enrollment>of())))
                .collect(Collectors.toList()));
    }

    /**
     * @throws de.bsommerfeld.tutoria.db.DatabaseException with
     *                                                     {@code CONSTRAINT}
     *                                                     if the course or tutor
     *                                                     does not exist
     */
    public TutoringSession create(NewSession session) {
        TutoringSession created = database.call(c -> sessions.insert(c, session));
        LOG.info("Scheduled session {} for course {} ({})", created.id(), created.courseId(),
                created.status().code());
        return created;
    }

    public Optional<TutoringSession> updateStatus(long id, SessionStatus status) {
        return database.call(c -> sessions.updateStatus(c, id, status));
    }
}
