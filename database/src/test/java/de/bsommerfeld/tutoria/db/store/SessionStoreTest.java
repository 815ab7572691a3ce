package de.bsommerfeld.tutoria.db.store;

import de.bsommerfeld.tutoria.core.domain.Course;
import de.bsommerfeld.tutoria.core.domain.EnrollmentStatus;
import de.bsommerfeld.tutoria.core.domain.NewCourse;
import de.bsommerfeld.tutoria.core.domain.NewSession;
import de.bsommerfeld.tutoria.core.domain.NewUser;
import de.bsommerfeld.tutoria.core.domain.SessionFilter;
import de.bsommerfeld.tutoria.core.domain.SessionLevel;
import de.bsommerfeld.tutoria.core.domain.SessionStatus;
import de.bsommerfeld.tutoria.core.domain.SessionType;
import de.bsommerfeld.tutoria.core.domain.TutoringSession;
import de.bsommerfeld.tutoria.core.domain.User;
import de.bsommerfeld.tutoria.db.DatabaseException;
import de.bsommerfeld.tutoria.db.ErrorCategory;
import de.bsommerfeld.tutoria.db.SqliteDatabaseClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionStoreTest {

    @TempDir
    Path tempDir;

    private SqliteDatabaseClient client;
    private final EnrollmentStore enrollments = new EnrollmentStore(StoreTestSupport.CLOCK);
    private final SessionStore sessions = new SessionStore(StoreTestSupport.CLOCK, enrollments);
    private final UserStore users = new UserStore(StoreTestSupport.CLOCK);
    private final CourseStore courses = new CourseStore(StoreTestSupport.CLOCK);

    private User tutor;
    private User student;
    private Course calculus;
    private Course physics;

    @BeforeEach
    void setUp() {
        client = StoreTestSupport.connect(tempDir);
        tutor = users.insert(client, new NewUser("tutor@uni.test", "pw", "Tutor"), "h");
        student = users.insert(client, new NewUser("student@uni.test", "pw", "Student"), "h");
        calculus = courses.insert(client, new NewCourse("MAT-101", "Calculus", "Limits", 1, true));
        physics = courses.insert(client, new NewCourse("Physics", "Mechanics", 2));
    }

    @AfterEach
    void tearDown() {
        client.disconnect();
    }

    @Test
    void insert_shouldLoadCourseTutorAndDefaultStatus() {
        TutoringSession session = sessions.insert(client, session(calculus, "Limits", day(3), null));

        assertEquals(SessionStatus.PENDING, session.status());
        assertEquals("Calculus", session.course().name());
        assertEquals("tutor@uni.test", session.tutor().email());
        assertEquals(0, session.enrolled());
    }

    @Test
    void insert_unknownCourse_shouldFailAsConstraint() {
        NewSession orphan = new NewSession(999, tutor.id(), SessionType.ONLINE, 60, 5, "x", null,
                day(1), day(1).plusHours(1), null, null, null);

        DatabaseException e = assertThrows(DatabaseException.class, () -> sessions.insert(client, orphan));

        assertEquals(ErrorCategory.CONSTRAINT, e.category());
    }

    @Test
    void findMany_shouldFilterBySearchOverTitleAndCourseName() {
        sessions.insert(client, session(calculus, "Limits", day(1), null));
        sessions.insert(client, session(physics, "Forces", day(2), null));

        assertEquals(List.of("Limits"), titles(sessions.findMany(client, SessionFilter.builder().search("calc").build())));
        assertEquals(List.of("Forces"), titles(sessions.findMany(client, SessionFilter.builder().search("FOR").build())));
    }

    @Test
    void findMany_shouldApplyDayBoundsLimitAndOrder() {
        sessions.insert(client, session(calculus, "Later", day(5), null));
        sessions.insert(client, session(calculus, "Sooner", day(1), null));
        sessions.insert(client, session(calculus, "Past", day(-3), null));

        SessionFilter fromToday = SessionFilter.builder().startDate(LocalDate.of(2026, 3, 2)).build();
        assertEquals(List.of("Sooner", "Later"), titles(sessions.findMany(client, fromToday)));

        SessionFilter untilTomorrow = SessionFilter.builder().endDate(LocalDate.of(2026, 3, 3)).build();
        assertEquals(List.of("Past", "Sooner"), titles(sessions.findMany(client, untilTomorrow)));

        assertEquals(List.of("Past"), titles(sessions.findMany(client, SessionFilter.builder().limit(1).build())));
    }

    @Test
    void findMany_excludeStudent_shouldHideTheirSessions() {
        TutoringSession joined = sessions.insert(client, session(calculus, "Joined", day(1), null));
        sessions.insert(client, session(calculus, "Open", day(2), null));
        enrollments.insert(client, joined.id(), student.id(), null, null);

        List<TutoringSession> open = sessions.findMany(client,
                SessionFilter.builder().excludeStudentId(student.id()).build());

        assertEquals(List.of("Open"), titles(open));
    }

    @Test
    void findByStudent_shouldBoundStartDateOnBothEnds() {
        TutoringSession early = sessions.insert(client, session(calculus, "Early", day(1), null));
        TutoringSession late = sessions.insert(client, session(calculus, "Late", day(10), null));
        enrollments.insert(client, early.id(), student.id(), EnrollmentStatus.REGISTERED, null);
        enrollments.insert(client, late.id(), student.id(), null, null);

        SessionFilter window = SessionFilter.builder()
                .startDate(LocalDate.of(2026, 3, 1))
                .endDate(LocalDate.of(2026, 3, 5))
                .build();
        List<TutoringSession> found = sessions.findByStudent(client, student.id(), window);

        assertEquals(List.of("Early"), titles(found));
        assertEquals(EnrollmentStatus.REGISTERED, found.get(0).students().get(0).status());
    }

    @Test
    void updateStatus_shouldReturnReloadedSessionOrEmpty() {
        TutoringSession session = sessions.insert(client, session(calculus, "Limits", day(1), null));

        assertEquals(SessionStatus.CONFIRMED,
                sessions.updateStatus(client, session.id(), SessionStatus.CONFIRMED).orElseThrow().status());
        assertTrue(sessions.updateStatus(client, 999, SessionStatus.CANCELLED).isEmpty());
    }

    @Test
    void enrollment_duplicate_shouldFailAsConstraint() {
        TutoringSession session = sessions.insert(client, session(calculus, "Limits", day(1), null));
        enrollments.insert(client, session.id(), student.id(), null, null);

        DatabaseException e = assertThrows(DatabaseException.class,
                () -> enrollments.insert(client, session.id(), student.id(), null, null));

        assertEquals(ErrorCategory.CONSTRAINT, e.category());
    }

    private NewSession session(Course course, String title, LocalDateTime start, SessionStatus status) {
        return new NewSession(course.id(), tutor.id(), SessionType.ONLINE, 60, 4, title, null,
                start, start.plusHours(1), SessionLevel.BASIC, status, null);
    }

    private static LocalDateTime day(int offset) {
        return StoreTestSupport.NOW.plusDays(offset);
    }

    private static List<String> titles(List<TutoringSession> list) {
        return list.stream().map(TutoringSession::title).toList();
    }
}
