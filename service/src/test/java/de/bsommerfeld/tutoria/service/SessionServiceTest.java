package de.bsommerfeld.tutoria.service;

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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionServiceTest {

    @TempDir
    Path tempDir;

    private ServiceFixture fixture;
    private SessionService sessions;
    private User tutor;
    private User otherTutor;
    private User student;
    private User classmate;
    private Course course;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture(tempDir);
        fixture.lifecycle.init();
        sessions = fixture.sessions;
        tutor = fixture.users.create(new NewUser("tutor@uni.test", "pw", "Tutor"));
        otherTutor = fixture.users.create(new NewUser("other@uni.test", "pw", "Other"));
        student = fixture.users.create(new NewUser("student@uni.test", "pw", "Student"));
        classmate = fixture.users.create(new NewUser("mate@uni.test", "pw", "Mate"));
        course = fixture.courses.create(new NewCourse("Calculus", "Limits", 1));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void create_shouldStartPendingWithResolvedCourseAndTutor() {
        TutoringSession session = sessions.create(session(tutor, "Limits", 1, SessionLevel.BASIC));

        assertEquals(SessionStatus.PENDING, session.status());
        assertEquals(course, session.course());
        assertEquals(tutor, session.tutor());
        assertTrue(session.students().isEmpty());
    }

    @Test
    void create_unknownTutor_shouldFailAsConstraint() {
        NewSession orphan = new NewSession(course.id(), 4711, SessionType.IN_PERSON, 60, 3, "x", null,
                at(1), at(1).plusHours(1), null, null, "A-1");

        DatabaseException e = assertThrows(DatabaseException.class, () -> sessions.create(orphan));

        assertEquals(ErrorCategory.CONSTRAINT, e.category());
        assertTrue(sessions.findMany(SessionFilter.all()).items().isEmpty());
    }

    @Test
    void findMany_shouldFilterByLevelAndStatus() {
        TutoringSession basic = sessions.create(session(tutor, "Basic", 1, SessionLevel.BASIC));
        sessions.create(session(tutor, "Advanced", 2, SessionLevel.ADVANCED));
        sessions.updateStatus(basic.id(), SessionStatus.CONFIRMED);

        assertEquals(List.of("Basic"), titles(sessions.findMany(
                SessionFilter.builder().level(SessionLevel.BASIC).build()).items()));
        assertEquals(List.of("Advanced"), titles(sessions.findMany(
                SessionFilter.builder().status(SessionStatus.PENDING).build()).items()));
    }

    @Test
    void findManyByTutor_shouldOnlyListOwnSessions() {
        sessions.create(session(tutor, "Mine", 1, null));
        sessions.create(session(otherTutor, "Theirs", 2, null));

        assertEquals(List.of("Mine"), titles(sessions.findManyByTutor(tutor.id(), SessionFilter.all()).items()));
    }

    @Test
    void findManyByStudent_shouldNarrowEnrollmentsToTheStudent() {
        TutoringSession shared = sessions.create(session(tutor, "Shared", 1, null));
        sessions.create(session(tutor, "Unrelated", 2, null));
        fixture.enrollments.enroll(shared.id(), student.id(), EnrollmentStatus.REGISTERED, null);
        fixture.enrollments.enroll(shared.id(), classmate.id());

        List<TutoringSession> found = sessions.findManyByStudent(student.id(), SessionFilter.all()).items();

        assertEquals(List.of("Shared"), titles(found));
        assertEquals(1, found.get(0).students().size());
        assertEquals(student.id(), found.get(0).students().get(0).studentId());
        assertEquals(2, sessions.findOne(shared.id()).orElseThrow().enrolled());
    }

    @Test
    void updateStatus_shouldPersistAndReturnEmptyForUnknownSession() {
        TutoringSession session = sessions.create(session(tutor, "Limits", 1, null));

        sessions.updateStatus(session.id(), SessionStatus.CANCELLED);

        assertEquals(SessionStatus.CANCELLED, sessions.findOne(session.id()).orElseThrow().status());
        assertTrue(sessions.updateStatus(999, SessionStatus.CONFIRMED).isEmpty());
    }

    private NewSession session(User owner, String title, int daysAhead, SessionLevel level) {
        return new NewSession(course.id(), owner.id(), SessionType.ONLINE, 60, 4, title, null,
                at(daysAhead), at(daysAhead).plusHours(1), level, null, null);
    }

    private static LocalDateTime at(int daysAhead) {
        return ServiceFixture.NOW.plusDays(daysAhead);
    }

    private static List<String> titles(List<TutoringSession> list) {
        return list.stream().map(TutoringSession::title).toList();
    }
}
