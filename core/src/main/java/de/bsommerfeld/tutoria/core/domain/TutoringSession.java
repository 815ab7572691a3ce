package de.bsommerfeld.tutoria.core.domain;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * A scheduled tutoring slot, loaded together with its course, its tutor and
 * its enrollments.
 *
 * @param duration length in minutes
 * @param seats    capacity; enrollments beyond it are not rejected by the
 *                 store
 * @param course   the owning course, {@code null} only if it was deleted
 * @param tutor    the tutor account, {@code null} only if it was deleted
 * @param students enrollments, possibly narrowed to a single student by the
 *                 caller (see {@link #withStudents})
 */
public record TutoringSession(
        long id,
        String title,
        String description,
        long courseId,
        long tutorId,
        LocalDateTime startDate,
        LocalDateTime endDate,
        int duration,
        int seats,
        SessionType type,
        SessionLevel level,
        SessionStatus status,
        String classRoom,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        Course course,
        User tutor,
        List<Enrollment> students) {

    public TutoringSession {
        students = students == null ? List.of() : List.copyOf(students);
    }

    /** Number of enrollments currently attached. */
    public int enrolled() {
        return students.size();
    }

    public Optional<Enrollment> enrollmentOf(long studentId) {
        return students.stream().filter(e -> e.studentId() == studentId).findFirst();
    }

    public TutoringSession withStudents(List<Enrollment> replacement) {
        return new TutoringSession(id, title, description, courseId, tutorId, startDate, endDate,
                duration, seats, type, level, status, classRoom, createdAt, updatedAt,
                course, tutor, replacement);
    }
}
