package de.bsommerfeld.tutoria.core.domain;

import java.time.LocalDateTime;

/**
 * A student's seat in a tutoring session. At most one exists per
 * (session, student) pair.
 *
 * @param attended {@code null} until the tutor records attendance
 */
public record Enrollment(
        long id,
        long sessionId,
        long studentId,
        EnrollmentStatus status,
        Boolean attended,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {
}
