package de.bsommerfeld.tutoria.db.store;

import de.bsommerfeld.tutoria.core.domain.EnrollmentStatus;
import de.bsommerfeld.tutoria.core.domain.SessionStatus;

import java.time.LocalDateTime;

/**
 * One enrollment of a student flattened together with the session facts the
 * dashboards aggregate over.
 *
 * @param enrolledAt    when the enrollment row was created
 * @param duration      session length in minutes
 * @param courseName    {@code null} if the course row is gone
 */
public record StudentActivity(
        long sessionId,
        EnrollmentStatus status,
        Boolean attended,
        LocalDateTime enrolledAt,
        LocalDateTime sessionStart,
        int duration,
        SessionStatus sessionStatus,
        String courseName) {

    public boolean hasAttended() {
        return Boolean.TRUE.equals(attended);
    }

    public double hours() {
        return duration / 60.0;
    }
}
