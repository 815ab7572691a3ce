package de.bsommerfeld.tutoria.core.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Input for scheduling a session. Course, tutor, type, duration and seats are
 * mandatory; {@code status} defaults to {@link SessionStatus#PENDING}.
 */
public record NewSession(
        long courseId,
        long tutorId,
        SessionType type,
        int duration,
        int seats,
        String title,
        String description,
        LocalDateTime startDate,
        LocalDateTime endDate,
        SessionLevel level,
        SessionStatus status,
        String classRoom) {

    public NewSession {
        Objects.requireNonNull(type, "type");
        if (duration < 0) {
            throw new IllegalArgumentException("duration must not be negative: " + duration);
        }
        if (seats < 0) {
            throw new IllegalArgumentException("seats must not be negative: " + seats);
        }
    }

    public SessionStatus statusOrDefault() {
        return status == null ? SessionStatus.PENDING : status;
    }
}
