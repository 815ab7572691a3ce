package de.bsommerfeld.tutoria.core.domain;

import java.time.LocalDateTime;

/**
 * Short reference to the next session on a dashboard.
 *
 * @param label course name for students, session title for tutors
 */
public record UpcomingSession(String label, LocalDateTime startDate) {
}
