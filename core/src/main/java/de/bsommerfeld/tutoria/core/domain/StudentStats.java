package de.bsommerfeld.tutoria.core.domain;

/**
 * Student dashboard figures. Hours are rounded to two decimals.
 *
 * @param confirmedSessions      upcoming confirmed sessions the student is registered in
 * @param pendingSessions        upcoming pending sessions the student is registered in
 * @param monthSessions          enrollments created in the current month
 * @param nextSession            the next session the student is enrolled in, or {@code null}
 * @param totalHoursAttended     sum of durations of attended sessions
 * @param averageHoursRegistered mean duration of registered sessions
 */
public record StudentStats(
        int confirmedSessions,
        int pendingSessions,
        int monthSessions,
        UpcomingSession nextSession,
        double totalHoursAttended,
        double averageHoursRegistered) {
}
