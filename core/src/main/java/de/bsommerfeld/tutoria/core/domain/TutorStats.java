package de.bsommerfeld.tutoria.core.domain;

/**
 * Tutor dashboard figures. Percentages and averages are rounded to two
 * decimals.
 *
 * @param totalStudents               distinct students across all of the tutor's sessions
 * @param todaySessions               sessions starting today
 * @param completedSessionsPercentage confirmed or already started sessions, in percent
 * @param averageDurationPerSession   mean duration in minutes
 * @param averageOccupancy            mean of enrolled/seats per session, in percent
 */
public record TutorStats(
        int totalStudents,
        int todaySessions,
        double completedSessionsPercentage,
        double averageDurationPerSession,
        int totalTutoringSessions,
        double averageOccupancy,
        UpcomingSession nextSession) {
}
