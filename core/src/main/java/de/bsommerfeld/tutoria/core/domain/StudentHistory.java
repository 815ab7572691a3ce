package de.bsommerfeld.tutoria.core.domain;

/**
 * Figures over a student's past sessions.
 *
 * @param attendanceRate attended share of past sessions, in percent
 */
public record StudentHistory(
        int attendedSessions,
        double totalHoursAttended,
        double attendanceRate,
        int unattendedSessions) {
}
