package de.bsommerfeld.tutoria.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.domain.Enrollment;
import de.bsommerfeld.tutoria.core.domain.EnrollmentStatus;
import de.bsommerfeld.tutoria.core.domain.SessionFilter;
import de.bsommerfeld.tutoria.core.domain.SessionStatus;
import de.bsommerfeld.tutoria.core.domain.StudentHistory;
import de.bsommerfeld.tutoria.core.domain.StudentStats;
import de.bsommerfeld.tutoria.core.domain.TutorStats;
import de.bsommerfeld.tutoria.core.domain.TutoringSession;
import de.bsommerfeld.tutoria.core.domain.UpcomingSession;
import de.bsommerfeld.tutoria.db.Database;
import de.bsommerfeld.tutoria.db.store.EnrollmentStore;
import de.bsommerfeld.tutoria.db.store.SessionStore;
import de.bsommerfeld.tutoria.db.store.StudentActivity;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.YearMonth;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Dashboard figures for students and tutors. Each figure set is computed from
 * one unit of work that loads the raw rows; the aggregation runs on the
 * calling thread. "Now" comes from the injected {@link Clock}.
 *
 * <p>
 * Hours are session durations divided by 60. Averages and percentages are
 * rounded to two decimals and are {@code 0} when there is nothing to average.
 */
@Singleton
public class StatsService {

    private final Database database;
    private final EnrollmentStore enrollments;
    private final SessionStore sessions;
    private final Clock clock;

    @Inject
    public StatsService(Database database, EnrollmentStore enrollments, SessionStore sessions, Clock clock) {
        this.database = database;
        this.enrollments = enrollments;
        this.sessions = sessions;
        this.clock = clock;
    }

    public StudentStats studentStats(long studentId) {
        List<StudentActivity> activity = database.call(c -> enrollments.findActivity(c, studentId));
        LocalDateTime now = LocalDateTime.now(clock);
        YearMonth month = YearMonth.from(now);
        LocalDateTime monthStart = month.atDay(1).atStartOfDay();
        LocalDateTime monthEnd = month.atEndOfMonth().atTime(LocalTime.of(23, 59, 59));

        int confirmed = 0;
        int pending = 0;
        int thisMonth = 0;
        UpcomingSession next = null;
        double hoursAttended = 0;
        double hoursRegistered = 0;
        int registeredWithDuration = 0;

        for (StudentActivity a : activity) {
            boolean upcoming = a.sessionStart() != null && !a.sessionStart().isBefore(now);
            if (a.status() == EnrollmentStatus.REGISTERED && upcoming) {
                if (a.sessionStatus() == SessionStatus.CONFIRMED) {
                    confirmed++;
                } else if (a.sessionStatus() == SessionStatus.PENDING) {
                    pending++;
                }
            }
            if (a.enrolledAt() != null && !a.enrolledAt().isBefore(monthStart) && !a.enrolledAt().isAfter(monthEnd)) {
                thisMonth++;
            }
            if (a.sessionStart() != null && a.sessionStart().isAfter(now)
                    && (next == null || a.sessionStart().isBefore(next.startDate()))) {
                next = new UpcomingSession(a.courseName(), a.sessionStart());
            }
            if (a.hasAttended()) {
                hoursAttended += a.hours();
            }
            if (a.status() == EnrollmentStatus.REGISTERED && a.duration() > 0) {
                hoursRegistered += a.hours();
                registeredWithDuration++;
            }
        }
        return new StudentStats(confirmed, pending, thisMonth, next, round(hoursAttended),
                average(hoursRegistered, registeredWithDuration));
    }

    /** Figures over the sessions of {@code studentId} that have already started. */
    public StudentHistory studentHistory(long studentId) {
        List<StudentActivity> activity = database.call(c -> enrollments.findActivity(c, studentId));
        LocalDateTime now = LocalDateTime.now(clock);

        int past = 0;
        int attended = 0;
        int absent = 0;
        double hours = 0;
        for (StudentActivity a : activity) {
            if (a.sessionStart() == null || !a.sessionStart().isBefore(now)) {
                continue;
            }
            past++;
            if (a.hasAttended()) {
                attended++;
                hours += a.hours();
            }
            if (a.status() == EnrollmentStatus.ABSENT) {
                absent++;
            }
        }
        return new StudentHistory(attended, round(hours), percentage(attended, past), absent);
    }

    public TutorStats tutorStats(long tutorId) {
        List<TutoringSession> own = database.call(c -> sessions.findByTutor(c, tutorId, SessionFilter.all()));
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();

        Set<Long> students = new HashSet<>();
        int todaySessions = 0;
        int completed = 0;
        long totalDuration = 0;
        double occupancySum = 0;
        UpcomingSession next = null;

        for (TutoringSession s : own) {
            for (Enrollment e : s.students()) {
                students.add(e.studentId());
            }
            LocalDateTime start = s.startDate();
            if (start != null && start.toLocalDate().equals(today)) {
                todaySessions++;
            }
            if (s.status() == SessionStatus.CONFIRMED || (start != null && start.isBefore(now))) {
                completed++;
            }
            totalDuration += s.duration();
            int seats = s.seats() == 0 ? 1 : s.seats();
            occupancySum += s.enrolled() * 100.0 / seats;
            if (start != null && start.isAfter(now) && (next == null || start.isBefore(next.startDate()))) {
                next = new UpcomingSession(s.title(), start);
            }
        }

        int total = own.size();
        return new TutorStats(
                students.size(),
                todaySessions,
                percentage(completed, total),
                average(totalDuration, total),
                total,
                average(occupancySum, total),
                next);
    }

    private static double percentage(int part, int whole) {
        return whole == 0 ? 0.0 : round(part * 100.0 / whole);
    }

    private static double average(double sum, int count) {
        return count == 0 ? 0.0 : round(sum / count);
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
