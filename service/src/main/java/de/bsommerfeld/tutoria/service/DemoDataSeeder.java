package de.bsommerfeld.tutoria.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.domain.Course;
import de.bsommerfeld.tutoria.core.domain.EnrollmentStatus;
import de.bsommerfeld.tutoria.core.domain.NewCourse;
import de.bsommerfeld.tutoria.core.domain.NewSession;
import de.bsommerfeld.tutoria.core.domain.NewUser;
import de.bsommerfeld.tutoria.core.domain.SessionLevel;
import de.bsommerfeld.tutoria.core.domain.SessionStatus;
import de.bsommerfeld.tutoria.core.domain.SessionType;
import de.bsommerfeld.tutoria.core.domain.TutoringSession;
import de.bsommerfeld.tutoria.core.domain.User;
import de.bsommerfeld.tutoria.core.domain.UserFilter;
import de.bsommerfeld.tutoria.core.domain.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Fills an empty store with a small, plausible dataset for TEST mode: one
 * admin, three tutors, eight students, four courses and sessions spread from
 * two weeks ago to two weeks ahead with mixed enrollments.
 *
 * <p>
 * The random source is seeded, so two runs against the same clock produce the
 * same data. Seeding is skipped when any user already exists.
 *
 * <p>
 * Every demo account uses the password {@value #DEMO_PASSWORD}.
 */
@Singleton
public class DemoDataSeeder {

    private static final Logger LOG = LoggerFactory.getLogger(DemoDataSeeder.class);

    public static final String DEMO_PASSWORD = "tutoria-demo";

    private static final String[][] COURSES = {
            { "MAT-101", "Calculus I", "Limits, derivatives and their applications", "1" },
            { "PHY-110", "Physics I", "Kinematics, dynamics and energy", "1" },
            { "CS-201", "Data Structures", "Lists, trees, graphs and hashing", "3" },
            { "STA-205", "Statistics", "Probability, estimation and hypothesis tests", "4" },
    };

    private static final String[] TUTORS = { "Ana Torres", "Luis Méndez", "Carla Ruiz" };
    private static final String[] STUDENTS = { "Diego Vargas", "Elena Soto", "Felipe Rojas", "Gabriela Núñez",
            "Hugo Paredes", "Irene Castillo", "Jorge Salas", "Karen Molina" };

    private final UserService users;
    private final CourseService courses;
    private final SessionService sessions;
    private final EnrollmentService enrollments;
    private final Clock clock;

    @Inject
    public DemoDataSeeder(UserService users, CourseService courses, SessionService sessions,
            EnrollmentService enrollments, Clock clock) {
        this.users = users;
        this.courses = courses;
        this.sessions = sessions;
        this.enrollments = enrollments;
        this.clock = clock;
    }

    /** @return {@code true} if data was written */
    public boolean seedIfEmpty() {
        if (users.findMany(UserFilter.all()).totalRecords() > 0) {
            LOG.info("Store already contains users, skipping demo data.");
            return false;
        }
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE: seeding in-memory store with demo data   #");
        LOG.warn("#######################################################");

        Random random = new Random(42);
        users.create(new NewUser("admin@tutoria.test", DEMO_PASSWORD, "Admin", null, null, null,
                UserRole.ADMIN, true));

        List<User> tutors = new ArrayList<>();
        for (String name : TUTORS) {
            tutors.add(users.create(new NewUser(email(name), DEMO_PASSWORD, name)));
        }
        List<User> students = new ArrayList<>();
        for (String name : STUDENTS) {
            students.add(users.create(new NewUser(email(name), DEMO_PASSWORD, name)));
        }
        List<Course> created = new ArrayList<>();
        for (String[] c : COURSES) {
            created.add(courses.create(new NewCourse(c[0], c[1], c[2], Integer.parseInt(c[3]), true)));
        }

        LocalDateTime base = LocalDateTime.now(clock).truncatedTo(ChronoUnit.HOURS);
        SessionLevel[] levels = SessionLevel.values();
        int sessionCount = 0;
        int enrollmentCount = 0;
        for (int day = -14; day <= 14; day += 2) {
            Course course = created.get(random.nextInt(created.size()));
            User tutor = tutors.get(random.nextInt(tutors.size()));
            LocalDateTime start = base.plusDays(day).withHour(9 + random.nextInt(8));
            int duration = 60 + 30 * random.nextInt(3);
            SessionType type = random.nextBoolean() ? SessionType.ONLINE : SessionType.IN_PERSON;
            SessionStatus status = day < 0 || random.nextBoolean() ? SessionStatus.CONFIRMED : SessionStatus.PENDING;

            TutoringSession session = sessions.create(new NewSession(course.id(), tutor.id(), type, duration,
                    4 + random.nextInt(5), course.name() + " review", "Guided practice for " + course.name(),
                    start, start.plusMinutes(duration), levels[random.nextInt(levels.length)], status,
                    type == SessionType.IN_PERSON ? "Room " + (100 + random.nextInt(20)) : null));
            sessionCount++;

            int seats = Math.min(session.seats(), 1 + random.nextInt(students.size()));
            for (int i = 0; i < seats; i++) {
                User student = students.get((day + 14 + i) % students.size());
                EnrollmentStatus enrollmentStatus;
                Boolean attended = null;
                if (day < 0) {
                    attended = random.nextInt(4) != 0;
                    enrollmentStatus = attended ? EnrollmentStatus.ATTENDED : EnrollmentStatus.ABSENT;
                } else {
                    enrollmentStatus = random.nextBoolean() ? EnrollmentStatus.REGISTERED : EnrollmentStatus.REQUESTED;
                }
                if (enrollments.enroll(session.id(), student.id(), enrollmentStatus, attended).isPresent()) {
                    enrollmentCount++;
                }
            }
        }
        LOG.info("Seeded {} users, {} courses, {} sessions, {} enrollments.",
                1 + tutors.size() + students.size(), created.size(), sessionCount, enrollmentCount);
        return true;
    }

    private static String email(String name) {
        String local = Normalizer.normalize(name, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replace(' ', '.');
        return local + "@tutoria.test";
    }
}
