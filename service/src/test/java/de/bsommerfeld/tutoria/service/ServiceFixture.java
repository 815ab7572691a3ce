package de.bsommerfeld.tutoria.service;

import de.bsommerfeld.tutoria.core.event.ApplicationEventBus;
import de.bsommerfeld.tutoria.db.ConnectionGuard;
import de.bsommerfeld.tutoria.db.Database;
import de.bsommerfeld.tutoria.db.DatabaseLifecycle;
import de.bsommerfeld.tutoria.db.SqliteDatabaseClient;
import de.bsommerfeld.tutoria.db.loop.PersistentLoop;
import de.bsommerfeld.tutoria.db.store.CourseStore;
import de.bsommerfeld.tutoria.db.store.EnrollmentStore;
import de.bsommerfeld.tutoria.db.store.SessionStore;
import de.bsommerfeld.tutoria.db.store.UserStore;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.Executors;

/**
 * The service graph wired by hand over a SQLite file, with the clock pinned
 * to {@link #NOW} (a Wednesday).
 */
final class ServiceFixture {

    static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 18, 12, 0);

    final Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    final ApplicationEventBus eventBus = new ApplicationEventBus();
    final PersistentLoop loop;
    final SqliteDatabaseClient client;
    final Database database;
    final DatabaseLifecycle lifecycle;

    final UserService users;
    final CourseService courses;
    final SessionService sessions;
    final EnrollmentService enrollments;
    final StatsService stats;
    final HealthService health;

    ServiceFixture(Path dir) {
        loop = new PersistentLoop(Duration.ofSeconds(5), Duration.ofSeconds(2), "test-db",
                Executors.defaultThreadFactory(), eventBus);
        client = new SqliteDatabaseClient("jdbc:sqlite:" + dir.resolve("tutoria.db").toAbsolutePath(), true,
                eventBus);
        database = new Database(loop, new ConnectionGuard(client, eventBus));
        lifecycle = new DatabaseLifecycle(loop, database, client);

        UserStore userStore = new UserStore(clock);
        CourseStore courseStore = new CourseStore(clock);
        EnrollmentStore enrollmentStore = new EnrollmentStore(clock);
        SessionStore sessionStore = new SessionStore(clock, enrollmentStore);

        users = new UserService(database, userStore, new PasswordHasher(1_000));
        courses = new CourseService(database, courseStore);
        sessions = new SessionService(database, sessionStore);
        enrollments = new EnrollmentService(database, enrollmentStore, sessionStore, userStore);
        stats = new StatsService(database, enrollmentStore, sessionStore, clock);
        health = new HealthService(loop, client);
    }

    DemoDataSeeder seeder() {
        return new DemoDataSeeder(users, courses, sessions, enrollments, clock);
    }

    void close() {
        lifecycle.close();
    }
}
