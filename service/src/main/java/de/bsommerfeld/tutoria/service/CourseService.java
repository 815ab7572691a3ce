package de.bsommerfeld.tutoria.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tutoria.core.domain.Course;
import de.bsommerfeld.tutoria.core.domain.CourseFilter;
import de.bsommerfeld.tutoria.core.domain.CourseUpdate;
import de.bsommerfeld.tutoria.core.domain.Listing;
import de.bsommerfeld.tutoria.core.domain.NewCourse;
import de.bsommerfeld.tutoria.db.Database;
import de.bsommerfeld.tutoria.db.store.CourseStore;

import java.util.Optional;

@Singleton
public class CourseService {

    private final Database database;
    private final CourseStore courses;

    @Inject
    public CourseService(Database database, CourseStore courses) {
        this.database = database;
        this.courses = courses;
    }

    public Listing<Course> findMany(CourseFilter filter) {
        return new Listing<>(database.call(c -> courses.findMany(c, filter)));
    }

    public Optional<Course> findOne(long id) {
        return database.call(c -> courses.findById(c, id));
    }

    public Course create(NewCourse course) {
        return database.call(c -> courses.insert(c, course));
    }

    public Optional<Course> update(long id, CourseUpdate update) {
        return database.call(c -> courses.update(c, id, update));
    }

    public Optional<Course> updateStatus(long id, boolean active) {
        return update(id, new CourseUpdate(null, null, null, active));
    }
}
