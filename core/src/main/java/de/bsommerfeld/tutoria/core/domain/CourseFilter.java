package de.bsommerfeld.tutoria.core.domain;

/**
 * Criteria for course listings; {@code search} covers name, description and
 * code.
 */
public record CourseFilter(String search, Integer semester, Boolean active) {

    public static CourseFilter all() {
        return new CourseFilter(null, null, null);
    }
}
