package de.bsommerfeld.tutoria.core.domain;

/**
 * Partial course update. {@code null} components are left untouched.
 */
public record CourseUpdate(String name, String description, Integer semester, Boolean active) {

    public boolean isEmpty() {
        return name == null && description == null && semester == null && active == null;
    }
}
