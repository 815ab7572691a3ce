package de.bsommerfeld.tutoria.core.domain;

import java.util.Objects;

public record NewCourse(String code, String name, String description, int semester, boolean active) {

    public NewCourse {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
    }

    public NewCourse(String name, String description, int semester) {
        this(null, name, description, semester, true);
    }
}
