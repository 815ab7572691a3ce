package de.bsommerfeld.tutoria.core.domain;

import java.time.LocalDateTime;

/**
 * Subject a tutoring session belongs to.
 *
 * @param code     optional short catalogue code, unique when present
 * @param semester curriculum semester the course is taught in
 * @param active   inactive courses stay readable but are hidden from catalogues
 */
public record Course(
        long id,
        String code,
        String name,
        String description,
        int semester,
        boolean active,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {
}
