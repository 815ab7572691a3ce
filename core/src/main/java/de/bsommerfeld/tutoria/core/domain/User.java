package de.bsommerfeld.tutoria.core.domain;

import java.time.LocalDateTime;

/**
 * Platform account as exposed to callers. The password hash never leaves the
 * database module, so it has no component here.
 *
 * @param id            surrogate key
 * @param email         unique login address
 * @param name          given name
 * @param secondName    optional second given name
 * @param secondSurname optional second surname
 * @param phoneNumber   optional contact number
 * @param role          authorization role
 * @param active        {@code false} once the account is disabled
 * @param createdAt     creation time, local to the server
 * @param updatedAt     last modification time
 */
public record User(
        long id,
        String email,
        String name,
        String secondName,
        String secondSurname,
        String phoneNumber,
        UserRole role,
        boolean active,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {
}
