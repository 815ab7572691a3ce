package de.bsommerfeld.tutoria.core.domain;

/**
 * Criteria for user listings. Every component is optional; {@code search} is
 * matched case-insensitively against email and name.
 */
public record UserFilter(UserRole role, Boolean active, String search) {

    public static UserFilter all() {
        return new UserFilter(null, null, null);
    }
}
