package de.bsommerfeld.tutoria.core.domain;

/**
 * Partial account update. {@code null} components are left untouched.
 */
public record UserUpdate(
        String email,
        String password,
        String name,
        String phoneNumber,
        UserRole role) {

    public boolean isEmpty() {
        return email == null && password == null && name == null && phoneNumber == null && role == null;
    }
}
