package de.bsommerfeld.tutoria.core.domain;

import java.util.Objects;

/**
 * Input for account creation. {@code password} is plain text and is hashed
 * before it reaches the store. Nullable optionals fall back to the column
 * defaults ({@code user} role, active).
 */
public record NewUser(
        String email,
        String password,
        String name,
        String secondName,
        String secondSurname,
        String phoneNumber,
        UserRole role,
        Boolean active) {

    public NewUser {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(name, "name");
    }

    public NewUser(String email, String password, String name) {
        this(email, password, name, null, null, null, null, null);
    }

    public UserRole roleOrDefault() {
        return role == null ? UserRole.USER : role;
    }

    public boolean activeOrDefault() {
        return active == null || active;
    }
}
