package de.bsommerfeld.tutoria.core.domain;

public enum UserRole implements Coded {

    ADMIN("admin"),
    USER("user");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    public static UserRole of(String code) {
        return Coded.parse(UserRole.class, code);
    }
}
