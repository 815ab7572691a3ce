package de.bsommerfeld.tutoria.core.domain;

/**
 * Lifecycle of a tutoring session as decided by its tutor.
 */
public enum SessionStatus implements Coded {

    PENDING("pending"),
    CONFIRMED("confirmed"),
    CANCELLED("cancelled");

    private final String code;

    SessionStatus(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    public static SessionStatus of(String code) {
        return Coded.parse(SessionStatus.class, code);
    }
}
