package de.bsommerfeld.tutoria.core.domain;

/**
 * Delivery mode of a tutoring session.
 */
public enum SessionType implements Coded {

    ONLINE("online"),
    IN_PERSON("in_person");

    private final String code;

    SessionType(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    public static SessionType of(String code) {
        return Coded.parse(SessionType.class, code);
    }
}
