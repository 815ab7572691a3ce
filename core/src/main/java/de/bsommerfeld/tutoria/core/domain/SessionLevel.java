package de.bsommerfeld.tutoria.core.domain;

public enum SessionLevel implements Coded {

    BASIC("basic"),
    MEDIUM("medium"),
    ADVANCED("advanced");

    private final String code;

    SessionLevel(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    public static SessionLevel of(String code) {
        return Coded.parse(SessionLevel.class, code);
    }
}
