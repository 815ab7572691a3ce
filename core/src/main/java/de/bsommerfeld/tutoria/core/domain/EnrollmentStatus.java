package de.bsommerfeld.tutoria.core.domain;

/**
 * State of one student's seat in a session. New enrollments start as {@link #REQUESTED}.
 */
public enum EnrollmentStatus implements Coded {

    REQUESTED("requested"),
    REGISTERED("registered"),
    ABSENT("absent"),
    ATTENDED("attended"),
    REJECTED("rejected");

    private final String code;

    EnrollmentStatus(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    public static EnrollmentStatus of(String code) {
        return Coded.parse(EnrollmentStatus.class, code);
    }
}
