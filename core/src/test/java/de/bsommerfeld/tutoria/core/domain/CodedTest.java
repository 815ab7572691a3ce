package de.bsommerfeld.tutoria.core.domain;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodedTest {

    @Test
    void of_shouldResolveStoredCodes() {
        assertEquals(SessionType.IN_PERSON, SessionType.of("in_person"));
        assertEquals(EnrollmentStatus.REGISTERED, EnrollmentStatus.of("registered"));
        assertEquals(SessionStatus.CANCELLED, SessionStatus.of("cancelled"));
        assertEquals(UserRole.ADMIN, UserRole.of("admin"));
        assertEquals(SessionLevel.ADVANCED, SessionLevel.of("advanced"));
    }

    @Test
    void of_shouldIgnoreCaseAndSurroundingWhitespace() {
        assertEquals(SessionStatus.PENDING, SessionStatus.of(" PENDING "));
    }

    @Test
    void of_shouldListAllowedCodesOnMismatch() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EnrollmentStatus.of("enrolled"));

        assertTrue(e.getMessage().contains("requested"));
        assertTrue(e.getMessage().contains("rejected"));
    }

    @Test
    void of_shouldRejectNull() {
        assertThrows(IllegalArgumentException.class, () -> UserRole.of(null));
    }

    @Test
    void code_shouldBeUniqueWithinEachEnum() {
        for (Class<? extends Coded> type : List.<Class<? extends Coded>>of(UserRole.class, SessionType.class,
                SessionLevel.class, SessionStatus.class, EnrollmentStatus.class)) {
            Coded[] constants = type.getEnumConstants();
            long distinct = Arrays.stream(constants).map(Coded::code).distinct().count();
            assertEquals(constants.length, distinct, type.getSimpleName());
        }
    }
}
