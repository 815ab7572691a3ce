package de.bsommerfeld.tutoria.db.sql;

import de.bsommerfeld.tutoria.core.domain.SessionStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlFilterTest {

    private static final String BASE = "SELECT * FROM sessions s";

    @Test
    void applyTo_withoutConditions_shouldLeaveBaseUntouched() {
        SqlStatement stmt = new SqlFilter().eq("s.status", null).contains("  ", "s.title").applyTo(BASE);

        assertEquals(BASE, stmt.sql());
        assertTrue(stmt.params().isEmpty());
    }

    @Test
    void applyTo_shouldJoinConditionsWithAnd() {
        SqlStatement stmt = new SqlFilter()
                .eq("s.status", SessionStatus.CONFIRMED)
                .compare("s.start_date", ">=", LocalDate.of(2026, 3, 1))
                .applyTo(BASE);

        assertEquals(BASE + " WHERE s.status = ? AND s.start_date >= ?", stmt.sql());
        assertEquals(List.of(SessionStatus.CONFIRMED, LocalDate.of(2026, 3, 1)), stmt.params());
    }

    @Test
    void contains_shouldMatchAnyColumnCaseInsensitively() {
        SqlStatement stmt = new SqlFilter().contains(" Calc ", "s.title", "c.name").applyTo(BASE);

        assertEquals(BASE + " WHERE (LOWER(s.title) LIKE ? ESCAPE '\\' OR LOWER(c.name) LIKE ? ESCAPE '\\')",
                stmt.sql());
        assertEquals(List.of("%calc%", "%calc%"), stmt.params());
    }

    @Test
    void contains_shouldEscapeLikeWildcards() {
        assertEquals("50\\% off\\_now\\\\", SqlFilter.escapeLike("50% off_now\\"));
    }

    @Test
    void append_shouldKeepNullParameters() {
        SqlStatement stmt = SqlStatement.of("INSERT INTO t VALUES (?, ?)", "a", null).append(" LIMIT ?", 5);

        assertEquals(Arrays.asList("a", null, 5), stmt.params());
    }

    @Test
    void sqlUpdate_shouldSkipNullAssignments() {
        SqlStatement stmt = new SqlUpdate("courses")
                .set("name", "Calculus II")
                .set("description", null)
                .set("status", false)
                .where("id = ?", 3L);

        assertEquals("UPDATE courses SET name = ?, status = ? WHERE id = ?", stmt.sql());
        assertEquals(List.of("Calculus II", false, 3L), stmt.params());
    }

    @Test
    void sqlUpdate_withoutAssignments_shouldRefuseToBuild() {
        assertThrows(IllegalStateException.class, () -> new SqlUpdate("courses").set("name", null).where("id = ?", 1));
    }

    @Test
    void timestamps_shouldRoundTripAndAcceptIsoVariants() {
        LocalDateTime value = LocalDateTime.of(2026, 3, 2, 14, 30, 15, 999_000_000);

        assertEquals("2026-03-02 14:30:15", Timestamps.format(value));
        assertEquals(value.withNano(0), Timestamps.parse("2026-03-02T14:30:15.999"));
        assertEquals(LocalDateTime.of(2026, 3, 2, 14, 30), Timestamps.parse("2026-03-02 14:30"));
        assertNull(Timestamps.parse(null));
        assertEquals(LocalDateTime.of(2026, 3, 2, 23, 59, 59), Timestamps.endOfDay(LocalDate.of(2026, 3, 2)));
    }
}
