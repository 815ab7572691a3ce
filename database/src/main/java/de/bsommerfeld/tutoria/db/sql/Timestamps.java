package de.bsommerfeld.tutoria.db.sql;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Text encoding of date-times in the store: {@code yyyy-MM-dd HH:mm:ss}, the
 * format of SQLite's own date functions. It sorts lexically in time order, so
 * range filters compare strings.
 */
public final class Timestamps {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Timestamps() {
    }

    public static String format(LocalDateTime value) {
        return value == null ? null : value.truncatedTo(ChronoUnit.SECONDS).format(FORMAT);
    }

    public static LocalDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace('T', ' ');
        int fraction = normalized.indexOf('.');
        if (fraction > 0) {
            normalized = normalized.substring(0, fraction);
        }
        if (normalized.length() == 16) {
            normalized = normalized + ":00";
        }
        return LocalDateTime.parse(normalized, FORMAT);
    }

    public static LocalDateTime startOfDay(LocalDate day) {
        return day == null ? null : day.atStartOfDay();
    }

    public static LocalDateTime endOfDay(LocalDate day) {
        return day == null ? null : day.atTime(LocalTime.of(23, 59, 59));
    }
}
