package de.bsommerfeld.tutoria.core.domain;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Enum constant with a stable lowercase code. The code is what gets stored in
 * the database and what external callers send, so it must never change once
 * released.
 */
public interface Coded {

    String code();

    /**
     * Resolves the constant of {@code type} whose code equals {@code code}
     * (case-insensitive).
     *
     * @throws IllegalArgumentException listing the allowed codes if nothing
     *                                  matches
     */
    static <E extends Enum<E> & Coded> E parse(Class<E> type, String code) {
        if (code != null) {
            for (E constant : type.getEnumConstants()) {
                if (constant.code().equalsIgnoreCase(code.trim())) {
                    return constant;
                }
            }
        }
        String allowed = Arrays.stream(type.getEnumConstants())
                .map(Coded::code)
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
                "Invalid " + type.getSimpleName() + " '" + code + "', allowed: " + allowed);
    }
}
