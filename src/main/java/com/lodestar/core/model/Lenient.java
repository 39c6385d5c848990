package com.lodestar.core.model;

import java.util.Locale;

/**
 * Forgiving enum parsing for values that arrive from generated JSON
 * ("blocking", "Non-Functional", "no go").
 */
final class Lenient {

    private Lenient() {}

    static <E extends Enum<E>> E parse(Class<E> type, String raw, E fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        return fallback;
    }
}
