package com.narrativeplatform.common.model;

import com.narrativeplatform.common.exception.InputRangeException;

import java.util.Locale;
import java.util.function.Function;

/**
 * Lenient label matching shared by the model enums. Case, spaces, hyphens and
 * underscores are ignored, so {@code "Short-term"}, {@code "short_term"} and
 * {@code "SHORT TERM"} all resolve to the same constant.
 */
final class Labels {

    private Labels() {}

    static String normalize(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]+", "");
    }

    static <E extends Enum<E>> E parse(Class<E> type, String raw, Function<E, String[]> accepted) {
        if (raw == null || raw.isBlank()) {
            throw new InputRangeException(type.getSimpleName(), "missing value");
        }
        String key = normalize(raw);
        for (E constant : type.getEnumConstants()) {
            for (String candidate : accepted.apply(constant)) {
                if (normalize(candidate).equals(key)) {
                    return constant;
                }
            }
        }
        throw new InputRangeException(type.getSimpleName(), "unrecognized value '" + raw + "'");
    }
}
