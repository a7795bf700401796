package io.visitfile.parser.model;

import java.util.Locale;

/**
 * Classification of an activity derived from its keyword.
 */
public enum ActivityKind {
    DITHER,
    OBSERVATION_STATEMENT,
    CONFIGURATION_CHANGE,
    OTHER;

    public static ActivityKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Activity kind must be provided");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ActivityKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported activity kind: " + raw);
    }
}
