package io.visitfile.parser.summary;

import java.util.Locale;

/**
 * How dithers are counted for a visit summary.
 */
public enum DitherCountRule {
    /**
     * Every statement classified as a dither counts once.
     */
    CLASSIFIED,
    /**
     * Dither statements count once per distinct {@code ID} parameter; statements without an id count individually.
     */
    DISTINCT_IDS;

    public static DitherCountRule from(String raw) {
        if (raw == null || raw.isBlank()) {
            return CLASSIFIED;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (DitherCountRule rule : values()) {
            if (rule.name().equals(normalized)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Unsupported dither count rule: " + raw);
    }
}
