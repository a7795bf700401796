package io.visitfile.parser.summary;

import java.util.List;
import java.util.Locale;

/**
 * Science instruments and the script name prefixes selecting their activities.
 */
public enum Instrument {
    NIRISS(List.of("NIS", "NRC")),
    NIRCAM(List.of("NRC")),
    NIRSPEC(List.of("NRS")),
    MIRI(List.of("MIR")),
    FGS(List.of("FGS"));

    private final List<String> scriptPrefixes;

    Instrument(List<String> scriptPrefixes) {
        this.scriptPrefixes = scriptPrefixes;
    }

    public boolean runs(String scriptName) {
        return scriptName != null && scriptPrefixes.stream().anyMatch(scriptName::startsWith);
    }

    public static Instrument from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Instrument must be provided");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Instrument instrument : values()) {
            if (instrument.name().equals(normalized)) {
                return instrument;
            }
        }
        throw new IllegalArgumentException("Unsupported instrument: " + raw);
    }
}
