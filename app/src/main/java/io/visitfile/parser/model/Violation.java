package io.visitfile.parser.model;

import java.util.Objects;

/**
 * Invariant violation found by {@link DocumentValidator}.
 *
 * @param location human-readable path to the offending node, e.g. {@code group 2 / sequence 1}
 */
public record Violation(String location, String message) {

    public Violation {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return location + ": " + message;
    }
}
