package io.visitfile.parser.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Named {@code NAME=VALUE} argument of a visit file statement.
 */
public record Parameter(String name, String value) {

    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public Optional<Double> numericValue() {
        try {
            return Optional.of(Double.parseDouble(value.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
