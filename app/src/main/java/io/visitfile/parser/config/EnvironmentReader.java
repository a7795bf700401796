package io.visitfile.parser.config;

import java.util.Optional;

/**
 * Source of environment values consulted when a CLI option is omitted.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Reads a non-blank value with surrounding whitespace removed.
     */
    default Optional<String> getTrimmed(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
