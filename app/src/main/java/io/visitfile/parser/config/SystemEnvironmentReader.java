package io.visitfile.parser.config;

import java.util.Optional;

/**
 * Reads visit parser settings from the process environment.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
