package io.visitfile.parser.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Leaf statement of a visit: either a visit-level statement or an activity inside a sequence.
 */
public record Activity(String keyword,
                       List<String> positionalArguments,
                       List<Parameter> parameters,
                       ActivityKind kind,
                       int activityNumber,
                       String scriptName,
                       int lineNumber) {

    public static final String NO_SCRIPT = "NONE";
    static final String CONFIG_PARAMETER = "CONFIG";

    public Activity {
        keyword = requireNonBlank(keyword, "keyword");
        positionalArguments = List.copyOf(Objects.requireNonNull(positionalArguments, "positionalArguments"));
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
        Objects.requireNonNull(kind, "kind");
        scriptName = scriptName == null || scriptName.isBlank() ? NO_SCRIPT : scriptName;
        if (activityNumber < 0) {
            throw new IllegalArgumentException("activityNumber must not be negative");
        }
    }

    /**
     * Returns the value of the first parameter with the given name.
     */
    public Optional<String> parameter(String name) {
        for (Parameter parameter : parameters) {
            if (parameter.name().equals(name)) {
                return Optional.of(parameter.value());
            }
        }
        return Optional.empty();
    }

    public boolean isDither() {
        return kind == ActivityKind.DITHER;
    }

    public boolean isObservationStatement() {
        return kind == ActivityKind.OBSERVATION_STATEMENT;
    }

    public boolean isConfigurationChange() {
        return kind == ActivityKind.CONFIGURATION_CHANGE;
    }

    /**
     * Instrument configuration referenced by this statement: the {@code CONFIG} parameter when present,
     * otherwise the first positional argument.
     */
    public Optional<String> configurationValue() {
        Optional<String> configured = parameter(CONFIG_PARAMETER);
        if (configured.isPresent()) {
            return configured;
        }
        return positionalArguments.isEmpty() ? Optional.empty() : Optional.of(positionalArguments.get(0));
    }

    public boolean hasScript() {
        return !NO_SCRIPT.equals(scriptName);
    }

    /**
     * Group/sequence/activity code, e.g. {@code 01101}.
     */
    public String gsa(int groupIndex, int sequenceIndex) {
        return String.format(Locale.ROOT, "%02d%1d%02d", groupIndex, sequenceIndex, activityNumber);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
