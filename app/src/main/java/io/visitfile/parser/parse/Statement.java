package io.visitfile.parser.parse;

import io.visitfile.parser.model.Activity;
import io.visitfile.parser.model.Parameter;
import io.visitfile.parser.tokenize.LineKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One {@code ;}-terminated statement assembled from its opening line and any continuation lines.
 *
 * <p>Fields are separated by whitespace followed by a comma. The first field is the keyword, the rest are
 * arguments; an argument containing {@code =} is a named parameter.
 */
record Statement(int lineNumber, LineKind kind, String keyword, List<String> arguments) {

    private static final Pattern FIELD_SEPARATOR = Pattern.compile("\\s+,");
    private static final Pattern HEX_NUMBER = Pattern.compile("[0-9A-Fa-f]{1,6}");

    Statement {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(keyword, "keyword");
        arguments = List.copyOf(arguments);
    }

    /**
     * Splits the joined statement text, without its terminating {@code ;}, into keyword and arguments.
     */
    static Statement parse(int lineNumber, LineKind kind, String body) {
        List<String> fields = Arrays.stream(FIELD_SEPARATOR.split(body.strip()))
                .map(String::trim)
                .filter(field -> !field.isEmpty())
                .toList();
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Empty statement at line " + lineNumber);
        }
        String keyword = fields.get(0).toUpperCase(Locale.ROOT);
        return new Statement(lineNumber, kind, keyword, fields.subList(1, fields.size()));
    }

    List<String> positionalArguments() {
        return arguments.stream()
                .filter(argument -> argument.indexOf('=') < 0)
                .toList();
    }

    List<Parameter> parameters() {
        List<Parameter> parameters = new ArrayList<>();
        for (String argument : arguments) {
            int separator = argument.indexOf('=');
            if (separator > 0) {
                parameters.add(new Parameter(argument.substring(0, separator).trim(), argument.substring(separator + 1).trim()));
            }
        }
        return parameters;
    }

    Optional<String> firstArgument() {
        return arguments.isEmpty() ? Optional.empty() : Optional.of(arguments.get(0));
    }

    /**
     * Script name carried as the second argument of {@code ACT}-style statements.
     */
    String scriptName() {
        if (arguments.size() < 2 || arguments.get(1).indexOf('=') >= 0) {
            return Activity.NO_SCRIPT;
        }
        return arguments.get(1);
    }

    /**
     * Leading index of a {@code GROUP} or {@code SEQ} marker.
     */
    Optional<Integer> markerIndex() {
        return firstArgument()
                .map(argument -> argument.split("\\s+")[0])
                .flatMap(Statement::parseDecimal);
    }

    /**
     * Activity number given in hexadecimal as the first argument, falling back to {@code ordinal}.
     * The first argument only counts as a number when a script name follows it.
     */
    int activityNumber(int ordinal) {
        if (Activity.NO_SCRIPT.equals(scriptName())) {
            return ordinal;
        }
        return firstArgument()
                .filter(argument -> HEX_NUMBER.matcher(argument).matches())
                .map(argument -> Integer.parseInt(argument, 16))
                .orElse(ordinal);
    }

    private static Optional<Integer> parseDecimal(String raw) {
        try {
            return Optional.of(Integer.parseInt(raw));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
