package io.visitfile.parser.parse;

import io.visitfile.parser.model.Visit;
import java.util.List;
import java.util.Objects;

/**
 * Successfully parsed visit together with the warnings collected in file order.
 */
public record ParseResult(Visit visit, List<ParseWarning> warnings) {

    public ParseResult {
        Objects.requireNonNull(visit, "visit");
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
