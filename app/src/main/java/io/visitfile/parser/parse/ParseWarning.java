package io.visitfile.parser.parse;

import java.util.Objects;

/**
 * Non-fatal finding collected while parsing.
 */
public record ParseWarning(WarningKind kind, int lineNumber, String message) {

    public ParseWarning {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return "line " + lineNumber + ": " + kind + ": " + message;
    }
}
