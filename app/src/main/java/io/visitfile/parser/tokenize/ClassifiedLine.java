package io.visitfile.parser.tokenize;

import java.util.Objects;

/**
 * A single input line tagged with its classification.
 *
 * @param lineNumber 1-based position in the input
 * @param text line content with trailing whitespace removed
 * @param kind classification of the line
 * @param depth nesting-depth hint derived from the line's marker
 */
public record ClassifiedLine(int lineNumber, String text, LineKind kind, int depth) {

    public ClassifiedLine {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(kind, "kind");
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be 1-based");
        }
    }

    public ClassifiedLine(int lineNumber, String text, LineKind kind) {
        this(lineNumber, text, kind, kind.depth());
    }

    public boolean terminatesStatement() {
        return text.endsWith(";");
    }
}
