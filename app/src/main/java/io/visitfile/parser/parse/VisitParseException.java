package io.visitfile.parser.parse;

import java.util.Objects;

/**
 * Runtime exception aborting the parse of a visit file. No partially built document accompanies it.
 */
public class VisitParseException extends RuntimeException {

    private final ParseErrorKind kind;
    private final int lineNumber;
    private final String detail;

    public VisitParseException(ParseErrorKind kind, int lineNumber, String detail) {
        super("line " + lineNumber + ": " + kind + ": " + detail);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.lineNumber = lineNumber;
        this.detail = Objects.requireNonNull(detail, "detail");
    }

    public ParseErrorKind kind() {
        return kind;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String detail() {
        return detail;
    }
}
