package io.visitfile.parser.parse;

/**
 * Fatal parse failures.
 */
public enum ParseErrorKind {
    MALFORMED_HEADER,
    STRUCTURAL,
    UNKNOWN_ACTIVITY_TYPE,
    DUPLICATE_INDEX,
    INCOMPLETE_DOCUMENT
}
