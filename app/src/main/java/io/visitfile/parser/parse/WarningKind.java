package io.visitfile.parser.parse;

/**
 * Recoverable conditions reported alongside a successful parse.
 */
public enum WarningKind {
    UNKNOWN_ACTIVITY_TYPE,
    UNRECOGNIZED_LINE
}
