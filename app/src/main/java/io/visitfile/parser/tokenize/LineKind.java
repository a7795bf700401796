package io.visitfile.parser.tokenize;

/**
 * Classification of individual visit file lines.
 *
 * <p>Structural kinds carry the nesting depth their marker implies; the remaining kinds report zero.
 */
public enum LineKind {
    HEADER(0),
    VISIT_STATEMENT(1),
    GROUP_MARKER(1),
    SEQUENCE_MARKER(2),
    ACTIVITY_LINE(3),
    CONTINUATION(0),
    COMMENT(0),
    BLANK(0),
    UNRECOGNIZED(0);

    private final int depth;

    LineKind(int depth) {
        this.depth = depth;
    }

    public int depth() {
        return depth;
    }
}
