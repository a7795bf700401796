package io.visitfile.parser.parse;

/**
 * States of the visit parser's state machine.
 */
enum ParserState {
    AWAITING_HEADER,
    IN_VISIT,
    IN_GROUP,
    IN_SEQUENCE,
    IN_ACTIVITY
}
