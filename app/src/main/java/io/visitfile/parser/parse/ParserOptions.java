package io.visitfile.parser.parse;

import io.visitfile.parser.model.Visit;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parsing policy handed to {@link VisitParser} for a single parser instance.
 *
 * @param strict fail on unknown activity keywords and unrecognized lines instead of warning
 * @param vocabulary keyword classification table
 * @param visitIdPattern pattern the header's visit identifier must match
 */
public record ParserOptions(boolean strict, ActivityVocabulary vocabulary, Pattern visitIdPattern) {

    public ParserOptions {
        Objects.requireNonNull(vocabulary, "vocabulary");
        visitIdPattern = visitIdPattern == null ? Visit.DEFAULT_ID_PATTERN : visitIdPattern;
    }

    public static ParserOptions defaults() {
        return new ParserOptions(false, ActivityVocabulary.defaults(), Visit.DEFAULT_ID_PATTERN);
    }

    public ParserOptions withStrict(boolean strictMode) {
        return new ParserOptions(strictMode, vocabulary, visitIdPattern);
    }

    public ParserOptions withVocabulary(ActivityVocabulary replacement) {
        return new ParserOptions(strict, replacement, visitIdPattern);
    }
}
