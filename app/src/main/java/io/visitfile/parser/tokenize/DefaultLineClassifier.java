package io.visitfile.parser.tokenize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Default implementation deciding each line's kind from its leading keyword or marker character.
 *
 * <p>The decision is line-local. Lines that do not start with a recognizable marker are reported as
 * {@link LineKind#UNRECOGNIZED} and left for the parser to handle.
 */
public class DefaultLineClassifier implements LineClassifier {

    public static final String HEADER_KEYWORD = "VISIT";
    public static final String GROUP_KEYWORD = "GROUP";
    public static final String SEQUENCE_KEYWORD = "SEQ";

    private static final String COMMENT_MARKER = "#";
    private static final String CONTINUATION_MARKER = ",";
    private static final String TERMINATOR = ";";
    private static final Pattern KEYWORD = Pattern.compile("^([A-Za-z][A-Za-z0-9_]*)(?=$|[\\s;])");

    private final Set<String> visitStatementKeywords;

    public DefaultLineClassifier(Set<String> visitStatementKeywords) {
        Objects.requireNonNull(visitStatementKeywords, "visitStatementKeywords");
        this.visitStatementKeywords = visitStatementKeywords.stream()
                .map(keyword -> keyword.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public List<ClassifiedLine> classify(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return Collections.emptyList();
        }
        List<ClassifiedLine> classified = new ArrayList<>(lines.size());
        for (int index = 0; index < lines.size(); index++) {
            String text = stripTrailing(lines.get(index));
            classified.add(new ClassifiedLine(index + 1, text, classify(text)));
        }
        return Collections.unmodifiableList(classified);
    }

    LineKind classify(String text) {
        if (text.isBlank()) {
            return LineKind.BLANK;
        }
        String content = text.strip();
        if (content.startsWith(COMMENT_MARKER)) {
            return LineKind.COMMENT;
        }
        if (content.startsWith(CONTINUATION_MARKER) || content.equals(TERMINATOR)) {
            return LineKind.CONTINUATION;
        }
        Matcher matcher = KEYWORD.matcher(content);
        if (!matcher.find()) {
            return LineKind.UNRECOGNIZED;
        }
        String keyword = matcher.group(1).toUpperCase(Locale.ROOT);
        if (keyword.equals(HEADER_KEYWORD)) {
            return LineKind.HEADER;
        }
        if (keyword.equals(GROUP_KEYWORD)) {
            return LineKind.GROUP_MARKER;
        }
        if (keyword.equals(SEQUENCE_KEYWORD)) {
            return LineKind.SEQUENCE_MARKER;
        }
        if (visitStatementKeywords.contains(keyword)) {
            return LineKind.VISIT_STATEMENT;
        }
        return LineKind.ACTIVITY_LINE;
    }

    private static String stripTrailing(String line) {
        return line == null ? "" : line.stripTrailing();
    }
}
