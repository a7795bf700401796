package io.visitfile.parser.parse;

import io.visitfile.parser.model.Activity;
import io.visitfile.parser.model.ActivityKind;
import io.visitfile.parser.model.Group;
import io.visitfile.parser.model.Parameter;
import io.visitfile.parser.model.Sequence;
import io.visitfile.parser.model.Visit;
import io.visitfile.parser.tokenize.ClassifiedLine;
import io.visitfile.parser.tokenize.DefaultLineClassifier;
import io.visitfile.parser.tokenize.LineClassifier;
import io.visitfile.parser.tokenize.LineKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Visit} tree from the lines of a visit file.
 *
 * <p>Lines are classified first, then assembled into {@code ;}-terminated statements which drive a
 * single-pass state machine ({@code AWAITING_HEADER -> IN_VISIT -> IN_GROUP -> IN_SEQUENCE -> IN_ACTIVITY}).
 * The parser keeps no state between calls, so one instance can serve concurrent callers.
 */
public class VisitParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(VisitParser.class);

    private final ParserOptions options;
    private final LineClassifier classifier;

    public VisitParser() {
        this(ParserOptions.defaults());
    }

    public VisitParser(ParserOptions options) {
        this(options, new DefaultLineClassifier(options.vocabulary().visitStatementKeywords()));
    }

    VisitParser(ParserOptions options, LineClassifier classifier) {
        this.options = Objects.requireNonNull(options, "options");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Parses one visit file.
     *
     * @param lines decoded lines without line terminators
     * @return the visit and any warnings, in file order
     * @throws VisitParseException on the first fatal problem; no partial document is produced
     */
    public ParseResult parse(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        List<ClassifiedLine> classified = classifier.classify(lines);
        ParseResult result = new ParseRun(options).execute(classified);
        LOGGER.debug("Parsed visit {}: {} groups, {} warnings",
                result.visit().id(), result.visit().groups().size(), result.warnings().size());
        return result;
    }

    /**
     * Mutable state of a single parse invocation.
     */
    private static final class ParseRun {

        private final ParserOptions options;
        private final List<ParseWarning> warnings = new ArrayList<>();

        private ParserState state = ParserState.AWAITING_HEADER;
        private PendingStatement pending;

        private String visitId;
        private List<String> templates = List.of();
        private List<Parameter> visitParameters = List.of();
        private final List<Activity> visitStatements = new ArrayList<>();
        private final List<Group> groups = new ArrayList<>();
        private final Set<Integer> groupIndices = new HashSet<>();
        private int lastGroupIndex = Integer.MIN_VALUE;
        private GroupBuilder currentGroup;
        private SequenceBuilder currentSequence;

        private ParseRun(ParserOptions options) {
            this.options = options;
        }

        private ParseResult execute(List<ClassifiedLine> lines) {
            templates = leadingTemplates(lines);
            for (ClassifiedLine line : lines) {
                switch (line.kind()) {
                    case BLANK, COMMENT -> {
                    }
                    case UNRECOGNIZED -> onUnrecognized(line);
                    case CONTINUATION -> onContinuation(line);
                    case HEADER, VISIT_STATEMENT, GROUP_MARKER, SEQUENCE_MARKER, ACTIVITY_LINE -> onStatementStart(line);
                }
            }
            return finish();
        }

        private void onUnrecognized(ClassifiedLine line) {
            if (state == ParserState.AWAITING_HEADER && pending == null) {
                throw new VisitParseException(ParseErrorKind.MALFORMED_HEADER, line.lineNumber(),
                        "expected VISIT header but found '" + line.text().strip() + "'");
            }
            if (options.strict()) {
                throw new VisitParseException(ParseErrorKind.STRUCTURAL, line.lineNumber(),
                        "unrecognized line '" + line.text().strip() + "'");
            }
            warnings.add(new ParseWarning(WarningKind.UNRECOGNIZED_LINE, line.lineNumber(),
                    "ignoring unrecognized line '" + line.text().strip() + "'"));
        }

        private void onContinuation(ClassifiedLine line) {
            if (pending == null) {
                ParseErrorKind kind = state == ParserState.AWAITING_HEADER
                        ? ParseErrorKind.MALFORMED_HEADER
                        : ParseErrorKind.STRUCTURAL;
                throw new VisitParseException(kind, line.lineNumber(), "continuation line without an open statement");
            }
            pending.append(line);
            completeIfTerminated(line);
        }

        private void onStatementStart(ClassifiedLine line) {
            if (pending != null) {
                ParseErrorKind kind = pending.kind() == LineKind.HEADER
                        ? ParseErrorKind.MALFORMED_HEADER
                        : ParseErrorKind.STRUCTURAL;
                throw new VisitParseException(kind, line.lineNumber(),
                        "statement opened at line " + pending.lineNumber() + " is not terminated with ';'");
            }
            if (state == ParserState.AWAITING_HEADER && line.kind() != LineKind.HEADER) {
                throw new VisitParseException(ParseErrorKind.MALFORMED_HEADER, line.lineNumber(),
                        "expected VISIT header but found " + line.kind());
            }
            pending = new PendingStatement(line);
            completeIfTerminated(line);
        }

        private void completeIfTerminated(ClassifiedLine line) {
            if (!line.terminatesStatement()) {
                return;
            }
            Statement statement = pending.complete();
            pending = null;
            state = transition(state, statement);
        }

        private ParserState transition(ParserState current, Statement statement) {
            LineKind kind = statement.kind();
            return switch (current) {
                case AWAITING_HEADER -> switch (kind) {
                    case HEADER -> openVisit(statement);
                    case VISIT_STATEMENT, GROUP_MARKER, SEQUENCE_MARKER, ACTIVITY_LINE ->
                            throw malformedHeader(statement, "expected VISIT header but found " + statement.keyword());
                    case CONTINUATION, COMMENT, BLANK, UNRECOGNIZED -> throw notAStatement(kind);
                };
                case IN_VISIT -> switch (kind) {
                    case HEADER -> throw duplicateHeader(statement);
                    case VISIT_STATEMENT -> addVisitStatement(statement);
                    case GROUP_MARKER -> openGroup(statement);
                    case SEQUENCE_MARKER -> throw structural(statement, "SEQ statement before any GROUP");
                    case ACTIVITY_LINE -> throw structural(statement,
                            statement.keyword() + " statement before any GROUP");
                    case CONTINUATION, COMMENT, BLANK, UNRECOGNIZED -> throw notAStatement(kind);
                };
                case IN_GROUP -> switch (kind) {
                    case HEADER -> throw duplicateHeader(statement);
                    case VISIT_STATEMENT -> throw isActivityKeyword(statement)
                            ? structural(statement, statement.keyword() + " statement before any SEQ in group "
                                    + currentGroup.index)
                            : misplacedVisitStatement(statement);
                    case GROUP_MARKER -> {
                        closeGroup();
                        yield openGroup(statement);
                    }
                    case SEQUENCE_MARKER -> openSequence(statement);
                    case ACTIVITY_LINE -> throw structural(statement,
                            statement.keyword() + " statement before any SEQ in group " + currentGroup.index);
                    case CONTINUATION, COMMENT, BLANK, UNRECOGNIZED -> throw notAStatement(kind);
                };
                case IN_SEQUENCE, IN_ACTIVITY -> switch (kind) {
                    case HEADER -> throw duplicateHeader(statement);
                    case VISIT_STATEMENT -> {
                        if (!isActivityKeyword(statement)) {
                            throw misplacedVisitStatement(statement);
                        }
                        yield addActivity(statement);
                    }
                    case GROUP_MARKER -> {
                        closeSequence();
                        closeGroup();
                        yield openGroup(statement);
                    }
                    case SEQUENCE_MARKER -> {
                        closeSequence();
                        yield openSequence(statement);
                    }
                    case ACTIVITY_LINE -> addActivity(statement);
                    case CONTINUATION, COMMENT, BLANK, UNRECOGNIZED -> throw notAStatement(kind);
                };
            };
        }

        private ParserState openVisit(Statement statement) {
            String id = statement.positionalArguments().isEmpty()
                    ? ""
                    : statement.positionalArguments().get(0);
            if (id.isEmpty()) {
                throw malformedHeader(statement, "VISIT header has no identifier");
            }
            if (!options.visitIdPattern().matcher(id).matches()) {
                throw malformedHeader(statement,
                        "visit identifier '" + id + "' does not match " + options.visitIdPattern().pattern());
            }
            visitId = id;
            visitParameters = statement.parameters();
            return ParserState.IN_VISIT;
        }

        private ParserState addVisitStatement(Statement statement) {
            ActivityKind kind = options.vocabulary().visitStatementKind(statement.keyword())
                    .orElse(ActivityKind.OTHER);
            visitStatements.add(toActivity(statement, kind, visitStatements.size() + 1));
            return ParserState.IN_VISIT;
        }

        private ParserState openGroup(Statement statement) {
            int index = requireIndex(statement, "GROUP");
            if (!groupIndices.add(index)) {
                throw new VisitParseException(ParseErrorKind.DUPLICATE_INDEX, statement.lineNumber(),
                        "group index " + index + " already used in visit " + visitId);
            }
            if (index < lastGroupIndex) {
                throw structural(statement, "group index " + index + " follows group " + lastGroupIndex);
            }
            lastGroupIndex = index;
            currentGroup = new GroupBuilder(index, statement.parameters(), statement.lineNumber());
            return ParserState.IN_GROUP;
        }

        private ParserState openSequence(Statement statement) {
            int index = requireIndex(statement, "SEQ");
            if (!currentGroup.sequenceIndices.add(index)) {
                throw new VisitParseException(ParseErrorKind.DUPLICATE_INDEX, statement.lineNumber(),
                        "sequence index " + index + " already used in group " + currentGroup.index);
            }
            if (index < currentGroup.lastSequenceIndex) {
                throw structural(statement,
                        "sequence index " + index + " follows sequence " + currentGroup.lastSequenceIndex);
            }
            currentGroup.lastSequenceIndex = index;
            currentSequence = new SequenceBuilder(index, statement.parameters(), statement.lineNumber());
            return ParserState.IN_SEQUENCE;
        }

        private ParserState addActivity(Statement statement) {
            Optional<ActivityKind> known = options.vocabulary().activityKind(statement.keyword());
            if (known.isEmpty()) {
                if (options.strict()) {
                    throw new VisitParseException(ParseErrorKind.UNKNOWN_ACTIVITY_TYPE, statement.lineNumber(),
                            "unknown activity type " + statement.keyword());
                }
                warnings.add(new ParseWarning(WarningKind.UNKNOWN_ACTIVITY_TYPE, statement.lineNumber(),
                        "unknown activity type " + statement.keyword() + " recorded as " + ActivityKind.OTHER));
            }
            ActivityKind kind = known.orElse(ActivityKind.OTHER);
            currentSequence.activities.add(toActivity(statement, kind, currentSequence.activities.size() + 1));
            return ParserState.IN_ACTIVITY;
        }

        private boolean isActivityKeyword(Statement statement) {
            return options.vocabulary().activityKind(statement.keyword()).isPresent();
        }

        private void closeSequence() {
            currentGroup.sequences.add(currentSequence.build());
            currentSequence = null;
        }

        private void closeGroup() {
            groups.add(currentGroup.build());
            currentGroup = null;
        }

        private ParseResult finish() {
            if (pending != null) {
                throw new VisitParseException(ParseErrorKind.INCOMPLETE_DOCUMENT, pending.lineNumber(),
                        pending.keyword() + " statement is not terminated with ';' at end of input");
            }
            switch (state) {
                case AWAITING_HEADER -> throw new VisitParseException(ParseErrorKind.MALFORMED_HEADER, 1,
                        "no VISIT header found");
                case IN_SEQUENCE, IN_ACTIVITY -> {
                    closeSequence();
                    closeGroup();
                }
                case IN_GROUP -> closeGroup();
                case IN_VISIT -> {
                }
            }
            Visit visit = new Visit(visitId, templates, visitParameters, visitStatements, groups);
            return new ParseResult(visit, warnings);
        }

        private int requireIndex(Statement statement, String marker) {
            int index = statement.markerIndex()
                    .orElseThrow(() -> structural(statement, marker + " statement requires a numeric index"));
            if (index < 0) {
                throw structural(statement, marker + " index must not be negative");
            }
            return index;
        }

        private static Activity toActivity(Statement statement, ActivityKind kind, int ordinal) {
            return new Activity(statement.keyword(), statement.positionalArguments(), statement.parameters(), kind,
                    statement.activityNumber(ordinal), statement.scriptName(), statement.lineNumber());
        }

        private static List<String> leadingTemplates(List<ClassifiedLine> lines) {
            if (lines.isEmpty() || lines.get(0).kind() != LineKind.COMMENT) {
                return List.of();
            }
            String text = lines.get(0).text().strip().substring(1).strip();
            return Arrays.stream(text.split(","))
                    .map(String::trim)
                    .filter(template -> !template.isEmpty())
                    .toList();
        }

        private static VisitParseException malformedHeader(Statement statement, String message) {
            return new VisitParseException(ParseErrorKind.MALFORMED_HEADER, statement.lineNumber(), message);
        }

        private static VisitParseException structural(Statement statement, String message) {
            return new VisitParseException(ParseErrorKind.STRUCTURAL, statement.lineNumber(), message);
        }

        private static VisitParseException duplicateHeader(Statement statement) {
            return structural(statement, "duplicate VISIT header");
        }

        private static VisitParseException misplacedVisitStatement(Statement statement) {
            return structural(statement, statement.keyword() + " statement must precede the first GROUP");
        }

        private static IllegalStateException notAStatement(LineKind kind) {
            return new IllegalStateException(kind + " lines never form a statement");
        }
    }

    /**
     * Statement whose terminating {@code ;} has not been seen yet.
     */
    private static final class PendingStatement {

        private final ClassifiedLine opening;
        private final StringBuilder text = new StringBuilder();

        private PendingStatement(ClassifiedLine opening) {
            this.opening = opening;
            text.append(opening.text().strip());
        }

        private void append(ClassifiedLine continuation) {
            text.append(' ').append(continuation.text().strip());
        }

        private int lineNumber() {
            return opening.lineNumber();
        }

        private LineKind kind() {
            return opening.kind();
        }

        private String keyword() {
            String content = opening.text().strip();
            int end = 0;
            while (end < content.length() && (Character.isLetterOrDigit(content.charAt(end)) || content.charAt(end) == '_')) {
                end++;
            }
            return content.substring(0, end);
        }

        private Statement complete() {
            String joined = text.toString();
            int terminator = joined.indexOf(';');
            String body = joined.substring(0, terminator);
            if (!joined.substring(terminator + 1).isBlank()) {
                throw new VisitParseException(ParseErrorKind.STRUCTURAL, opening.lineNumber(),
                        "unexpected text after ';' in " + keyword() + " statement");
            }
            return Statement.parse(opening.lineNumber(), opening.kind(), body);
        }
    }

    private static final class GroupBuilder {

        private final int index;
        private final List<Parameter> parameters;
        private final int lineNumber;
        private final List<Sequence> sequences = new ArrayList<>();
        private final Set<Integer> sequenceIndices = new HashSet<>();
        private int lastSequenceIndex = Integer.MIN_VALUE;

        private GroupBuilder(int index, List<Parameter> parameters, int lineNumber) {
            this.index = index;
            this.parameters = parameters;
            this.lineNumber = lineNumber;
        }

        private Group build() {
            return new Group(index, parameters, sequences, lineNumber);
        }
    }

    private static final class SequenceBuilder {

        private final int index;
        private final List<Parameter> parameters;
        private final int lineNumber;
        private final List<Activity> activities = new ArrayList<>();

        private SequenceBuilder(int index, List<Parameter> parameters, int lineNumber) {
            this.index = index;
            this.parameters = parameters;
            this.lineNumber = lineNumber;
        }

        private Sequence build() {
            return new Sequence(index, parameters, activities, lineNumber);
        }
    }
}
