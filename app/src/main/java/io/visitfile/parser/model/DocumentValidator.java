package io.visitfile.parser.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Re-checks the structural invariants of a visit tree, collecting every violation instead of stopping at the
 * first one.
 */
public class DocumentValidator {

    static final String WAVEFRONT_SENSING_MARKER = "WFSC";
    static final String AUX_KEYWORD = "AUX";

    private final Pattern idPattern;
    private final Set<String> knownKeywords;

    public DocumentValidator() {
        this(Visit.DEFAULT_ID_PATTERN, Set.of());
    }

    /**
     * @param idPattern pattern the visit identifier must match
     * @param knownKeywords recognized statement keywords; an empty set skips the vocabulary check
     */
    public DocumentValidator(Pattern idPattern, Set<String> knownKeywords) {
        this.idPattern = Objects.requireNonNull(idPattern, "idPattern");
        this.knownKeywords = Set.copyOf(Objects.requireNonNull(knownKeywords, "knownKeywords"));
    }

    public List<Violation> validate(Visit visit) {
        Objects.requireNonNull(visit, "visit");
        List<Violation> violations = new ArrayList<>();
        if (!idPattern.matcher(visit.id()).matches()) {
            violations.add(new Violation("visit", "identifier '" + visit.id() + "' does not match " + idPattern.pattern()));
        }
        for (Activity statement : visit.statements()) {
            checkKeyword("visit statement at line " + statement.lineNumber(), statement, violations);
        }

        Set<Integer> groupIndices = new HashSet<>();
        int previousGroup = Integer.MIN_VALUE;
        for (Group group : visit.groups()) {
            String groupLocation = "group " + group.index();
            previousGroup = checkIndex(groupLocation, "group", group.index(), previousGroup, groupIndices, violations);

            Set<Integer> sequenceIndices = new HashSet<>();
            int previousSequence = Integer.MIN_VALUE;
            for (Sequence sequence : group.sequences()) {
                String sequenceLocation = groupLocation + " / sequence " + sequence.index();
                previousSequence = checkIndex(sequenceLocation, "sequence", sequence.index(), previousSequence,
                        sequenceIndices, violations);
                for (int position = 0; position < sequence.activities().size(); position++) {
                    checkKeyword(sequenceLocation + " / activity " + (position + 1), sequence.activity(position), violations);
                }
            }
        }

        checkWavefrontSensingAux(visit, violations);
        return List.copyOf(violations);
    }

    private int checkIndex(String location,
                           String scope,
                           int index,
                           int previous,
                           Set<Integer> seen,
                           List<Violation> violations) {
        if (!seen.add(index)) {
            violations.add(new Violation(location, "duplicate " + scope + " index " + index));
        } else if (index < previous) {
            violations.add(new Violation(location, scope + " index " + index + " follows " + previous));
        }
        return Math.max(previous, index);
    }

    private void checkKeyword(String location, Activity activity, List<Violation> violations) {
        if (knownKeywords.isEmpty()) {
            return;
        }
        if (!knownKeywords.contains(activity.keyword().toUpperCase(Locale.ROOT))) {
            violations.add(new Violation(location, "unknown activity type " + activity.keyword()));
        }
    }

    private void checkWavefrontSensingAux(Visit visit, List<Violation> violations) {
        boolean wavefrontSensing = visit.activities().stream()
                .anyMatch(activity -> activity.scriptName().contains(WAVEFRONT_SENSING_MARKER));
        if (!wavefrontSensing) {
            return;
        }
        boolean hasAux = visit.statements().stream()
                .anyMatch(statement -> AUX_KEYWORD.equalsIgnoreCase(statement.keyword()));
        if (!hasAux) {
            violations.add(new Violation("visit", "wavefront sensing visit has no AUX statement"));
        }
    }
}
