package io.visitfile.parser.summary;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate statistics computed from a parsed visit.
 */
public record VisitSummary(String visitId,
                           int ditherCount,
                           int groupCount,
                           int observationStatementCount,
                           List<String> modesUsed,
                           int sequenceCount,
                           int activityCount) {

    public VisitSummary {
        Objects.requireNonNull(visitId, "visitId");
        modesUsed = List.copyOf(Objects.requireNonNull(modesUsed, "modesUsed"));
        if (ditherCount < 0 || groupCount < 0 || observationStatementCount < 0 || sequenceCount < 0 || activityCount < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
    }

    public VisitSummary(String visitId, int ditherCount, int groupCount, int observationStatementCount, List<String> modesUsed) {
        this(visitId, ditherCount, groupCount, observationStatementCount, modesUsed, 0, 0);
    }
}
