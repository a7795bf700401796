package io.visitfile.parser.report;

import io.visitfile.parser.model.Violation;
import io.visitfile.parser.model.Visit;
import io.visitfile.parser.parse.ParseWarning;
import io.visitfile.parser.summary.SummaryTable;
import io.visitfile.parser.summary.VisitSummary;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a report layout needs, computed up front so renderers only arrange it.
 */
public record VisitReport(Visit visit,
                          VisitSummary summary,
                          String summaryLine,
                          SummaryTable activityTable,
                          Optional<SummaryTable> instrumentOverview,
                          List<ParseWarning> warnings,
                          List<Violation> violations) {

    public VisitReport {
        Objects.requireNonNull(visit, "visit");
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(summaryLine, "summaryLine");
        Objects.requireNonNull(activityTable, "activityTable");
        instrumentOverview = instrumentOverview == null ? Optional.empty() : instrumentOverview;
        warnings = List.copyOf(warnings == null ? List.of() : warnings);
        violations = List.copyOf(violations == null ? List.of() : violations);
    }

    /**
     * Table written to summary files: the instrument overview when one was requested.
     */
    public SummaryTable primaryTable() {
        return instrumentOverview.orElse(activityTable);
    }
}
