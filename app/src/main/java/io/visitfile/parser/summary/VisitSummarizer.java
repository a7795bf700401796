package io.visitfile.parser.summary;

import io.visitfile.parser.model.Activity;
import io.visitfile.parser.model.Group;
import io.visitfile.parser.model.Sequence;
import io.visitfile.parser.model.Visit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes visit statistics and the per-activity listing. Reads the visit only.
 */
public class VisitSummarizer {

    public static final List<String> ACTIVITY_COLUMNS = List.of("GROUP_ID", "SEQ_ID", "ACT_ID", "GSA", "TYPE", "SCRIPT");
    static final String DITHER_ID_PARAMETER = "ID";

    private final DitherCountRule ditherCountRule;

    public VisitSummarizer() {
        this(DitherCountRule.CLASSIFIED);
    }

    public VisitSummarizer(DitherCountRule ditherCountRule) {
        this.ditherCountRule = Objects.requireNonNull(ditherCountRule, "ditherCountRule");
    }

    public VisitSummary summarize(Visit visit) {
        Objects.requireNonNull(visit, "visit");
        List<Activity> activities = visit.activities();
        int observationStatements = (int) activities.stream()
                .filter(Activity::isObservationStatement)
                .count();
        Set<String> modes = new LinkedHashSet<>();
        for (Activity activity : activities) {
            if (activity.isConfigurationChange()) {
                activity.configurationValue().ifPresent(modes::add);
            }
        }
        int sequences = visit.groups().stream()
                .mapToInt(group -> group.sequences().size())
                .sum();
        return new VisitSummary(visit.id(), countDithers(visit), visit.groups().size(), observationStatements,
                new ArrayList<>(modes), sequences, activities.size());
    }

    /**
     * Renders {@code Visit <id>: <d> dithers, <g> groups, <o> observation statements. Uses ['<mode>', ...]}.
     */
    public String renderOneLine(VisitSummary summary) {
        Objects.requireNonNull(summary, "summary");
        String modes = summary.modesUsed().stream()
                .map(mode -> "'" + mode + "'")
                .collect(Collectors.joining(", ", "[", "]"));
        return "Visit " + summary.visitId() + ": "
                + summary.ditherCount() + " dithers, "
                + summary.groupCount() + " groups, "
                + summary.observationStatementCount() + " observation statements. Uses " + modes;
    }

    /**
     * One row per sequence activity in tree order.
     */
    public SummaryTable activityTable(Visit visit) {
        Objects.requireNonNull(visit, "visit");
        List<List<String>> rows = new ArrayList<>();
        for (Group group : visit.groups()) {
            for (Sequence sequence : group.sequences()) {
                for (Activity activity : sequence.activities()) {
                    rows.add(List.of(
                            Integer.toString(group.index()),
                            Integer.toString(sequence.index()),
                            Integer.toString(activity.activityNumber()),
                            activity.gsa(group.index(), sequence.index()),
                            activity.keyword(),
                            activity.scriptName()));
                }
            }
        }
        return new SummaryTable(visit.id(), ACTIVITY_COLUMNS, rows);
    }

    private int countDithers(Visit visit) {
        List<Activity> dithers = visit.allStatements().stream()
                .filter(Activity::isDither)
                .toList();
        return switch (ditherCountRule) {
            case CLASSIFIED -> dithers.size();
            case DISTINCT_IDS -> countDistinctIds(dithers);
        };
    }

    private static int countDistinctIds(List<Activity> dithers) {
        Set<String> ids = new HashSet<>();
        int withoutId = 0;
        for (Activity dither : dithers) {
            String id = dither.parameter(DITHER_ID_PARAMETER).orElse(null);
            if (id == null) {
                withoutId++;
            } else {
                ids.add(id);
            }
        }
        return ids.size() + withoutId;
    }
}
