package io.visitfile.parser.summary;

import io.visitfile.parser.model.Activity;
import io.visitfile.parser.model.Group;
import io.visitfile.parser.model.Sequence;
import io.visitfile.parser.model.Visit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Activity listing restricted to one instrument's scripts, extended with its exposure parameters.
 */
public class InstrumentOverview {

    public static final List<String> PARAMETER_COLUMNS = List.of(
            "OPMODE", "TARGTYPE", "DITHERID", "PATTERN", "NINTS", "NGROUPS", "PUPIL", "FILTER", "SUBARRAY");
    static final String MISSING_VALUE = "NONE";

    public SummaryTable build(Visit visit, Instrument instrument) {
        Objects.requireNonNull(visit, "visit");
        Objects.requireNonNull(instrument, "instrument");
        List<String> columns = new ArrayList<>(VisitSummarizer.ACTIVITY_COLUMNS);
        columns.addAll(PARAMETER_COLUMNS);

        List<List<String>> rows = new ArrayList<>();
        for (Group group : visit.groups()) {
            for (Sequence sequence : group.sequences()) {
                for (Activity activity : sequence.activities()) {
                    if (!instrument.runs(activity.scriptName())) {
                        continue;
                    }
                    List<String> row = new ArrayList<>(columns.size());
                    row.add(Integer.toString(group.index()));
                    row.add(Integer.toString(sequence.index()));
                    row.add(Integer.toString(activity.activityNumber()));
                    row.add(activity.gsa(group.index(), sequence.index()));
                    row.add(activity.keyword());
                    row.add(activity.scriptName());
                    for (String parameter : PARAMETER_COLUMNS) {
                        row.add(activity.parameter(parameter).orElse(MISSING_VALUE));
                    }
                    rows.add(row);
                }
            }
        }
        return new SummaryTable(visit.id() + " " + instrument.name(), columns, rows);
    }
}
