package io.visitfile.parser.report;

import io.visitfile.parser.model.Activity;
import io.visitfile.parser.model.Group;
import io.visitfile.parser.model.Sequence;
import io.visitfile.parser.model.Violation;
import io.visitfile.parser.parse.ParseWarning;
import java.util.Objects;

/**
 * Renders a {@link VisitReport} as a human-readable text block.
 */
public class TextReportRenderer {

    private final ActivityDescriber describer;
    private final FixedWidthTableFormatter tableFormatter;

    public TextReportRenderer() {
        this(new ActivityDescriber(), new FixedWidthTableFormatter());
    }

    public TextReportRenderer(ActivityDescriber describer, FixedWidthTableFormatter tableFormatter) {
        this.describer = Objects.requireNonNull(describer, "describer");
        this.tableFormatter = Objects.requireNonNull(tableFormatter, "tableFormatter");
    }

    public String render(VisitReport report) {
        Objects.requireNonNull(report, "report");
        String newline = System.lineSeparator();
        StringBuilder builder = new StringBuilder();
        builder.append(report.summaryLine()).append(newline);
        if (!report.visit().templates().isEmpty()) {
            builder.append("Templates: ").append(String.join(", ", report.visit().templates())).append(newline);
        }

        if (!report.visit().statements().isEmpty()) {
            builder.append(newline).append("Visit statements:").append(newline);
            for (Activity statement : report.visit().statements()) {
                builder.append("  ").append(statement.keyword());
                statement.parameters().forEach(parameter ->
                        builder.append(' ').append(parameter.name()).append('=').append(parameter.value()));
                builder.append(newline);
            }
        }

        builder.append(newline).append("Activities:").append(newline);
        if (report.visit().activities().isEmpty()) {
            builder.append("  (none)").append(newline);
        }
        for (Group group : report.visit().groups()) {
            for (Sequence sequence : group.sequences()) {
                for (Activity activity : sequence.activities()) {
                    builder.append("  ")
                            .append(activity.gsa(group.index(), sequence.index()))
                            .append("  ")
                            .append(activity.keyword())
                            .append("  ")
                            .append(describer.describe(activity))
                            .append(newline);
                }
            }
        }

        builder.append(newline);
        for (String line : tableFormatter.format(report.primaryTable())) {
            builder.append(line).append(newline);
        }

        if (!report.warnings().isEmpty()) {
            builder.append(newline).append("Warnings:").append(newline);
            for (ParseWarning warning : report.warnings()) {
                builder.append("  - ").append(warning).append(newline);
            }
        }
        if (!report.violations().isEmpty()) {
            builder.append(newline).append("Violations:").append(newline);
            for (Violation violation : report.violations()) {
                builder.append("  - ").append(violation).append(newline);
            }
        }
        return builder.toString();
    }
}
