package io.visitfile.parser.report;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * Writes the fixed-width summary table of a visit to {@code <visitId>_visit_file_summary.txt}.
 */
public class ReportWriter {

    static final String FILE_SUFFIX = "_visit_file_summary.txt";

    private final FixedWidthTableFormatter tableFormatter;

    public ReportWriter() {
        this(new FixedWidthTableFormatter());
    }

    public ReportWriter(FixedWidthTableFormatter tableFormatter) {
        this.tableFormatter = Objects.requireNonNull(tableFormatter, "tableFormatter");
    }

    public Path write(Path outputDirectory, VisitReport report) {
        if (outputDirectory == null || report == null) {
            throw new IllegalArgumentException("outputDirectory and report must be provided");
        }
        Path target = outputDirectory.resolve(report.visit().id() + FILE_SUFFIX);
        List<String> lines = tableFormatter.format(report.primaryTable());
        try {
            Files.createDirectories(outputDirectory);
            Files.write(target, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write visit summary: " + target, ex);
        }
        return target;
    }
}
