package io.visitfile.parser.cli;

import io.visitfile.parser.model.DocumentValidator;
import io.visitfile.parser.model.Violation;
import io.visitfile.parser.model.Visit;
import io.visitfile.parser.parse.ParseResult;
import io.visitfile.parser.parse.VisitParser;
import io.visitfile.parser.report.VisitReport;
import io.visitfile.parser.summary.Instrument;
import io.visitfile.parser.summary.InstrumentOverview;
import io.visitfile.parser.summary.SummaryTable;
import io.visitfile.parser.summary.VisitSummarizer;
import io.visitfile.parser.summary.VisitSummary;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one visit file and runs it through parsing, validation and summarization.
 */
public class VisitFileProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(VisitFileProcessor.class);

    private final VisitParser parser;
    private final VisitSummarizer summarizer;
    private final DocumentValidator validator;
    private final InstrumentOverview instrumentOverview;
    private final Optional<Instrument> instrument;

    public VisitFileProcessor(VisitParser parser,
                              VisitSummarizer summarizer,
                              DocumentValidator validator,
                              Optional<Instrument> instrument) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.instrument = instrument == null ? Optional.empty() : instrument;
        this.instrumentOverview = new InstrumentOverview();
    }

    /**
     * @throws UncheckedIOException when the file cannot be read
     * @throws io.visitfile.parser.parse.VisitParseException when the file is not a valid visit file
     */
    public VisitReport process(Path visitFile) {
        Objects.requireNonNull(visitFile, "visitFile");
        return process(read(visitFile));
    }

    public VisitReport process(List<String> lines) {
        ParseResult result = parser.parse(lines);
        Visit visit = result.visit();
        if (result.hasWarnings()) {
            LOGGER.warn("Visit {} parsed with {} warning(s)", visit.id(), result.warnings().size());
            result.warnings().forEach(warning -> LOGGER.warn("{}", warning));
        }

        List<Violation> violations = validator.validate(visit);
        violations.forEach(violation -> LOGGER.warn("Invariant violation in {}: {}", visit.id(), violation));

        VisitSummary summary = summarizer.summarize(visit);
        SummaryTable activityTable = summarizer.activityTable(visit);
        Optional<SummaryTable> overview = instrument.map(selected -> instrumentOverview.build(visit, selected));
        return new VisitReport(visit, summary, summarizer.renderOneLine(summary), activityTable, overview,
                result.warnings(), violations);
    }

    private List<String> read(Path visitFile) {
        try {
            return Files.readAllLines(visitFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read visit file: " + visitFile, ex);
        }
    }
}
