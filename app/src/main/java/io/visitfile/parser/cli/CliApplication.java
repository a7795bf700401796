package io.visitfile.parser.cli;

import io.visitfile.parser.config.Config;
import io.visitfile.parser.config.ConfigLoader;
import io.visitfile.parser.config.SystemEnvironmentReader;
import io.visitfile.parser.logging.LoggingConfigurator;
import io.visitfile.parser.model.DocumentValidator;
import io.visitfile.parser.parse.ActivityVocabulary;
import io.visitfile.parser.parse.ParserOptions;
import io.visitfile.parser.parse.VisitParseException;
import io.visitfile.parser.parse.VisitParser;
import io.visitfile.parser.report.ReportWriter;
import io.visitfile.parser.report.TextReportRenderer;
import io.visitfile.parser.report.VisitReport;
import io.visitfile.parser.summary.VisitSummarizer;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and visit file pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        VisitFileProcessor processor;
        try {
            config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat());
            processor = createProcessor(config);
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            err.println(ex.getMessage());
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LOGGER.info("Parsing {} visit file(s) (strict={}, ditherRule={})",
                config.visitFiles().size(), config.strict(), config.ditherCountRule());

        TextReportRenderer renderer = new TextReportRenderer();
        ReportWriter reportWriter = new ReportWriter();
        int failures = 0;
        for (Path visitFile : config.visitFiles()) {
            MDC.put(LoggingConfigurator.VISIT_FILE_KEY, visitFile.toString());
            try {
                VisitReport report = processor.process(visitFile);
                out.print(renderer.render(report));
                config.outputDirectory().ifPresent(directory -> {
                    Path written = reportWriter.write(directory, report);
                    LOGGER.info("Wrote summary table to {}", written);
                });
            } catch (VisitParseException ex) {
                failures++;
                err.println(visitFile + ":" + ex.lineNumber() + ": " + ex.kind() + ": " + ex.detail());
            } catch (UncheckedIOException ex) {
                failures++;
                err.println(visitFile + ": " + ex.getMessage());
            } finally {
                MDC.remove(LoggingConfigurator.VISIT_FILE_KEY);
            }
        }
        out.flush();
        err.flush();
        if (failures > 0) {
            LOGGER.warn("{} of {} visit file(s) failed to parse", failures, config.visitFiles().size());
            return EXIT_PARSE_FAILURE;
        }
        return EXIT_OK;
    }

    private VisitFileProcessor createProcessor(Config config) {
        ActivityVocabulary vocabulary = config.vocabularyFile()
                .map(ActivityVocabulary::load)
                .orElseGet(ActivityVocabulary::defaults);
        ParserOptions options = ParserOptions.defaults()
                .withVocabulary(vocabulary)
                .withStrict(config.strict());
        DocumentValidator validator = new DocumentValidator(options.visitIdPattern(), vocabulary.knownKeywords());
        return new VisitFileProcessor(new VisitParser(options), new VisitSummarizer(config.ditherCountRule()),
                validator, config.instrument());
    }
}
