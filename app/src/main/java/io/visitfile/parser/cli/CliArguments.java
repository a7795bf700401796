package io.visitfile.parser.cli;

import io.visitfile.parser.config.LogFormat;
import io.visitfile.parser.summary.DitherCountRule;
import io.visitfile.parser.summary.Instrument;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "visit-parser", mixinStandardHelpOptions = true,
        description = "Parses observatory visit files and prints their summaries")
public class CliArguments {

    @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE", description = "Visit files to parse")
    private List<Path> visitFiles;

    @CommandLine.Option(names = "--strict", description = "Fail on unknown activity types and unrecognized lines")
    private boolean strict;

    @CommandLine.Option(names = "--vocabulary", description = "Properties file with the activity keyword vocabulary", paramLabel = "FILE")
    private Path vocabularyFile;

    @CommandLine.Option(names = "--dither-rule", description = "Dither counting rule: classified or distinct-ids", converter = DitherCountRuleConverter.class)
    private DitherCountRule ditherCountRule;

    @CommandLine.Option(names = "--instrument", description = "Instrument for the overview table: niriss, nircam, nirspec, miri or fgs", converter = InstrumentConverter.class)
    private Instrument instrument;

    @CommandLine.Option(names = "--output-dir", description = "Directory receiving <visit>_visit_file_summary.txt files", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public List<Path> visitFiles() {
        return visitFiles;
    }

    public boolean strict() {
        return strict;
    }

    public Path vocabularyFile() {
        return vocabularyFile;
    }

    public DitherCountRule ditherCountRule() {
        return ditherCountRule;
    }

    public Instrument instrument() {
        return instrument;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
