package io.visitfile.parser.config;

import io.visitfile.parser.summary.DitherCountRule;
import io.visitfile.parser.summary.Instrument;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 *
 * @param visitFiles files to parse, in the order given
 * @param strict fail on unknown keywords and unrecognized lines
 * @param vocabularyFile properties file replacing the bundled keyword vocabulary
 * @param ditherCountRule rule used to count dithers in summaries
 * @param instrument instrument whose overview table is produced, if any
 * @param outputDirectory directory receiving summary files, if any
 * @param logFormat log output format
 */
public record Config(
        List<Path> visitFiles,
        boolean strict,
        Optional<Path> vocabularyFile,
        DitherCountRule ditherCountRule,
        Optional<Instrument> instrument,
        Optional<Path> outputDirectory,
        LogFormat logFormat
) {

    public Config {
        visitFiles = List.copyOf(Objects.requireNonNull(visitFiles, "visitFiles"));
        if (visitFiles.isEmpty()) {
            throw new IllegalArgumentException("At least one visit file must be provided");
        }
        vocabularyFile = vocabularyFile == null ? Optional.empty() : vocabularyFile;
        ditherCountRule = Objects.requireNonNull(ditherCountRule, "ditherCountRule");
        instrument = instrument == null ? Optional.empty() : instrument;
        outputDirectory = outputDirectory == null ? Optional.empty() : outputDirectory;
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
    }
}
