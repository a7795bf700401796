package io.visitfile.parser.config;

import io.visitfile.parser.cli.CliArguments;
import io.visitfile.parser.summary.DitherCountRule;
import io.visitfile.parser.summary.Instrument;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_STRICT = "VISIT_PARSER_STRICT";
    static final String ENV_VOCABULARY = "VISIT_PARSER_VOCABULARY";
    static final String ENV_DITHER_RULE = "VISIT_PARSER_DITHER_RULE";
    static final String ENV_INSTRUMENT = "VISIT_PARSER_INSTRUMENT";
    static final String ENV_OUTPUT_DIR = "VISIT_PARSER_OUTPUT_DIR";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        List<Path> visitFiles = arguments.visitFiles() == null ? List.of() : arguments.visitFiles();
        boolean strict = resolveStrict(arguments);
        Optional<Path> vocabularyFile = firstPresent(arguments.vocabularyFile(), ENV_VOCABULARY);
        DitherCountRule ditherCountRule = resolveDitherCountRule(arguments);
        Optional<Instrument> instrument = Optional.ofNullable(arguments.instrument())
                .or(() -> environmentReader.getTrimmed(ENV_INSTRUMENT).map(Instrument::from));
        Optional<Path> outputDirectory = firstPresent(arguments.outputDirectory(), ENV_OUTPUT_DIR);
        LogFormat logFormat = resolveLogFormat(arguments);

        return new Config(visitFiles, strict, vocabularyFile, ditherCountRule, instrument, outputDirectory, logFormat);
    }

    private boolean resolveStrict(CliArguments arguments) {
        if (arguments.strict()) {
            return true;
        }
        return environmentReader.getTrimmed(ENV_STRICT)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private DitherCountRule resolveDitherCountRule(CliArguments arguments) {
        DitherCountRule cliRule = arguments.ditherCountRule();
        if (cliRule != null) {
            return cliRule;
        }
        return environmentReader.getTrimmed(ENV_DITHER_RULE)
                .map(DitherCountRule::from)
                .orElse(DitherCountRule.CLASSIFIED);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getTrimmed(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<Path> firstPresent(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.getTrimmed(envKey).map(Path::of);
    }
}
