package io.visitfile.parser.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.visitfile.parser.config.ConfigLoader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CliApplication application;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                new PrintWriter(out, true), new PrintWriter(err, true));
    }

    @Test
    void printsSummaryForValidVisitFile() throws IOException {
        Path visitFile = write("flat.vst", List.of(
                "# NIRISS Internal Flat",
                "VISIT ,V00783001001 ,ENGINEERING=N;",
                "GROUP ,01 ,CONGRP=NONE;",
                "SEQ ,1 ,PARALLEL=N;",
                "CONFIG ,NIRISS Internal Flat;",
                "ACT ,01 ,NISMAIN ,CONFIG=NIS ,NINTS=1;",
                "ACT ,02 ,NISMAIN ,CONFIG=NIS ,NINTS=2;"));

        int exitCode = application.run(new String[] {visitFile.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(out.toString()).startsWith(
                "Visit V00783001001: 0 dithers, 1 groups, 2 observation statements. Uses ['NIRISS Internal Flat']");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void writesSummaryFilesWhenOutputDirectoryGiven() throws IOException {
        Path visitFile = write("visit.vst", List.of(
                "VISIT ,V00783001001;", "GROUP ,1;", "SEQ ,1;", "ACT ,01 ,NISMAIN;"));
        Path outputDir = tempDir.resolve("summaries");

        int exitCode = application.run(new String[] {
                "--output-dir", outputDir.toString(), "--instrument", "niriss", visitFile.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        Path summary = outputDir.resolve("V00783001001_visit_file_summary.txt");
        assertThat(summary).exists();
        assertThat(Files.readAllLines(summary, StandardCharsets.UTF_8).get(0)).startsWith("GROUP_ID").endsWith("SUBARRAY");
    }

    @Test
    void reportsParseFailureWithLocationAndContinues() throws IOException {
        Path broken = write("broken.vst", List.of("VISIT ,V00783001001;", "SEQ ,1;"));
        Path valid = write("valid.vst", List.of("VISIT ,V00783001002;"));

        int exitCode = application.run(new String[] {broken.toString(), valid.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_PARSE_FAILURE);
        assertThat(err.toString()).startsWith(broken + ":2: STRUCTURAL: ");
        assertThat(out.toString()).contains("Visit V00783001002:");
    }

    @Test
    void strictModeTurnsUnknownActivitiesIntoFailures() throws IOException {
        Path visitFile = write("wait.vst", List.of(
                "VISIT ,V00783001001;", "GROUP ,1;", "SEQ ,1;", "WAIT ,01;"));

        int lenient = application.run(new String[] {visitFile.toString()});
        int strict = application.run(new String[] {"--strict", visitFile.toString()});

        assertThat(lenient).isEqualTo(CliApplication.EXIT_OK);
        assertThat(strict).isEqualTo(CliApplication.EXIT_PARSE_FAILURE);
        assertThat(err.toString()).contains(":4: UNKNOWN_ACTIVITY_TYPE: ");
    }

    @Test
    void missingFileIsReportedAsFailure() {
        Path missing = tempDir.resolve("missing.vst");

        int exitCode = application.run(new String[] {missing.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_PARSE_FAILURE);
        assertThat(err.toString()).contains("missing.vst");
    }

    @Test
    void invalidArgumentsReturnUsageError() {
        int noFiles = application.run(new String[] {});
        int badRule = application.run(new String[] {"--dither-rule", "unique", "visit.vst"});

        assertThat(noFiles).isEqualTo(2);
        assertThat(badRule).isEqualTo(2);
        assertThat(err.toString()).contains("Usage: visit-parser");
    }

    @Test
    void unreadableVocabularyReturnsUsageError() throws IOException {
        Path visitFile = write("visit.vst", List.of("VISIT ,V00783001001;"));

        int exitCode = application.run(new String[] {
                "--vocabulary", tempDir.resolve("absent.properties").toString(), visitFile.toString()});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("absent.properties");
    }

    @Test
    void helpIsPrintedToStandardOutput() {
        int exitCode = application.run(new String[] {"--help"});

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: visit-parser").contains("--dither-rule");
    }

    private Path write(String name, List<String> lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, lines, StandardCharsets.UTF_8);
        return file;
    }
}
