package io.visitfile.parser.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.visitfile.parser.model.ActivityKind;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ActivityVocabularyTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledVocabularyClassifiesCoreKeywords() {
        ActivityVocabulary vocabulary = ActivityVocabulary.defaults();

        assertThat(vocabulary.activityKind("ACT")).contains(ActivityKind.OBSERVATION_STATEMENT);
        assertThat(vocabulary.activityKind("slew")).contains(ActivityKind.OBSERVATION_STATEMENT);
        assertThat(vocabulary.activityKind("CONFIG")).contains(ActivityKind.CONFIGURATION_CHANGE);
        assertThat(vocabulary.visitStatementKind("DITHER")).contains(ActivityKind.DITHER);
        assertThat(vocabulary.visitStatementKeywords()).contains("AUX", "MOMENTUM", "DITHER");
        assertThat(vocabulary.activityKind("WAIT")).isEmpty();
    }

    @Test
    void loadsVocabularyFromFile() throws IOException {
        Path file = tempDir.resolve("custom.properties");
        Files.writeString(file, String.join("\n",
                "activity.PAUSE=other",
                "activity.EXPOSE=observation-statement",
                "visit.PATTERN=dither"), StandardCharsets.UTF_8);

        ActivityVocabulary vocabulary = ActivityVocabulary.load(file);

        assertThat(vocabulary.activityKind("expose")).contains(ActivityKind.OBSERVATION_STATEMENT);
        assertThat(vocabulary.visitStatementKind("PATTERN")).contains(ActivityKind.DITHER);
        assertThat(vocabulary.knownKeywords()).containsExactlyInAnyOrder("PAUSE", "EXPOSE", "PATTERN");
    }

    @Test
    void rejectsEntriesWithoutScopePrefix() {
        Properties properties = new Properties();
        properties.setProperty("ACT", "observation-statement");

        Throwable thrown = catchThrowable(() -> ActivityVocabulary.fromProperties(properties));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("ACT");
    }

    @Test
    void rejectsUnknownKinds() {
        Properties properties = new Properties();
        properties.setProperty("activity.ACT", "exposure");

        assertThat(catchThrowable(() -> ActivityVocabulary.fromProperties(properties)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingFileSurfacesAsUncheckedIoException() {
        Throwable thrown = catchThrowable(() -> ActivityVocabulary.load(tempDir.resolve("absent.properties")));

        assertThat(thrown).isInstanceOf(UncheckedIOException.class).hasMessageContaining("absent.properties");
    }

    @Test
    void extensionsLeaveOriginalUntouched() {
        ActivityVocabulary base = ActivityVocabulary.empty();

        ActivityVocabulary extended = base.withActivity("wait", ActivityKind.OTHER)
                .withVisitStatement("AUX", ActivityKind.OTHER);

        assertThat(base.knownKeywords()).isEmpty();
        assertThat(extended.activityKind("WAIT")).contains(ActivityKind.OTHER);
        assertThat(extended.visitStatementKeywords()).containsExactly("AUX");
    }
}
