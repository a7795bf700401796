package io.visitfile.parser.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class VisitTest {

    @Test
    void navigatesGroupsAndSequencesByIndex() {
        Activity act = activity("ACT", ActivityKind.OBSERVATION_STATEMENT, 1, "NISMAIN");
        Visit visit = new Visit("V00783001001", List.of(
                new Group(1, List.of(new Sequence(1, List.of(act)))),
                new Group(3, List.of(new Sequence(2, List.of())))));

        assertThat(visit.group(3)).isPresent();
        assertThat(visit.group(2)).isEmpty();
        assertThat(visit.sequence(1, 1)).hasValueSatisfying(sequence -> assertThat(sequence.activity(0)).isEqualTo(act));
        assertThat(visit.sequence(3, 1)).isEmpty();
        assertThat(visit.activities()).containsExactly(act);
    }

    @Test
    void allStatementsListsVisitStatementsFirst() {
        Activity dither = activity("DITHER", ActivityKind.DITHER, 1, Activity.NO_SCRIPT);
        Activity act = activity("ACT", ActivityKind.OBSERVATION_STATEMENT, 1, "NISMAIN");
        Visit visit = new Visit("V00783001001", List.of(), List.of(), List.of(dither),
                List.of(new Group(1, List.of(new Sequence(1, List.of(act))))));

        assertThat(visit.allStatements()).containsExactly(dither, act);
        assertThat(visit.isEmpty()).isFalse();
    }

    @Test
    void rejectsBlankIdentifier() {
        assertThat(catchThrowable(() -> new Visit(" ", List.of()))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void activityExposesParametersAndCodes() {
        Activity activity = new Activity("ACT", List.of("0A", "NRCMAIN"),
                List.of(new Parameter("CONFIG", "NRCALL"), new Parameter("NINTS", "3")),
                ActivityKind.OBSERVATION_STATEMENT, 10, "NRCMAIN", 12);

        assertThat(activity.parameter("NINTS")).contains("3");
        assertThat(activity.parameter("FILTER")).isEmpty();
        assertThat(activity.configurationValue()).contains("NRCALL");
        assertThat(activity.gsa(1, 2)).isEqualTo("01210");
        assertThat(activity.hasScript()).isTrue();
    }

    @Test
    void gsaUsesAsciiDigitsInEveryLocale() {
        Activity activity = activity("ACT", ActivityKind.OBSERVATION_STATEMENT, 3, "NISMAIN");
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));

            assertThat(activity.gsa(2, 1)).isEqualTo("02103");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void configurationValueFallsBackToFirstPositionalArgument() {
        Activity config = new Activity("CONFIG", List.of("NIRISS Internal Flat"), List.of(),
                ActivityKind.CONFIGURATION_CHANGE, 1, null, 5);

        assertThat(config.configurationValue()).contains("NIRISS Internal Flat");
        assertThat(config.scriptName()).isEqualTo(Activity.NO_SCRIPT);
        assertThat(config.hasScript()).isFalse();
    }

    @Test
    void numericParameterValues() {
        assertThat(new Parameter("GSRA", " 80.25 ").numericValue()).contains(80.25);
        assertThat(new Parameter("GUIDEMODE", "FINEGUIDE").numericValue()).isEmpty();
    }

    @Test
    void parsesActivityKindNames() {
        assertThat(ActivityKind.from("observation-statement")).isEqualTo(ActivityKind.OBSERVATION_STATEMENT);
        assertThat(ActivityKind.from(" Dither ")).isEqualTo(ActivityKind.DITHER);
        assertThat(catchThrowable(() -> ActivityKind.from("exposure"))).isInstanceOf(IllegalArgumentException.class);
    }

    static Activity activity(String keyword, ActivityKind kind, int number, String script) {
        return new Activity(keyword, List.of(), List.of(), kind, number, script, 1);
    }
}
