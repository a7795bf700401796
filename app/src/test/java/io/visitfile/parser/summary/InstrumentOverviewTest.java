package io.visitfile.parser.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.visitfile.parser.model.Visit;
import io.visitfile.parser.parse.VisitParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class InstrumentOverviewTest {

    private final Visit visit = new VisitParser().parse(List.of(
            "VISIT ,V01069001001;",
            "GROUP ,1;",
            "SEQ ,1;",
            "SLEW ,01 ,SCSLEWMAIN;",
            "ACT ,02 ,NRCMAIN ,OPMODE=FULLFRAME ,NINTS=2 ,FILTER=F212N;",
            "SEQ ,2;",
            "ACT ,01 ,NISMAIN ,TARGTYPE=EXTERNAL ,PUPIL=CLEARP;",
            "ACT ,02 ,MIRMAIN ,NGROUPS=5;")).visit();

    @Test
    void selectsActivitiesRunByInstrument() {
        SummaryTable table = new InstrumentOverview().build(visit, Instrument.NIRISS);

        assertThat(table.title()).isEqualTo("V01069001001 NIRISS");
        assertThat(table.columns()).endsWith("PUPIL", "FILTER", "SUBARRAY");
        assertThat(table.column("SCRIPT")).containsExactly("NRCMAIN", "NISMAIN");
        assertThat(table.column("OPMODE")).containsExactly("FULLFRAME", "NONE");
        assertThat(table.column("PUPIL")).containsExactly("NONE", "CLEARP");
        assertThat(table.column("GSA")).containsExactly("01102", "01201");
    }

    @Test
    void emptyWhenInstrumentNeverRuns() {
        SummaryTable table = new InstrumentOverview().build(visit, Instrument.FGS);

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.columns()).hasSize(VisitSummarizer.ACTIVITY_COLUMNS.size() + InstrumentOverview.PARAMETER_COLUMNS.size());
    }

    @Test
    void resolvesInstrumentNames() {
        assertThat(Instrument.from("miri")).isEqualTo(Instrument.MIRI);
        assertThat(Instrument.MIRI.runs("MIRMAIN")).isTrue();
        assertThat(Instrument.NIRCAM.runs("NISMAIN")).isFalse();
        assertThat(catchThrowable(() -> Instrument.from("JWST"))).isInstanceOf(IllegalArgumentException.class);
    }
}
