package io.visitfile.parser.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.visitfile.parser.model.Visit;
import io.visitfile.parser.parse.VisitParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class VisitSummarizerTest {

    private static final List<String> NIRCAM_VISIT = List.of(
            "# NIRCam Imaging",
            "VISIT ,V01069001001 ,ENGINEERING=N;",
            "DITHER ,ID=1 ,PATTERN=FULL;",
            "DITHER ,ID=1 ,SUBPIXEL=4;",
            "DITHER ,PATTERN=NONE;",
            "GROUP ,01;",
            "SEQ ,1;",
            "SLEW ,01 ,SCSLEWMAIN ,GSRA=80.3;",
            "CONFIG ,NRCALL_FULL;",
            "ACT ,02 ,NRCMAIN ,CONFIG=NRCALL ,NINTS=1;",
            "ACT ,03 ,NRCMAIN ,CONFIG=NRCALL ,NINTS=2;",
            "GROUP ,02;",
            "SEQ ,1;",
            "CONFIG ,NRCALL_FULL;",
            "CONFIG ,NRCA1_SUB;",
            "ACT ,01 ,NRCMAIN;");

    private final Visit visit = new VisitParser().parse(NIRCAM_VISIT).visit();

    @Test
    void summarizesCountsAndModes() {
        VisitSummary summary = new VisitSummarizer().summarize(visit);

        assertThat(summary.visitId()).isEqualTo("V01069001001");
        assertThat(summary.ditherCount()).isEqualTo(3);
        assertThat(summary.groupCount()).isEqualTo(2);
        assertThat(summary.observationStatementCount()).isEqualTo(4);
        assertThat(summary.modesUsed()).containsExactly("NRCALL_FULL", "NRCA1_SUB");
        assertThat(summary.sequenceCount()).isEqualTo(2);
        assertThat(summary.activityCount()).isEqualTo(7);
    }

    @Test
    void distinctIdRuleCollapsesRepeatedDitherIds() {
        VisitSummary summary = new VisitSummarizer(DitherCountRule.DISTINCT_IDS).summarize(visit);

        assertThat(summary.ditherCount()).isEqualTo(2);
    }

    @Test
    void rendersOneLineSummary() {
        VisitSummarizer summarizer = new VisitSummarizer();

        String line = summarizer.renderOneLine(summarizer.summarize(visit));

        assertThat(line).isEqualTo(
                "Visit V01069001001: 3 dithers, 2 groups, 4 observation statements. Uses ['NRCALL_FULL', 'NRCA1_SUB']");
    }

    @Test
    void rendersEmptyModeList() {
        VisitSummarizer summarizer = new VisitSummarizer();

        String line = summarizer.renderOneLine(new VisitSummary("V00783001001", 0, 0, 0, List.of()));

        assertThat(line).isEqualTo("Visit V00783001001: 0 dithers, 0 groups, 0 observation statements. Uses []");
    }

    @Test
    void summarizingTwiceGivesEqualResults() {
        VisitSummarizer summarizer = new VisitSummarizer();

        assertThat(summarizer.summarize(visit)).isEqualTo(summarizer.summarize(visit));
        assertThat(summarizer.activityTable(visit)).isEqualTo(summarizer.activityTable(visit));
    }

    @Test
    void listsActivitiesInTreeOrder() {
        SummaryTable table = new VisitSummarizer().activityTable(visit);

        assertThat(table.title()).isEqualTo("V01069001001");
        assertThat(table.columns()).containsExactly("GROUP_ID", "SEQ_ID", "ACT_ID", "GSA", "TYPE", "SCRIPT");
        assertThat(table.size()).isEqualTo(7);
        assertThat(table.column("GSA")).containsExactly("01101", "01102", "01102", "01103", "02101", "02102", "02101");
        assertThat(table.column("TYPE")).containsExactly("SLEW", "CONFIG", "ACT", "ACT", "CONFIG", "CONFIG", "ACT");
        assertThat(table.column("SCRIPT")).startsWith("SCSLEWMAIN", "NONE", "NRCMAIN");
    }

    @Test
    void parsesDitherRuleNames() {
        assertThat(DitherCountRule.from("distinct-ids")).isEqualTo(DitherCountRule.DISTINCT_IDS);
        assertThat(DitherCountRule.from(null)).isEqualTo(DitherCountRule.CLASSIFIED);
        assertThat(catchThrowable(() -> DitherCountRule.from("unique"))).isInstanceOf(IllegalArgumentException.class);
    }
}
