package io.visitfile.parser.report;

import static org.assertj.core.api.Assertions.assertThat;

import io.visitfile.parser.summary.SummaryTable;
import java.util.List;
import org.junit.jupiter.api.Test;

class FixedWidthTableFormatterTest {

    private final FixedWidthTableFormatter formatter = new FixedWidthTableFormatter();

    @Test
    void padsCellsToWidestValue() {
        SummaryTable table = new SummaryTable("V00783001001", List.of("GSA", "TYPE", "SCRIPT"), List.of(
                List.of("01101", "CONFIG", "NONE"),
                List.of("01102", "ACT", "NISMAIN")));

        List<String> lines = formatter.format(table);

        assertThat(lines).containsExactly(
                "GSA   , TYPE   , SCRIPT",
                "01101 , CONFIG , NONE",
                "01102 , ACT    , NISMAIN");
    }

    @Test
    void emptyTableRendersHeaderOnly() {
        SummaryTable table = new SummaryTable("V00783001001", List.of("GROUP_ID", "SEQ_ID"), List.of());

        assertThat(formatter.format(table)).containsExactly("GROUP_ID , SEQ_ID");
    }

    @Test
    void linesNeverEndWithWhitespace() {
        SummaryTable table = new SummaryTable("t", List.of("A", "LONGCOLUMN"), List.of(List.of("value", "")));

        assertThat(formatter.format(table)).allSatisfy(line -> assertThat(line).doesNotEndWith(" "));
    }
}
