package io.visitfile.parser.report;

import io.visitfile.parser.summary.SummaryTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lays out a table as fixed-width ASCII columns separated by {@code " , "} without leading or trailing
 * delimiters.
 */
public class FixedWidthTableFormatter {

    static final String DELIMITER = " , ";

    public List<String> format(SummaryTable table) {
        Objects.requireNonNull(table, "table");
        int[] widths = new int[table.columns().size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = table.columns().get(i).length();
        }
        for (List<String> row : table.rows()) {
            for (int i = 0; i < widths.length; i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        List<String> lines = new ArrayList<>(table.size() + 1);
        lines.add(formatRow(table.columns(), widths));
        for (List<String> row : table.rows()) {
            lines.add(formatRow(row, widths));
        }
        return lines;
    }

    private String formatRow(List<String> cells, int[] widths) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                builder.append(DELIMITER);
            }
            builder.append(pad(cells.get(i), widths[i]));
        }
        return builder.toString().stripTrailing();
    }

    private static String pad(String value, int width) {
        StringBuilder padded = new StringBuilder(width);
        padded.append(value);
        while (padded.length() < width) {
            padded.append(' ');
        }
        return padded.toString();
    }
}
