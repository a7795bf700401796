package io.visitfile.parser.summary;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Column-oriented listing derived from a visit; every cell is already rendered as text.
 */
public record SummaryTable(String title, List<String> columns, List<List<String>> rows) {

    public SummaryTable {
        Objects.requireNonNull(title, "title");
        columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        Objects.requireNonNull(rows, "rows");
        List<List<String>> copies = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row has " + row.size() + " cells but table has " + columns.size() + " columns");
            }
            copies.add(List.copyOf(row));
        }
        rows = List.copyOf(copies);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> column(String name) {
        int index = columns.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        List<String> values = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            values.add(row.get(index));
        }
        return List.copyOf(values);
    }
}
