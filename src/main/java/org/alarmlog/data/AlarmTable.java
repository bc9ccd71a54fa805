package org.alarmlog.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * In-memory table as read from an alarm log file. Header names and cells are
 * kept exactly as read; columns are looked up by trimmed, lower-cased name.
 * A table belongs to a single pipeline run.
 */
public final class AlarmTable {

    private final List<String> columns;
    private final List<String> keys;
    private final List<String[]> rows;

    public AlarmTable(List<String> columns, List<String[]> rows) {
        List<String> names = new ArrayList<>(columns.size());
        List<String> keys = new ArrayList<>(columns.size());
        for (String column : columns) {
            names.add(column == null ? "" : column);
            keys.add(normalizeColumn(column));
        }
        this.columns = Collections.unmodifiableList(names);
        this.keys = keys;
        this.rows = new ArrayList<>(rows.size());
        for (String[] row : rows) {
            this.rows.add(fit(row, names.size()));
        }
    }

    static String normalizeColumn(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    private static String[] fit(String[] row, int width) {
        if (row.length == width) {
            return row.clone();
        }
        String[] copy = new String[width];
        System.arraycopy(row, 0, copy, 0, Math.min(width, row.length));
        return copy;
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String name) {
        return columnIndex(name) >= 0;
    }

    public int columnIndex(String name) {
        return keys.indexOf(normalizeColumn(name));
    }

    /**
     * Required columns absent from this table, in the order they were asked for.
     */
    public List<String> missingColumns(String... required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!hasColumn(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    public String get(int row, String column) {
        int idx = columnIndex(column);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.get(row)[idx];
    }

    public void set(int row, String column, String value) {
        int idx = columnIndex(column);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        rows.get(row)[idx] = value;
    }

    public String[] row(int row) {
        return rows.get(row).clone();
    }

    public AlarmTable copy() {
        return new AlarmTable(columns, rows);
    }

    @Override
    public String toString() {
        return "AlarmTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
