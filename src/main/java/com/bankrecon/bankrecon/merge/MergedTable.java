package com.bankrecon.bankrecon.merge;

import com.bankrecon.bankrecon.ReconConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Wide, all-text table built from one bank's extract files.
 * <p>
 * Every row holds a value for every column; absent values are the empty string, never {@code null}.
 * Category flag columns are declared as they are discovered and only ever hold "J" or "N".
 */
public class MergedTable {

    private final List<String> columns = new ArrayList<>();
    private final Set<String> columnLookup = new HashSet<>();
    private final List<Map<String, String>> rows = new ArrayList<>();
    private final Set<String> categoryColumns = new LinkedHashSet<>();

    public MergedTable() {
    }

    public MergedTable(List<String> columns, List<Map<String, String>> rows, Set<String> categoryColumns) {
        for (String column : columns) {
            if (columnLookup.add(column)) {
                this.columns.add(column);
            }
        }
        for (Map<String, String> row : rows) {
            Map<String, String> copy = new LinkedHashMap<>();
            for (String column : this.columns) {
                String value = row.get(column);
                copy.put(column, value == null ? ReconConstants.BLANK : value);
            }
            this.rows.add(copy);
        }
        this.categoryColumns.addAll(categoryColumns);
    }

    public List<String> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Rows in table order. Callers must treat the row maps as read-only.
     */
    public List<Map<String, String>> rows() {
        return Collections.unmodifiableList(rows);
    }

    public Set<String> categoryColumns() {
        return Collections.unmodifiableSet(categoryColumns);
    }

    public boolean hasColumn(String column) {
        return columnLookup.contains(column);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public String value(int rowIndex, String column) {
        String value = rows.get(rowIndex).get(column);
        return value == null ? ReconConstants.BLANK : value;
    }

    /**
     * Appends the rows of one category file and pivots its label into a flag column.
     * <p>
     * Columns missing on either side are filled with "N": earlier rows get "N" for columns first seen
     * in this file, and this file's rows get "N" for columns it does not carry.
     *
     * @param categoryLabel label read from the file, becomes a column set to "J" for the file's rows
     * @param fileColumns   the file's columns without its category column
     * @param fileRows      the file's rows keyed by column name
     */
    public void appendCategory(String categoryLabel, List<String> fileColumns, List<Map<String, String>> fileRows) {
        Set<String> incoming = new LinkedHashSet<>(fileColumns);
        incoming.add(categoryLabel);

        for (String column : incoming) {
            if (columnLookup.add(column)) {
                columns.add(column);
                for (Map<String, String> row : rows) {
                    row.put(column, ReconConstants.FLAG_ABSENT);
                }
            }
        }

        for (Map<String, String> source : fileRows) {
            Map<String, String> row = new LinkedHashMap<>();
            for (String column : columns) {
                if (column.equals(categoryLabel)) {
                    row.put(column, ReconConstants.FLAG_PRESENT);
                } else if (incoming.contains(column)) {
                    String value = source.get(column);
                    row.put(column, value == null ? ReconConstants.BLANK : value);
                } else {
                    row.put(column, ReconConstants.FLAG_ABSENT);
                }
            }
            rows.add(row);
        }
        categoryColumns.add(categoryLabel);
    }

    /**
     * Appends a computed column, or recomputes it when it already exists.
     */
    public void addColumn(String column, Function<Map<String, String>, String> valueFunction) {
        List<String> computed = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            String value = valueFunction.apply(Collections.unmodifiableMap(row));
            computed.add(value == null ? ReconConstants.BLANK : value);
        }
        if (columnLookup.add(column)) {
            columns.add(column);
        }
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).put(column, computed.get(i));
        }
    }
}
