package com.bankrecon.bankrecon.merge;

import java.util.List;
import java.util.Map;

/**
 * One parsed extract file: its header names and its data rows, all values as text.
 */
public record ExtractFile(String fileName, List<String> columns, List<Map<String, String>> rows) {

    public ExtractFile {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public boolean hasNoData() {
        return rows.isEmpty();
    }
}
