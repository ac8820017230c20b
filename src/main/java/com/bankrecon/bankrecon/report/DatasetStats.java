package com.bankrecon.bankrecon.report;

import java.util.ArrayList;
import java.util.List;

/**
 * Descriptive statistics of a finished bank table.
 *
 * @param totalColumns      column count before the category count column is appended
 * @param multiCategoryRows rows with more than one flag column set to "J"
 */
public record DatasetStats(
        int totalRows,
        int totalColumns,
        List<String> staticColumns,
        List<String> flagColumns,
        int multiCategoryRows
) {

    public DatasetStats {
        staticColumns = List.copyOf(staticColumns);
        flagColumns = List.copyOf(flagColumns);
    }

    /**
     * Flag columns first, then static columns.
     */
    public List<String> orderedColumns() {
        List<String> ordered = new ArrayList<>(flagColumns);
        ordered.addAll(staticColumns);
        return ordered;
    }
}
