package com.bankrecon.bankrecon.report;

import com.bankrecon.bankrecon.ReconConstants;
import com.bankrecon.bankrecon.merge.FlagColumns;
import com.bankrecon.bankrecon.merge.MergedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes row/column statistics over a finished table and appends its {@code Category_Count} column.
 */
@Component
public class DatasetSummarizer {

    private static final Logger log = LoggerFactory.getLogger(DatasetSummarizer.class);

    public DatasetStats summarize(MergedTable table) {
        int totalRows = table.rowCount();
        int totalColumns = table.columnCount();
        List<String> flagColumns = FlagColumns.flagColumns(table);
        Set<String> flagLookup = new HashSet<>(flagColumns);
        List<String> staticColumns = new ArrayList<>();
        for (String column : table.columns()) {
            if (!flagLookup.contains(column)) {
                staticColumns.add(column);
            }
        }

        table.addColumn(ReconConstants.CATEGORY_COUNT_COLUMN, row -> String.valueOf(countPresent(row, flagColumns)));

        int multiCategoryRows = 0;
        for (Map<String, String> row : table.rows()) {
            if (Integer.parseInt(row.get(ReconConstants.CATEGORY_COUNT_COLUMN)) > 1) {
                multiCategoryRows++;
            }
        }

        log.info("Dataset summary: rows={}, columns={}, static={} {}, flag columns={}, multi-category rows={}",
                totalRows, totalColumns, staticColumns.size(), staticColumns, flagColumns.size(), multiCategoryRows);
        return new DatasetStats(totalRows, totalColumns, staticColumns, flagColumns, multiCategoryRows);
    }

    private int countPresent(Map<String, String> row, List<String> flagColumns) {
        int count = 0;
        for (String column : flagColumns) {
            if (ReconConstants.FLAG_PRESENT.equals(row.get(column))) {
                count++;
            }
        }
        return count;
    }
}
