package com.bankrecon.bankrecon.merge;

import com.bankrecon.bankrecon.ReconConstants;
import com.bankrecon.bankrecon.ReconProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Collapses the rows of one customer into a single row.
 * <p>
 * Flag columns become "J" when any of the customer's rows has "J", otherwise "N". Every other column
 * takes the first non-empty value in the customer's rows. Output is ordered by customer key.
 */
@Component
public class DuplicateReconciler {

    private static final Logger log = LoggerFactory.getLogger(DuplicateReconciler.class);

    private final ReconProperties reconProperties;

    public DuplicateReconciler(ReconProperties reconProperties) {
        this.reconProperties = reconProperties;
    }

    /**
     * @throws IllegalStateException when {@code keyColumn} is not a column of the table
     */
    public MergedTable reconcile(MergedTable table, String keyColumn) {
        if (!table.hasColumn(keyColumn)) {
            throw new IllegalStateException(ReconConstants.MSG_KEY_COLUMN_MISSING.formatted(keyColumn));
        }

        Set<String> flagColumns = new HashSet<>(FlagColumns.sampledFlagColumns(
                table, reconProperties.getFlagSampleSize(), reconProperties.getFlagSampleSeed()));

        Map<String, List<Map<String, String>>> groups = new TreeMap<>();
        int emptyKeys = 0;
        for (Map<String, String> row : table.rows()) {
            String key = row.get(keyColumn);
            if (key == null || key.isEmpty()) {
                emptyKeys++;
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        if (emptyKeys > 0) {
            log.warn("Dropped {} row(s) with empty {}", emptyKeys, keyColumn);
        }

        List<Map<String, String>> reconciled = new ArrayList<>(groups.size());
        for (List<Map<String, String>> group : groups.values()) {
            Map<String, String> merged = new LinkedHashMap<>(group.get(0));
            for (String column : table.columns()) {
                if (flagColumns.contains(column)) {
                    merged.put(column, anyPresent(group, column) ? ReconConstants.FLAG_PRESENT : ReconConstants.FLAG_ABSENT);
                } else {
                    merged.put(column, firstNonEmpty(group, column));
                }
            }
            reconciled.add(merged);
        }

        log.info("Reconciled {} row(s) into {} customer(s)", table.rowCount(), reconciled.size());
        return new MergedTable(table.columns(), reconciled, table.categoryColumns());
    }

    private boolean anyPresent(List<Map<String, String>> group, String column) {
        for (Map<String, String> row : group) {
            if (ReconConstants.FLAG_PRESENT.equals(row.get(column))) {
                return true;
            }
        }
        return false;
    }

    private String firstNonEmpty(List<Map<String, String>> group, String column) {
        for (Map<String, String> row : group) {
            String value = row.get(column);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return ReconConstants.BLANK;
    }
}
