package com.bankrecon.bankrecon.merge;

import com.bankrecon.bankrecon.ReconConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Classifies table columns as flag columns (non-blank values only "J"/"N") or static columns.
 * <p>
 * A column with no non-blank values at all counts as a flag column.
 */
public final class FlagColumns {

    private FlagColumns() {
    }

    /**
     * Full-scan classification.
     */
    public static List<String> flagColumns(MergedTable table) {
        return classify(table, table.rows());
    }

    /**
     * Classification over a seeded random sample of at most {@code sampleSize} rows. A column that only
     * holds flag values inside the sample is reported as a flag column even if other rows disagree.
     */
    public static List<String> sampledFlagColumns(MergedTable table, int sampleSize, long seed) {
        List<Map<String, String>> rows = table.rows();
        if (rows.size() <= sampleSize) {
            return classify(table, rows);
        }
        List<Integer> indexes = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            indexes.add(i);
        }
        Collections.shuffle(indexes, new Random(seed));
        List<Map<String, String>> sample = new ArrayList<>(sampleSize);
        for (int i = 0; i < sampleSize; i++) {
            sample.add(rows.get(indexes.get(i)));
        }
        return classify(table, sample);
    }

    public static boolean isFlagValue(String value) {
        return ReconConstants.FLAG_PRESENT.equals(value) || ReconConstants.FLAG_ABSENT.equals(value);
    }

    private static List<String> classify(MergedTable table, List<Map<String, String>> rows) {
        List<String> flags = new ArrayList<>();
        for (String column : table.columns()) {
            boolean flag = true;
            for (Map<String, String> row : rows) {
                String value = row.get(column);
                if (value != null && !value.isEmpty() && !isFlagValue(value)) {
                    flag = false;
                    break;
                }
            }
            if (flag) {
                flags.add(column);
            }
        }
        return flags;
    }
}
