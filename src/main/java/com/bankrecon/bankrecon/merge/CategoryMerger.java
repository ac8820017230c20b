package com.bankrecon.bankrecon.merge;

import com.bankrecon.bankrecon.ReconConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges one bank's per-category extract files into a single wide table with one flag column per category.
 * <p>
 * Each file is handled in isolation: a file without data is recorded as {@code NO_DATA}, any other
 * failure as {@code ERROR}, and the merge goes on with the next file.
 */
@Component
public class CategoryMerger {

    private static final Logger log = LoggerFactory.getLogger(CategoryMerger.class);

    private final ExtractFileReader extractFileReader;

    public CategoryMerger(ExtractFileReader extractFileReader) {
        this.extractFileReader = extractFileReader;
    }

    public MergeResult merge(Path baseDir, List<String> fileNames, String bankId) {
        MergedTable table = new MergedTable();
        List<FileOutcome> outcomes = new ArrayList<>(fileNames.size());

        for (String fileName : fileNames) {
            try {
                ExtractFile extract = extractFileReader.read(baseDir.resolve(fileName));
                if (extract.hasNoData() || extract.columns().size() <= ReconConstants.CATEGORY_COLUMN_INDEX) {
                    log.warn("Skipped {} for bank {}: no data, bank does not have this category type", fileName, bankId);
                    outcomes.add(FileOutcome.noData(fileName, extract.hasNoData() ? "no data rows" : "no category column"));
                    continue;
                }

                String categoryColumn = extract.columns().get(ReconConstants.CATEGORY_COLUMN_INDEX);
                String categoryLabel = extract.rows().get(0).get(categoryColumn).trim();
                if (categoryLabel.isEmpty()) {
                    throw new IllegalStateException(ReconConstants.MSG_BLANK_CATEGORY.formatted(fileName));
                }

                List<String> dataColumns = new ArrayList<>(extract.columns());
                dataColumns.remove(ReconConstants.CATEGORY_COLUMN_INDEX);
                table.appendCategory(categoryLabel, dataColumns, extract.rows());

                log.info("Merged {} as '{}' ({} rows) for bank {}", fileName, categoryLabel, extract.rows().size(), bankId);
                outcomes.add(FileOutcome.merged(fileName, categoryLabel));
            } catch (RuntimeException ex) {
                log.warn("Error in {} for bank {}: {}", fileName, bankId, ex.getMessage());
                outcomes.add(FileOutcome.error(fileName, ex.getMessage()));
            }
        }
        return new MergeResult(table, outcomes);
    }
}
