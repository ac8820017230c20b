package com.bankrecon.bankrecon.run;

import com.bankrecon.bankrecon.merge.FileOutcome;
import com.bankrecon.bankrecon.merge.MergeResult;
import com.bankrecon.bankrecon.merge.MergedTable;
import com.bankrecon.bankrecon.report.DatasetStats;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunSummaryReporterTest {

    private final RunSummaryReporter reporter = new RunSummaryReporter();

    @Test
    void shouldRenderPerBankSectionsAndDatasetSummary() {
        RunSummary summary = new RunSummary();
        BankSummary bank = summary.bank("1234");
        bank.recordMerge(new MergeResult(new MergedTable(), List.of(
                FileOutcome.merged("X.B1234.B.CSV", "SAVINGS"),
                FileOutcome.merged("X.B1234.A.CSV", "RETAIL"),
                FileOutcome.noData("X.B1234.C.CSV", "no data rows"),
                FileOutcome.error("X.B1234.D.CSV", "broken"))));
        bank.recordDataset(new DatasetStats(2, 5, List.of("Kundenummer", "Navn"), List.of("RETAIL", "SAVINGS"), 1));
        bank.addNote("No PAC data found for bank 1234");
        bank.recordFlow(FlowOutcome.completed("1234", FlowType.PM, Path.of("out/1234_20250706.xlsx"), 2));
        bank.recordFlow(FlowOutcome.noFiles("1234", FlowType.BM, "No BM (.CSV.BM) files found for bank 1234"));

        String text = reporter.render(RunResult.completed(summary, bank.flowOutcomes()));

        assertTrue(text.contains("Processed 1 banks"));
        assertTrue(text.contains("Bank 1234:"));
        assertTrue(text.contains("Categories merged: 2"));
        assertTrue(text.indexOf("+ RETAIL") < text.indexOf("+ SAVINGS"));
        assertTrue(text.contains("Bank does not have category types: 1"));
        assertTrue(text.contains("! X.B1234.C.CSV"));
        assertTrue(text.contains("Files with errors: 1"));
        assertTrue(text.contains("Final columns: 4 columns"));
        assertTrue(text.contains("Note: No PAC data found for bank 1234"));
        assertTrue(text.contains("BM flow: skipped"));
        assertTrue(text.contains("Rows with multiple categories: 1"));
    }

    @Test
    void shouldRenderAbortedRunWithoutBankSections() {
        String text = reporter.render(RunResult.fatal("Bank file inconsistency", new RunSummary()));

        assertTrue(text.contains("Run aborted: Bank file inconsistency"));
        assertFalse(text.contains("Bank 1234"));
    }
}
