package com.bankrecon.bankrecon.run;

import com.bankrecon.bankrecon.ReconConstants;
import com.bankrecon.bankrecon.ReconProperties;
import com.bankrecon.bankrecon.export.ExcelTableWriter;
import com.bankrecon.bankrecon.fileset.ConsistencyChecker;
import com.bankrecon.bankrecon.fileset.ConsistencyResult;
import com.bankrecon.bankrecon.fileset.FileSetIndex;
import com.bankrecon.bankrecon.fileset.FileSetIndexer;
import com.bankrecon.bankrecon.merge.CategoryMerger;
import com.bankrecon.bankrecon.merge.DuplicateReconciler;
import com.bankrecon.bankrecon.merge.MergeResult;
import com.bankrecon.bankrecon.merge.MergedTable;
import com.bankrecon.bankrecon.pac.EnrichmentResult;
import com.bankrecon.bankrecon.pac.Enricher;
import com.bankrecon.bankrecon.pac.PacLookupReader;
import com.bankrecon.bankrecon.pac.PacLookupTable;
import com.bankrecon.bankrecon.report.DatasetStats;
import com.bankrecon.bankrecon.report.DatasetSummarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Drives a reconciliation run: scan and consistency check, then the PM and BM flows of every bank in
 * ascending bank order, then the run summary.
 * <p>
 * A scan failure, an empty directory or a file-set mismatch is fatal for the run. Any failure inside a
 * single flow is recorded for that bank and flow only.
 */
@Service
public class RunOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    private final FileSetIndexer fileSetIndexer;
    private final ConsistencyChecker consistencyChecker;
    private final CategoryMerger categoryMerger;
    private final DuplicateReconciler duplicateReconciler;
    private final Enricher enricher;
    private final DatasetSummarizer datasetSummarizer;
    private final PacLookupReader pacLookupReader;
    private final ExcelTableWriter excelTableWriter;
    private final RunSummaryReporter runSummaryReporter;
    private final ReconProperties reconProperties;

    public RunOrchestrator(FileSetIndexer fileSetIndexer,
                           ConsistencyChecker consistencyChecker,
                           CategoryMerger categoryMerger,
                           DuplicateReconciler duplicateReconciler,
                           Enricher enricher,
                           DatasetSummarizer datasetSummarizer,
                           PacLookupReader pacLookupReader,
                           ExcelTableWriter excelTableWriter,
                           RunSummaryReporter runSummaryReporter,
                           ReconProperties reconProperties) {
        this.fileSetIndexer = fileSetIndexer;
        this.consistencyChecker = consistencyChecker;
        this.categoryMerger = categoryMerger;
        this.duplicateReconciler = duplicateReconciler;
        this.enricher = enricher;
        this.datasetSummarizer = datasetSummarizer;
        this.pacLookupReader = pacLookupReader;
        this.excelTableWriter = excelTableWriter;
        this.runSummaryReporter = runSummaryReporter;
        this.reconProperties = reconProperties;
    }

    public RunResult run(RunRequest request) {
        RunSummary summary = new RunSummary();

        FileSetIndex index;
        try {
            index = fileSetIndexer.scan(request.baseDir());
        } catch (RuntimeException ex) {
            return fatal(ex.getMessage(), summary);
        }
        if (index.isEmpty()) {
            return fatal(ReconConstants.MSG_NO_BANKS_FOUND.formatted(request.baseDir()), summary);
        }

        ConsistencyResult consistency = consistencyChecker.check(index);
        if (!consistency.isConsistent()) {
            return fatal(consistency.mismatch().describe(), summary);
        }

        if (request.onlyBank() != null && index.filesFor(request.onlyBank()).isEmpty()) {
            log.warn("Bank {} requested with --{} has no files in {}", request.onlyBank(),
                    ReconConstants.OPTION_ONLY_BANK, request.baseDir());
        }

        PacLookupSource pacLookup = new PacLookupSource(request.pacFile());
        List<FlowOutcome> flows = new ArrayList<>();
        for (String bankId : index.sortedBankIds()) {
            if (request.onlyBank() != null && !request.onlyBank().equals(bankId)) {
                continue;
            }
            if (!request.skipPm()) {
                flows.add(runFlow(FlowType.PM, bankId, index, request, summary, pacLookup));
            }
            if (!request.skipBm()) {
                flows.add(runFlow(FlowType.BM, bankId, index, request, summary, pacLookup));
            }
        }

        RunResult result = RunResult.completed(summary, flows);
        runSummaryReporter.report(result);
        return result;
    }

    private RunResult fatal(String message, RunSummary summary) {
        log.error("Critical error: {}", message);
        return RunResult.fatal(message, summary);
    }

    private FlowOutcome runFlow(FlowType flow, String bankId, FileSetIndex index, RunRequest request,
                                RunSummary summary, PacLookupSource pacLookup) {
        BankSummary bankSummary = summary.bank(bankId);
        FlowOutcome outcome;
        try {
            outcome = executeFlow(flow, bankId, index, request, bankSummary, pacLookup);
        } catch (RuntimeException ex) {
            log.error("Error during {} flow for bank {}: {}", flow, bankId, ex.getMessage(), ex);
            outcome = FlowOutcome.failed(bankId, flow, ex.getMessage());
        }
        bankSummary.recordFlow(outcome);
        return outcome;
    }

    private FlowOutcome executeFlow(FlowType flow, String bankId, FileSetIndex index, RunRequest request,
                                    BankSummary bankSummary, PacLookupSource pacLookup) {
        String extension = flow == FlowType.PM ? reconProperties.getPmExtension() : reconProperties.getBmExtension();
        List<String> files = index.filesFor(bankId, extension, reconProperties.getObsMarker());
        if (files.isEmpty()) {
            String message = "No " + flow + " (" + extension + ") files found for bank " + bankId;
            log.warn(message);
            return FlowOutcome.noFiles(bankId, flow, message);
        }

        MergeResult mergeResult = categoryMerger.merge(request.baseDir(), files, bankId);
        bankSummary.recordMerge(mergeResult);
        if (mergeResult.table().isEmpty()) {
            String message = "No " + flow + " rows merged for bank " + bankId + " from " + files.size() + " file(s)";
            log.warn(message);
            return FlowOutcome.noData(bankId, flow, message);
        }

        String keyColumn = reconProperties.getCustomerKeyColumn();
        MergedTable table = duplicateReconciler.reconcile(mergeResult.table(), keyColumn);

        if (flow == FlowType.BM) {
            EnrichmentResult enrichment = enricher.enrich(table, bankId, pacLookup.get(), keyColumn);
            if (!enrichment.bankFound()) {
                bankSummary.addNote(ReconConstants.MSG_NO_PAC_DATA.formatted(bankId));
            }
            table = enrichment.table();
        }

        DatasetStats stats = datasetSummarizer.summarize(table);
        bankSummary.recordDataset(stats);

        Path outputFile = request.outputDir().resolve(flow.outputFileName(bankId, request.runDate()));
        excelTableWriter.write(table, outputFile, Set.of(ReconConstants.CATEGORY_COUNT_COLUMN));
        log.info("Saved {} Excel: {}", flow, outputFile);
        return FlowOutcome.completed(bankId, flow, outputFile, table.rowCount());
    }

    /**
     * Reads the PAC export on first use and keeps it for the rest of the run. A failed read is not kept,
     * so the next BM flow tries again.
     */
    private final class PacLookupSource {

        private final Path pacFile;
        private PacLookupTable table;

        private PacLookupSource(Path pacFile) {
            this.pacFile = pacFile;
        }

        PacLookupTable get() {
            if (table == null) {
                table = pacLookupReader.read(pacFile);
            }
            return table;
        }
    }
}
