package com.bankrecon.bankrecon.run;

import com.bankrecon.bankrecon.merge.MergeResult;
import com.bankrecon.bankrecon.report.DatasetStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulated outcome of both flows of one bank.
 * <p>
 * Merged categories, missing files, failed files, notes and flow outcomes are appended by every flow;
 * final columns and dataset statistics hold whatever the last finished flow recorded.
 */
public class BankSummary {

    private final String bankId;
    private final List<String> mergedCategories = new ArrayList<>();
    private final List<String> missingFiles = new ArrayList<>();
    private final List<String> failedFiles = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();
    private final List<FlowOutcome> flowOutcomes = new ArrayList<>();
    private List<String> columns = List.of();
    private DatasetStats stats;

    public BankSummary(String bankId) {
        this.bankId = bankId;
    }

    public void recordMerge(MergeResult mergeResult) {
        mergedCategories.addAll(mergeResult.mergedCategories());
        missingFiles.addAll(mergeResult.missingFiles());
        failedFiles.addAll(mergeResult.failedFiles());
    }

    public void recordDataset(DatasetStats datasetStats) {
        this.stats = datasetStats;
        this.columns = datasetStats.orderedColumns();
    }

    public void addNote(String note) {
        notes.add(note);
    }

    public void recordFlow(FlowOutcome outcome) {
        flowOutcomes.add(outcome);
    }

    public String bankId() {
        return bankId;
    }

    public List<String> mergedCategories() {
        return Collections.unmodifiableList(mergedCategories);
    }

    public List<String> missingFiles() {
        return Collections.unmodifiableList(missingFiles);
    }

    public List<String> failedFiles() {
        return Collections.unmodifiableList(failedFiles);
    }

    public List<String> notes() {
        return Collections.unmodifiableList(notes);
    }

    public List<FlowOutcome> flowOutcomes() {
        return Collections.unmodifiableList(flowOutcomes);
    }

    public List<String> columns() {
        return columns;
    }

    public DatasetStats stats() {
        return stats;
    }
}
