package com.bankrecon.bankrecon.merge;

import java.util.List;

/**
 * Merged table of one bank flow plus what happened to each input file.
 */
public record MergeResult(MergedTable table, List<FileOutcome> outcomes) {

    public MergeResult {
        outcomes = List.copyOf(outcomes);
    }

    public List<String> mergedCategories() {
        return outcomes.stream()
                .filter(outcome -> outcome.status() == FileOutcome.Status.MERGED)
                .map(FileOutcome::categoryLabel)
                .toList();
    }

    public List<String> missingFiles() {
        return fileNames(FileOutcome.Status.NO_DATA);
    }

    public List<String> failedFiles() {
        return fileNames(FileOutcome.Status.ERROR);
    }

    private List<String> fileNames(FileOutcome.Status status) {
        return outcomes.stream()
                .filter(outcome -> outcome.status() == status)
                .map(FileOutcome::fileName)
                .toList();
    }
}
