package com.bankrecon.bankrecon.merge;

/**
 * Per-file result of a category merge.
 */
public record FileOutcome(String fileName, Status status, String categoryLabel, String detail) {

    public enum Status {
        MERGED,
        NO_DATA,
        ERROR
    }

    public static FileOutcome merged(String fileName, String categoryLabel) {
        return new FileOutcome(fileName, Status.MERGED, categoryLabel, null);
    }

    public static FileOutcome noData(String fileName, String detail) {
        return new FileOutcome(fileName, Status.NO_DATA, null, detail);
    }

    public static FileOutcome error(String fileName, String detail) {
        return new FileOutcome(fileName, Status.ERROR, null, detail);
    }
}
