package com.bankrecon.bankrecon.run;

import java.nio.file.Path;

/**
 * Result of one bank flow. Only {@code COMPLETED} flows have an output file.
 */
public record FlowOutcome(String bankId, FlowType flow, Status status, Path outputFile, int rows, String message) {

    public enum Status {
        COMPLETED,
        NO_FILES,
        NO_DATA,
        FAILED
    }

    public static FlowOutcome completed(String bankId, FlowType flow, Path outputFile, int rows) {
        return new FlowOutcome(bankId, flow, Status.COMPLETED, outputFile, rows, null);
    }

    public static FlowOutcome noFiles(String bankId, FlowType flow, String message) {
        return new FlowOutcome(bankId, flow, Status.NO_FILES, null, 0, message);
    }

    public static FlowOutcome noData(String bankId, FlowType flow, String message) {
        return new FlowOutcome(bankId, flow, Status.NO_DATA, null, 0, message);
    }

    public static FlowOutcome failed(String bankId, FlowType flow, String message) {
        return new FlowOutcome(bankId, flow, Status.FAILED, null, 0, message);
    }
}
