package com.bankrecon.bankrecon.run;

import com.bankrecon.bankrecon.ReconConstants;

import java.util.List;

/**
 * Outcome of a whole run. Only a fatal run (directory scan or consistency check) yields a non-zero exit code.
 */
public record RunResult(Status status, String fatalMessage, RunSummary summary, List<FlowOutcome> flows) {

    public enum Status {
        COMPLETED,
        FATAL
    }

    public RunResult {
        flows = flows == null ? List.of() : List.copyOf(flows);
    }

    public static RunResult completed(RunSummary summary, List<FlowOutcome> flows) {
        return new RunResult(Status.COMPLETED, null, summary, flows);
    }

    public static RunResult fatal(String message, RunSummary summary) {
        return new RunResult(Status.FATAL, message, summary, List.of());
    }

    public boolean isFatal() {
        return status == Status.FATAL;
    }

    public int exitCode() {
        return isFatal() ? ReconConstants.EXIT_FATAL : ReconConstants.EXIT_OK;
    }
}
