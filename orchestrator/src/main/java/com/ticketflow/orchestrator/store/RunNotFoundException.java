package com.ticketflow.orchestrator.store;

/**
 * Thrown when a run id is not known to the run store.
 */
public class RunNotFoundException extends RuntimeException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }

    public String getRunId() { return runId; }
}
