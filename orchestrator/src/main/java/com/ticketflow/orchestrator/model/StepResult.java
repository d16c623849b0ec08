package com.ticketflow.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * Mutable execution record of one step in a run.
 *
 * Only the owning {@link RunRecord} changes it, and only along the
 * transitions documented on {@link StepState}.
 */
public class StepResult {

    private final String name;

    private StepState    state = StepState.PENDING;
    private Instant      startedAt;
    private Instant      endedAt;
    private ExitInfo     exitInfo;
    private List<String> producedArtifacts = List.of();
    private FailureKind  failureKind;
    private String       errorSummary;
    private String       skipReason;

    StepResult(String name) {
        this.name = name;
    }

    // ------------------------------------------------------------------
    // Transitions (package-private: driven by RunRecord)
    // ------------------------------------------------------------------

    void start(Instant now) {
        require(state == StepState.PENDING, "start");
        state     = StepState.RUNNING;
        startedAt = now;
    }

    void succeed(Instant now, ExitInfo exit, List<String> artifacts) {
        require(state == StepState.RUNNING, "succeed");
        state             = StepState.SUCCESS;
        endedAt           = now;
        exitInfo          = exit;
        producedArtifacts = List.copyOf(artifacts);
    }

    void skip(Instant now, String reason) {
        require(state == StepState.PENDING, "skip");
        state      = StepState.SKIPPED;
        startedAt  = now;
        endedAt    = now;
        skipReason = reason;
    }

    void fail(Instant now, FailureKind kind, String summary, ExitInfo exit, List<String> artifacts) {
        require(state == StepState.PENDING || state == StepState.RUNNING, "fail");
        if (startedAt == null) startedAt = now;
        state             = StepState.FAILED;
        endedAt           = now;
        failureKind       = kind;
        errorSummary      = summary;
        exitInfo          = exit;
        producedArtifacts = List.copyOf(artifacts);
    }

    private void require(boolean allowed, String transition) {
        if (!allowed) {
            throw new IllegalStateException(
                    "Step '" + name + "' cannot " + transition + " from state " + state);
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String       getName()              { return name; }
    public StepState    getState()             { return state; }
    public Instant      getStartedAt()         { return startedAt; }
    public Instant      getEndedAt()           { return endedAt; }
    public ExitInfo     getExitInfo()          { return exitInfo; }
    public List<String> getProducedArtifacts() { return producedArtifacts; }
    public FailureKind  getFailureKind()       { return failureKind; }
    public String       getErrorSummary()      { return errorSummary; }
    public String       getSkipReason()        { return skipReason; }

    public StepSnapshot snapshot() {
        return new StepSnapshot(name, state, startedAt, endedAt, exitInfo,
                producedArtifacts, failureKind, errorSummary, skipReason);
    }
}
