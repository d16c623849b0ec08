package com.ticketflow.orchestrator.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One execution of a flow definition: the aggregate root the run controller
 * mutates and the run store projects.
 *
 * The overall state is always recomputed from the step states:
 * SUCCESS iff every step is SUCCESS or SKIPPED, FAILED iff any step is FAILED,
 * RUNNING otherwise once the run has started.
 *
 * Not thread-safe. Exactly one run controller thread owns an instance;
 * observers only ever see {@link RunSnapshot}s.
 */
public class RunRecord {

    private final String              runId;
    private final FlowKind            flowKind;
    private final Map<String, String> parameters;
    private final Instant             createdAt;
    private final Path                runDirectory;
    private final List<StepResult>    steps = new ArrayList<>();

    private RunState overallState = RunState.PENDING;
    private Instant  startedAt;
    private Instant  finishedAt;
    private String   errorSummary;

    public RunRecord(String runId,
                     FlowKind flowKind,
                     List<String> stepNames,
                     Map<String, String> redactedParameters,
                     Path runDirectory,
                     Instant createdAt) {
        this.runId        = Objects.requireNonNull(runId, "runId");
        this.flowKind     = Objects.requireNonNull(flowKind, "flowKind");
        this.parameters   = Map.copyOf(redactedParameters);
        this.runDirectory = Objects.requireNonNull(runDirectory, "runDirectory");
        this.createdAt    = Objects.requireNonNull(createdAt, "createdAt");
        for (String name : stepNames) {
            steps.add(new StepResult(name));
        }
    }

    // ------------------------------------------------------------------
    // Run lifecycle
    // ------------------------------------------------------------------

    /** PENDING → RUNNING. Called once, right after admission. */
    public void markRunning(Instant now) {
        if (overallState != RunState.PENDING) {
            throw new IllegalStateException("Run " + runId + " cannot start from state " + overallState);
        }
        overallState = RunState.RUNNING;
        startedAt    = now;
        recompute(now);
    }

    // ------------------------------------------------------------------
    // Step transitions
    // ------------------------------------------------------------------

    public void startStep(int index, Instant now) {
        requireRunning();
        step(index).start(now);
        recompute(now);
    }

    public void completeStep(int index, Instant now, ExitInfo exit, List<String> artifacts) {
        requireRunning();
        step(index).succeed(now, exit, artifacts);
        recompute(now);
    }

    public void skipStep(int index, Instant now, String reason) {
        requireRunning();
        step(index).skip(now, reason);
        recompute(now);
    }

    public void failStep(int index, Instant now, FailureKind kind, String summary,
                         ExitInfo exit, List<String> artifacts) {
        requireRunning();
        step(index).fail(now, kind, summary, exit, artifacts);
        errorSummary = step(index).getName() + ": " + summary;
        recompute(now);
    }

    private void requireRunning() {
        if (overallState != RunState.RUNNING) {
            throw new IllegalStateException("Run " + runId + " is " + overallState + ", steps cannot change");
        }
    }

    /** Recompute the overall state from the step states. */
    private void recompute(Instant now) {
        boolean anyFailed  = false;
        boolean allDone    = true;
        for (StepResult s : steps) {
            if (s.getState() == StepState.FAILED) anyFailed = true;
            if (s.getState() != StepState.SUCCESS && s.getState() != StepState.SKIPPED) allDone = false;
        }
        if (anyFailed) {
            overallState = RunState.FAILED;
            finishedAt   = now;
        } else if (allDone) {
            overallState = RunState.SUCCESS;
            finishedAt   = now;
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String              getRunId()        { return runId; }
    public FlowKind            getFlowKind()     { return flowKind; }
    public Map<String, String> getParameters()   { return parameters; }
    public Instant             getCreatedAt()    { return createdAt; }
    public Instant             getStartedAt()    { return startedAt; }
    public Instant             getFinishedAt()   { return finishedAt; }
    public Path                getRunDirectory() { return runDirectory; }
    public RunState            getOverallState() { return overallState; }
    public String              getErrorSummary() { return errorSummary; }
    public List<StepResult>    getSteps()        { return Collections.unmodifiableList(steps); }

    public StepResult step(int index) {
        return steps.get(index);
    }

    public RunSnapshot snapshot() {
        return new RunSnapshot(runId, flowKind, parameters, createdAt, startedAt, finishedAt,
                overallState, runDirectory.toString(), errorSummary,
                steps.stream().map(StepResult::snapshot).toList());
    }
}
