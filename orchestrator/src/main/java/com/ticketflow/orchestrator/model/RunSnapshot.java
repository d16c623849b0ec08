package com.ticketflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable, internally consistent projection of a {@link RunRecord}.
 *
 * This is what observers read and what status.json contains. It is never
 * partially updated: the run store swaps whole snapshots.
 */
public record RunSnapshot(
        String              runId,
        FlowKind            flowKind,
        Map<String, String> parameters,
        Instant             createdAt,
        Instant             startedAt,
        Instant             finishedAt,
        RunState            overallState,
        String              runDirectory,
        String              errorSummary,
        List<StepSnapshot>  steps) {

    public RunSnapshot {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        steps      = steps == null ? List.of() : List.copyOf(steps);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return overallState != null && overallState.isTerminal();
    }

    /**
     * Copy of a non-terminal snapshot marked FAILED because the engine stopped
     * while it was active. The running step (or the first pending one) becomes
     * FAILED with {@link FailureKind#INTERRUPTED}.
     */
    public RunSnapshot interrupted(Instant now, String message) {
        if (isTerminal()) return this;
        List<StepSnapshot> updated = new ArrayList<>(steps.size());
        boolean marked = false;
        for (StepSnapshot s : steps) {
            boolean target = !marked && (s.state() == StepState.RUNNING || s.state() == StepState.PENDING);
            if (target) {
                marked = true;
                updated.add(new StepSnapshot(s.name(), StepState.FAILED,
                        s.startedAt() != null ? s.startedAt() : now, now, s.exitInfo(),
                        s.producedArtifacts(), FailureKind.INTERRUPTED, message, null));
            } else {
                updated.add(s);
            }
        }
        return new RunSnapshot(runId, flowKind, parameters, createdAt, startedAt, now,
                RunState.FAILED, runDirectory, message, updated);
    }
}
