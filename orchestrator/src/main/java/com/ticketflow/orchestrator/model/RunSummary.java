package com.ticketflow.orchestrator.model;

import java.time.Instant;

/**
 * One row of the run listing.
 */
public record RunSummary(
        String   runId,
        FlowKind flowKind,
        RunState overallState,
        Instant  createdAt,
        Instant  finishedAt,
        int      totalSteps,
        int      finishedSteps,
        String   currentStep) {

    public static RunSummary of(RunSnapshot snapshot) {
        int finished = 0;
        String current = null;
        for (StepSnapshot step : snapshot.steps()) {
            if (step.state().isTerminal()) finished++;
            if (step.state() == StepState.RUNNING) current = step.name();
        }
        return new RunSummary(snapshot.runId(), snapshot.flowKind(), snapshot.overallState(),
                snapshot.createdAt(), snapshot.finishedAt(), snapshot.steps().size(), finished, current);
    }
}
