package com.ticketflow.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable projection of a {@link StepResult}, as persisted in status.json.
 */
public record StepSnapshot(
        String       name,
        StepState    state,
        Instant      startedAt,
        Instant      endedAt,
        ExitInfo     exitInfo,
        List<String> producedArtifacts,
        FailureKind  failureKind,
        String       errorSummary,
        String       skipReason) {

    public StepSnapshot {
        producedArtifacts = producedArtifacts == null ? List.of() : List.copyOf(producedArtifacts);
    }

    /** A pending step as written when the run is created. */
    public static StepSnapshot pending(String name) {
        return new StepSnapshot(name, StepState.PENDING, null, null, null, List.of(), null, null, null);
    }
}
