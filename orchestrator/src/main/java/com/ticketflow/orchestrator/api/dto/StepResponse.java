package com.ticketflow.orchestrator.api.dto;

import com.ticketflow.orchestrator.model.FailureKind;
import com.ticketflow.orchestrator.model.StepSnapshot;
import com.ticketflow.orchestrator.model.StepState;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of one step inside GET /runs/{id}.
 */
public record StepResponse(
        String       name,
        StepState    state,
        Instant      startedAt,
        Instant      endedAt,
        Integer      exitCode,
        boolean      timedOut,
        FailureKind  failureKind,
        String       errorSummary,
        String       skipReason,
        List<String> producedArtifacts
) {
    public static StepResponse from(StepSnapshot s) {
        return new StepResponse(
                s.name(),
                s.state(),
                s.startedAt(),
                s.endedAt(),
                s.exitInfo() != null ? s.exitInfo().exitCode() : null,
                s.exitInfo() != null && s.exitInfo().timedOut(),
                s.failureKind(),
                s.errorSummary(),
                s.skipReason(),
                s.producedArtifacts()
        );
    }
}
