package com.ticketflow.orchestrator.api.dto;

import com.ticketflow.orchestrator.model.RunSnapshot;
import com.ticketflow.orchestrator.model.RunState;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response body for GET /runs/{id}: the latest persisted snapshot of a run.
 * Parameters are shown as captured, with secrets redacted.
 */
public record RunResponse(
        String              runId,
        String              flow,
        RunState            state,
        Map<String, String> parameters,
        Instant             createdAt,
        Instant             startedAt,
        Instant             finishedAt,
        String              errorSummary,
        List<StepResponse>  steps
) {
    public static RunResponse from(RunSnapshot run) {
        return new RunResponse(
                run.runId(),
                run.flowKind().id(),
                run.overallState(),
                run.parameters(),
                run.createdAt(),
                run.startedAt(),
                run.finishedAt(),
                run.errorSummary(),
                run.steps().stream().map(StepResponse::from).toList()
        );
    }
}
