package com.ticketflow.orchestrator.api.dto;

/**
 * Response body for POST /runs. Poll {@code statusUrl} and {@code logUrl} for progress.
 */
public record SubmitRunResponse(String runId, String statusUrl, String logUrl) {

    public static SubmitRunResponse of(String runId) {
        return new SubmitRunResponse(runId, "/runs/" + runId, "/runs/" + runId + "/log?offset=0");
    }
}
