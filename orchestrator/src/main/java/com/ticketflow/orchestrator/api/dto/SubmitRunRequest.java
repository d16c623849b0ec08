package com.ticketflow.orchestrator.api.dto;

import com.ticketflow.orchestrator.flow.RunOptions;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Request body for POST /runs.
 *
 * Required: flow ("jitbit" or "jira")
 * Optional: parameters of the flow, option flags (null means the default),
 *   seedFrom: id of an earlier run whose artifacts are copied into the new run.
 */
public record SubmitRunRequest(
        @NotBlank String    flow,
        Map<String, Object> parameters,
        Boolean             skipExisting,
        Boolean             overwrite,
        Boolean             append,
        Boolean             skipDeduplication,
        String              seedFrom
) {
    public SubmitRunRequest {
        if (parameters == null) parameters = Map.of();
    }

    public RunOptions toOptions() {
        RunOptions defaults = RunOptions.defaults();
        return new RunOptions(
                skipExisting      != null ? skipExisting      : defaults.skipExisting(),
                overwrite         != null ? overwrite         : defaults.overwrite(),
                append            != null ? append            : defaults.append(),
                skipDeduplication != null ? skipDeduplication : defaults.skipDeduplication(),
                seedFrom == null || seedFrom.isBlank() ? null : seedFrom.trim());
    }
}
