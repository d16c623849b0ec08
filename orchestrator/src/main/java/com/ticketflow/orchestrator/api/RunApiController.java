package com.ticketflow.orchestrator.api;

import com.ticketflow.orchestrator.api.dto.LogChunkResponse;
import com.ticketflow.orchestrator.api.dto.RunResponse;
import com.ticketflow.orchestrator.api.dto.SubmitRunRequest;
import com.ticketflow.orchestrator.api.dto.SubmitRunResponse;
import com.ticketflow.orchestrator.flow.FlowCatalog;
import com.ticketflow.orchestrator.flow.FlowPlan;
import com.ticketflow.orchestrator.flow.ParameterValidationException;
import com.ticketflow.orchestrator.model.FlowKind;
import com.ticketflow.orchestrator.model.RunSummary;
import com.ticketflow.orchestrator.service.AdmissionRejectedException;
import com.ticketflow.orchestrator.service.RunScheduler;
import com.ticketflow.orchestrator.store.ArtifactEntry;
import com.ticketflow.orchestrator.store.RunNotFoundException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for run lifecycle.
 *
 * POST /runs                   : submit a run of the jitbit or jira flow
 * GET  /runs                   : list runs, newest first
 * GET  /runs/{id}              : poll the status of a run
 * GET  /runs/{id}/log?offset=k : read the run log incrementally
 * GET  /runs/{id}/artifacts    : list the artifacts a run has produced
 */
@RestController
@RequestMapping("/runs")
public class RunApiController {

    private final FlowCatalog  catalog;
    private final RunScheduler scheduler;

    public RunApiController(FlowCatalog catalog, RunScheduler scheduler) {
        this.catalog   = catalog;
        this.scheduler = scheduler;
    }

    /**
     * Submit a new run. Returns immediately; the run proceeds in the background.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"flow":"jira","parameters":{"project":"SUP","resolved_after":"2024-01-01"}}'
     *
     * HTTP 201: admitted
     * HTTP 400: unknown flow or invalid parameters
     * HTTP 429: concurrency limit reached, retry later
     */
    @PostMapping
    public ResponseEntity<SubmitRunResponse> submit(@Valid @RequestBody SubmitRunRequest req) {
        try {
            FlowKind kind = FlowKind.fromId(req.flow());
            FlowPlan plan = catalog.build(kind, req.parameters(), req.toOptions());
            String runId  = scheduler.submit(plan.definition(), plan.parameters());
            return ResponseEntity.status(HttpStatus.CREATED).body(SubmitRunResponse.of(runId));
        } catch (ParameterValidationException | IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (AdmissionRejectedException e) {
            throw new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, e.getMessage(), e);
        }
    }

    @GetMapping
    public List<RunSummary> listRuns() {
        return scheduler.listRuns();
    }

    /**
     * Poll the current state of a run.
     * Returns 404 if the run ID is not found.
     */
    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable String id) {
        try {
            return RunResponse.from(scheduler.status(id));
        } catch (RunNotFoundException e) {
            throw notFound(e);
        }
    }

    /**
     * Read the run log from a byte offset. Repeating a read with the same
     * offset returns the same content until more output is appended.
     *
     * HTTP 400: negative offset
     * HTTP 404: run ID not found
     */
    @GetMapping("/{id}/log")
    public LogChunkResponse getLog(@PathVariable String id,
                                   @RequestParam(defaultValue = "0") long offset) {
        if (offset < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "offset must not be negative");
        }
        try {
            return LogChunkResponse.from(scheduler.tailLog(id, offset));
        } catch (RunNotFoundException e) {
            throw notFound(e);
        }
    }

    @GetMapping("/{id}/artifacts")
    public List<ArtifactEntry> getArtifacts(@PathVariable String id) {
        try {
            return scheduler.artifacts(id);
        } catch (RunNotFoundException e) {
            throw notFound(e);
        }
    }

    private static ResponseStatusException notFound(RunNotFoundException e) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
    }
}
