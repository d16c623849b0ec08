package com.ticketflow.orchestrator.service;

import com.ticketflow.orchestrator.config.EngineProperties;
import com.ticketflow.orchestrator.flow.ParameterValidationException;
import com.ticketflow.orchestrator.flow.RunParameters;
import com.ticketflow.orchestrator.model.FlowDefinition;
import com.ticketflow.orchestrator.model.RunRecord;
import com.ticketflow.orchestrator.model.RunSnapshot;
import com.ticketflow.orchestrator.model.RunSummary;
import com.ticketflow.orchestrator.runlog.SecretRedactor;
import com.ticketflow.orchestrator.store.ArtifactEntry;
import com.ticketflow.orchestrator.store.LogChunk;
import com.ticketflow.orchestrator.store.RunStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Admits runs up to the configured concurrency bound and runs each admitted
 * run on its own worker thread.
 *
 * Admission is decided under one lock: the active-run count is checked and
 * the slot reserved atomically, so the bound can never be exceeded. Directory
 * creation and dispatch happen outside the lock; the slot is released when the
 * run ends, whether it succeeded, failed, or could not be started.
 *
 * Metrics:
 * <pre>
 *   ticketflow.runs.submitted
 *   ticketflow.runs.rejected
 *   ticketflow.runs.completed{flow, state}
 *   ticketflow.runs.active   (gauge)
 * </pre>
 */
@Service
public class RunScheduler {

    private static final Logger log = LoggerFactory.getLogger(RunScheduler.class);

    private final RunStore         store;
    private final RunController    controller;
    private final RunIdGenerator   ids;
    private final MeterRegistry    meterRegistry;
    private final Clock            clock;
    private final int              maxConcurrentRuns;
    private final ExecutorService  workers;

    private final Object      admissionLock = new Object();
    private final Set<String> activeRuns    = new HashSet<>();

    public RunScheduler(RunStore store,
                        RunController controller,
                        RunIdGenerator ids,
                        EngineProperties properties,
                        MeterRegistry meterRegistry,
                        Clock clock) {
        this.store             = store;
        this.controller        = controller;
        this.ids               = ids;
        this.meterRegistry     = meterRegistry;
        this.clock             = clock;
        this.maxConcurrentRuns = properties.getMaxConcurrentRuns();
        this.workers           = Executors.newFixedThreadPool(maxConcurrentRuns,
                new CustomizableThreadFactory("run-"));
        meterRegistry.gauge("ticketflow.runs.active", activeRuns, set -> activeCount());
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Admit a run and start it in the background.
     *
     * @return the new run's id
     * @throws AdmissionRejectedException   if the concurrency bound is reached
     * @throws ParameterValidationException if the seed run is unknown or has not finished
     */
    public String submit(FlowDefinition flow, RunParameters parameters) {
        String seed = parameters.options().seedFromRunId();
        if (seed != null) {
            if (!store.exists(seed)) {
                throw new ParameterValidationException("seedFrom refers to unknown run " + seed);
            }
            RunSnapshot seedStatus = store.getStatus(seed);
            if (!seedStatus.isTerminal()) {
                throw new ParameterValidationException(
                        "seedFrom run " + seed + " is still " + seedStatus.overallState() + ", only finished runs can seed");
            }
        }

        String runId = ids.next(flow.kind(), parameters.get("project"));
        synchronized (admissionLock) {
            if (activeRuns.size() >= maxConcurrentRuns) {
                meterRegistry.counter("ticketflow.runs.rejected").increment();
                log.info("Rejected {} run: {} of {} slots in use", flow.kind().id(), activeRuns.size(), maxConcurrentRuns);
                throw new AdmissionRejectedException(activeRuns.size());
            }
            activeRuns.add(runId);
        }

        try {
            RunRecord record = new RunRecord(runId, flow.kind(), flow.stepNames(),
                    SecretRedactor.redactParameters(parameters.values()),
                    store.runDirectory(runId), clock.instant());
            record.markRunning(clock.instant());
            store.create(record.snapshot(), seed);
            workers.submit(() -> runAndRelease(record, flow, parameters));
        } catch (RuntimeException | Error e) {
            release(runId);
            if (e instanceof RejectedExecutionException) {
                throw new IllegalStateException("Scheduler is shutting down", e);
            }
            throw e;
        }

        meterRegistry.counter("ticketflow.runs.submitted").increment();
        log.info("Admitted run {} ({} steps)", runId, flow.steps().size());
        return runId;
    }

    private void runAndRelease(RunRecord record, FlowDefinition flow, RunParameters parameters) {
        try {
            controller.execute(record, flow, parameters);
        } catch (Exception e) {
            log.error("Unhandled error in run {}: {}", record.getRunId(), e.getMessage(), e);
        } finally {
            meterRegistry.counter("ticketflow.runs.completed",
                    "flow", flow.kind().id(), "state", record.getOverallState().name()).increment();
            release(record.getRunId());
        }
    }

    private void release(String runId) {
        synchronized (admissionLock) {
            activeRuns.remove(runId);
        }
    }

    public int activeCount() {
        synchronized (admissionLock) {
            return activeRuns.size();
        }
    }

    // ------------------------------------------------------------------
    // Queries (non-blocking reads against the store)
    // ------------------------------------------------------------------

    public RunSnapshot status(String runId) {
        return store.getStatus(runId);
    }

    public List<RunSummary> listRuns() {
        return store.listRuns().stream().map(RunSummary::of).toList();
    }

    public LogChunk tailLog(String runId, long offset) {
        return store.readLog(runId, offset);
    }

    public List<ArtifactEntry> artifacts(String runId) {
        return store.listArtifacts(runId);
    }

    // ------------------------------------------------------------------
    // Shutdown
    // ------------------------------------------------------------------

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Run workers did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
