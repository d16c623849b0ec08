package com.ticketflow.orchestrator.service;

import com.ticketflow.orchestrator.artifact.ArtifactCheck;
import com.ticketflow.orchestrator.artifact.ArtifactValidator;
import com.ticketflow.orchestrator.config.EngineProperties;
import com.ticketflow.orchestrator.environment.EnvironmentCheck;
import com.ticketflow.orchestrator.executor.ExecutorException;
import com.ticketflow.orchestrator.executor.StepExecutor;
import com.ticketflow.orchestrator.executor.StepOutcome;
import com.ticketflow.orchestrator.flow.RunParameters;
import com.ticketflow.orchestrator.model.ExitInfo;
import com.ticketflow.orchestrator.model.FailureKind;
import com.ticketflow.orchestrator.model.FlowDefinition;
import com.ticketflow.orchestrator.model.RunRecord;
import com.ticketflow.orchestrator.model.StepDescriptor;
import com.ticketflow.orchestrator.model.StepState;
import com.ticketflow.orchestrator.policy.SkipDecision;
import com.ticketflow.orchestrator.policy.SkipPolicy;
import com.ticketflow.orchestrator.runlog.RunLog;
import com.ticketflow.orchestrator.runlog.SecretRedactor;
import com.ticketflow.orchestrator.store.RunStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one run through its flow, one step at a time.
 *
 * Before the first step the credentials the flow's programs need are checked;
 * an incomplete environment fails the first step with MISSING_INPUT.
 *
 * For each step:
 *   1. ask the skip policy; a skipped step launches nothing
 *   2. check the required inputs; a missing one fails the step before launch
 *   3. mark the step RUNNING and run the program synchronously
 *   4. exit 0 with valid outputs is success, everything else fails the step
 *   5. copy the outputs of a successful step into artifacts/
 *
 * The first failed step ends the run; later steps stay PENDING. Every
 * transition is persisted before the next one happens.
 */
@Component
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final SkipPolicy        skipPolicy;
    private final ArtifactValidator validator;
    private final StepExecutor      executor;
    private final RunStore          store;
    private final EnvironmentCheck  environment;
    private final EngineProperties  properties;
    private final MeterRegistry     meterRegistry;
    private final Clock             clock;

    public RunController(SkipPolicy skipPolicy,
                         ArtifactValidator validator,
                         StepExecutor executor,
                         RunStore store,
                         EnvironmentCheck environment,
                         EngineProperties properties,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.skipPolicy    = skipPolicy;
        this.validator     = validator;
        this.executor      = executor;
        this.store         = store;
        this.environment   = environment;
        this.properties    = properties;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Entry point, called by RunScheduler on the run's worker thread
    // ------------------------------------------------------------------

    /**
     * Execute every step of {@code flow} against {@code record}, which must be RUNNING.
     * Returns when the run is terminal. Step failures are recorded on the run,
     * never thrown.
     */
    public void execute(RunRecord record, FlowDefinition flow, RunParameters parameters) {
        MDC.put("runId", record.getRunId());
        MDC.put("flow",  flow.kind().id());
        RunLog runLog = new RunLog(store, record.getRunId(), clock);
        try {
            log.info("Starting run {} ({} steps)", record.getRunId(), flow.steps().size());
            runLog.info("=== RUN START: " + flow.kind().id() + " (" + record.getRunId() + ") ===");
            runLog.info("Parameters: " + SecretRedactor.redactParameters(parameters.values()));
            runLog.info("Options: " + parameters.options());

            Map<String, String> bindings = bindings(record.getRunDirectory(), parameters);
            if (environmentReady(record, flow, runLog)) {
                for (int i = 0; i < flow.steps().size(); i++) {
                    StepDescriptor step = flow.steps().get(i);
                    MDC.put("step", step.name());
                    if (!runStep(record, i, step, parameters, bindings, runLog)) {
                        break;
                    }
                }
            }
            MDC.remove("step");
            runLog.info("=== RUN END: " + record.getOverallState() + " ===");
            log.info("Run {} finished: {}", record.getRunId(), record.getOverallState());
        } catch (RuntimeException e) {
            log.error("Unexpected error in run {}: {}", record.getRunId(), e.getMessage(), e);
            abort(record, "Unexpected error: " + e.getMessage(), runLog);
        } finally {
            MDC.remove("step");
            MDC.remove("flow");
            MDC.remove("runId");
        }
    }

    /** @return false if the run was failed because credentials are missing or malformed */
    private boolean environmentReady(RunRecord record, FlowDefinition flow, RunLog runLog) {
        List<String> problems = environment.problemsFor(flow.kind());
        if (problems.isEmpty()) {
            runLog.info("Environment validation passed");
            return true;
        }
        String summary = "Environment validation failed: " + String.join("; ", problems);
        record.failStep(0, clock.instant(), FailureKind.MISSING_INPUT, summary, null, List.of());
        persist(record);
        log.warn("Run {} not started: {}", record.getRunId(), summary);
        runLog.error(summary);
        return false;
    }

    // ------------------------------------------------------------------
    // One step
    // ------------------------------------------------------------------

    /** @return true if the run may continue with the next step */
    private boolean runStep(RunRecord record, int index, StepDescriptor step, RunParameters parameters,
                            Map<String, String> bindings, RunLog runLog) {
        Path runDir = record.getRunDirectory();

        SkipDecision decision = skipPolicy.decide(step, parameters.options(), runDir);
        if (decision.shouldSkip()) {
            runLog.info("Skipping step: " + step.name() + " (" + decision.reason() + ")");
            record.skipStep(index, clock.instant(), decision.reason());
            persist(record);
            return true;
        }

        List<ArtifactCheck> missing = validator.checkAll(runDir, step.requiredInputs()).stream()
                .filter(c -> !c.valid())
                .toList();
        if (!missing.isEmpty()) {
            fail(record, index, step, FailureKind.MISSING_INPUT,
                    "Missing required input: " + describe(missing), null, runLog);
            return false;
        }

        record.startStep(index, clock.instant());
        persist(record);
        runLog.clearRecentOutput();
        runLog.stepStart(step.name());
        runLog.info("Mode: " + decision.action() + " (" + decision.reason() + ")");

        List<String> command;
        try {
            command = step.command().resolve(bindings, decision.appendMode(), decision.overwriteMode());
        } catch (IllegalArgumentException e) {
            fail(record, index, step, FailureKind.PROCESS_FAILURE, e.getMessage(), null, runLog);
            return false;
        }
        runLog.command(command);

        Duration timeout = step.timeout() != null ? step.timeout() : properties.getDefaultStepTimeout();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcomeTag = "failed";
        try {
            StepOutcome outcome;
            try {
                outcome = executor.execute(command, runDir, timeout, runLog);
            } catch (ExecutorException e) {
                log.warn("Step {} could not run {}: {}", step.name(), e.getProgram(), e.getMessage());
                fail(record, index, step, FailureKind.PROCESS_FAILURE, e.getMessage(), null, runLog);
                return false;
            }
            runLog.info("Exit code: " + outcome.exitCode() + " after " + outcome.elapsed().toSeconds() + "s");

            if (outcome.timedOut()) {
                outcomeTag = "timeout";
                fail(record, index, step, FailureKind.TIMEOUT_EXCEEDED,
                        "Timed out after " + timeout.toSeconds() + "s", outcome.exitInfo(), runLog);
                return false;
            }
            if (!outcome.success()) {
                fail(record, index, step, FailureKind.PROCESS_FAILURE,
                        "Exited with code " + outcome.exitCode(), outcome.exitInfo(), runLog);
                return false;
            }

            List<ArtifactCheck> invalid = validator.checkAll(runDir, step.declaredOutputs()).stream()
                    .filter(c -> !c.valid())
                    .toList();
            if (!invalid.isEmpty()) {
                fail(record, index, step, FailureKind.OUTPUT_VALIDATION_FAILED,
                        "Invalid output: " + describe(invalid), outcome.exitInfo(), runLog);
                return false;
            }

            List<String> artifacts = store.captureArtifacts(record.getRunId(), step.declaredOutputs());
            record.completeStep(index, clock.instant(), outcome.exitInfo(), artifacts);
            persist(record);
            runLog.stepEnd(step.name(), true);
            outcomeTag = "success";
            return true;
        } finally {
            sample.stop(meterRegistry.timer("ticketflow.step.duration",
                    "step", step.name(), "outcome", outcomeTag));
        }
    }

    // ------------------------------------------------------------------
    // Failure handling
    // ------------------------------------------------------------------

    private void fail(RunRecord record, int index, StepDescriptor step, FailureKind kind, String summary,
                      ExitInfo exit, RunLog runLog) {
        List<String> tail = runLog.recentOutput();
        String detail = tail.isEmpty() ? summary : summary + "\nLast output:\n" + String.join("\n", tail);

        record.failStep(index, clock.instant(), kind, detail, exit, List.of());
        persist(record);

        log.warn("Step '{}' failed ({}): {}", step.name(), kind, summary);
        runLog.error("Step failed (" + kind + "): " + summary);
        if (!tail.isEmpty()) {
            runLog.error("Last " + tail.size() + " lines of output:");
            tail.forEach(line -> runLog.error("  " + line));
        }
        runLog.stepEnd(step.name(), false);
    }

    /**
     * Close a run that an unexpected error left open. The first step that has
     * not finished is failed, which makes the run FAILED. Errors while
     * persisting or logging are logged and not rethrown.
     */
    private void abort(RunRecord record, String summary, RunLog runLog) {
        if (record.getOverallState().isTerminal()) {
            return;
        }
        int open = firstUnfinishedStep(record);
        if (open < 0) {
            return;
        }
        record.failStep(open, clock.instant(), FailureKind.PROCESS_FAILURE, summary, null, List.of());
        try {
            persist(record);
        } catch (RuntimeException e) {
            log.error("Could not persist failure of run {}: {}", record.getRunId(), e.getMessage(), e);
        }
        try {
            runLog.error(record.step(open).getName() + ": " + summary);
            runLog.info("=== RUN END: " + record.getOverallState() + " ===");
        } catch (RuntimeException e) {
            log.error("Could not write the end of run {} to its log: {}", record.getRunId(), e.getMessage(), e);
        }
    }

    private static int firstUnfinishedStep(RunRecord record) {
        for (int i = 0; i < record.getSteps().size(); i++) {
            StepState state = record.step(i).getState();
            if (state == StepState.PENDING || state == StepState.RUNNING) {
                return i;
            }
        }
        return -1;
    }

    private void persist(RunRecord record) {
        store.save(record.snapshot());
    }

    private Map<String, String> bindings(Path runDir, RunParameters parameters) {
        Map<String, String> bindings = new HashMap<>(parameters.values());
        bindings.put("python",      properties.getPythonExecutable());
        bindings.put("scripts_dir", properties.getScriptsDir().toAbsolutePath().normalize().toString());
        bindings.put("run_dir",     runDir.toAbsolutePath().toString());
        return bindings;
    }

    private static String describe(List<ArtifactCheck> checks) {
        return String.join(", ", checks.stream().map(ArtifactCheck::toString).toList());
    }
}
