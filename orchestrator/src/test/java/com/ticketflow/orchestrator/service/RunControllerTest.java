package com.ticketflow.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ticketflow.orchestrator.artifact.ArtifactValidator;
import com.ticketflow.orchestrator.config.EngineProperties;
import com.ticketflow.orchestrator.environment.EnvironmentCheck;
import com.ticketflow.orchestrator.executor.StepExecutor;
import com.ticketflow.orchestrator.flow.RunOptions;
import com.ticketflow.orchestrator.flow.RunParameters;
import com.ticketflow.orchestrator.model.CommandTemplate;
import com.ticketflow.orchestrator.model.FailureKind;
import com.ticketflow.orchestrator.model.FlowDefinition;
import com.ticketflow.orchestrator.model.FlowKind;
import com.ticketflow.orchestrator.model.RunRecord;
import com.ticketflow.orchestrator.model.RunSnapshot;
import com.ticketflow.orchestrator.model.RunState;
import com.ticketflow.orchestrator.model.StepDescriptor;
import com.ticketflow.orchestrator.model.StepSnapshot;
import com.ticketflow.orchestrator.model.StepState;
import com.ticketflow.orchestrator.policy.SkipPolicy;
import com.ticketflow.orchestrator.store.FileRunStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

/**
 * Drives whole runs with {@code sh} scripts standing in for the external programs.
 * No Spring context; the real store, validator, policy and executor are wired by hand.
 */
class RunControllerTest {

    @TempDir Path root;

    EngineProperties    properties;
    ObjectMapper        mapper;
    FileRunStore        store;
    SimpleMeterRegistry meterRegistry;
    RunController       controller;
    Clock               clock = Clock.systemDefaultZone();
    int                 runCounter;

    final Map<String, String> env = new HashMap<>(Map.of(
            "JITBIT_API_TOKEN", "jitbit-token",
            "JITBIT_BASE_URL", "https://support.example.com",
            "JIRA_EMAIL", "ops@example.com",
            "JIRA_API_TOKEN", "jira-token",
            "SCW_SECRET_KEY", "scw-secret",
            "SCW_OPENAI_BASE_URL", "https://api.scaleway.ai/v1"));

    @BeforeEach
    void setUp() {
        assumeFalse(System.getProperty("os.name").startsWith("Windows"));

        properties = new EngineProperties();
        properties.setRunsDir(root);
        properties.setDefaultStepTimeout(Duration.ofSeconds(20));
        properties.setKillGracePeriod(Duration.ofSeconds(1));

        mapper        = new ObjectMapper();
        meterRegistry = new SimpleMeterRegistry();
        useStore(new FileRunStore(properties, mapper, clock));
    }

    private void useStore(FileRunStore runStore) {
        ArtifactValidator validator = new ArtifactValidator(mapper);
        store      = runStore;
        controller = new RunController(new SkipPolicy(validator), validator, new StepExecutor(properties),
                store, new EnvironmentCheck(env::get), properties, meterRegistry, clock);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static StepDescriptor.Builder step(String name, String script) {
        return StepDescriptor.builder(name, CommandTemplate.program("sh", "-c", script).build());
    }

    private RunRecord newRun(FlowDefinition flow) {
        String runId = "run-" + (++runCounter);
        RunRecord record = new RunRecord(runId, flow.kind(), flow.stepNames(), Map.of(),
                store.runDirectory(runId), clock.instant());
        record.markRunning(clock.instant());
        store.create(record.snapshot(), null);
        return record;
    }

    private RunSnapshot run(RunRecord record, FlowDefinition flow) {
        controller.execute(record, flow, new RunParameters(Map.of(), RunOptions.defaults()));
        return store.getStatus(record.getRunId());
    }

    private static List<StepState> states(RunSnapshot snapshot) {
        return snapshot.steps().stream().map(StepSnapshot::state).toList();
    }

    // ------------------------------------------------------------------
    // Successful runs
    // ------------------------------------------------------------------

    @Test
    void existingOutputs_areSkipped_remainingStepRuns() throws Exception {
        FlowDefinition flow = new FlowDefinition(FlowKind.JITBIT, List.of(
                step("export", "echo should-not-run > ran-export.txt; echo '[]' > a.json").produces("a.json").build(),
                step("llm", "echo should-not-run > ran-llm.txt; echo '[]' > b.json").requires("a.json").produces("b.json").build(),
                step("docx", "mkdir -p docs && echo PK > docs/T-1.docx").requires("b.json").produces("docs/").build()));
        RunRecord record = newRun(flow);
        Path dir = record.getRunDirectory();
        Files.writeString(dir.resolve("a.json"), "[{\"id\":1}]");
        Files.writeString(dir.resolve("b.json"), "[{\"id\":1}]");

        RunSnapshot result = run(record, flow);

        assertThat(states(result)).containsExactly(StepState.SKIPPED, StepState.SKIPPED, StepState.SUCCESS);
        assertThat(result.overallState()).isEqualTo(RunState.SUCCESS);
        assertThat(dir.resolve("ran-export.txt")).doesNotExist();
        assertThat(dir.resolve("ran-llm.txt")).doesNotExist();
        assertThat(result.steps().get(2).producedArtifacts()).containsExactly("artifacts/docs/");
        assertThat(dir.resolve("artifacts/docs/T-1.docx")).exists();
        assertThat(result.steps().get(0).skipReason()).isEqualTo("outputs already exist and validate");
    }

    @Test
    void successfulRun_writesMarkersAndMetrics() {
        FlowDefinition flow = new FlowDefinition(FlowKind.JIRA, List.of(
                step("export", "echo exporting; echo '[1]' > e.json").produces("e.json").build()));
        RunRecord record = newRun(flow);

        RunSnapshot result = run(record, flow);

        assertThat(result.overallState()).isEqualTo(RunState.SUCCESS);
        assertThat(result.finishedAt()).isNotNull();
        String log = store.readLog(record.getRunId(), 0).text();
        assertThat(log)
                .contains("=== RUN START: jira")
                .contains("=== STEP START: export ===")
                .contains("] exporting")
                .contains("=== STEP END: export - SUCCESS ===")
                .contains("=== RUN END: SUCCESS ===");
        assertThat(meterRegistry.find("ticketflow.step.duration")
                .tags("step", "export", "outcome", "success").timer()).isNotNull();
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void timeout_failsStep_keepsEarlierArtifacts() {
        FlowDefinition flow = new FlowDefinition(FlowKind.JIRA, List.of(
                step("export", "echo '[]' > a.json").produces("a.json").build(),
                step("llm", "sleep 30").requires("a.json").produces("b.json")
                        .timeout(Duration.ofMillis(300)).build()));
        RunRecord record = newRun(flow);

        RunSnapshot result = run(record, flow);

        assertThat(states(result)).containsExactly(StepState.SUCCESS, StepState.FAILED);
        assertThat(result.steps().get(1).failureKind()).isEqualTo(FailureKind.TIMEOUT_EXCEEDED);
        assertThat(result.steps().get(1).exitInfo().timedOut()).isTrue();
        assertThat(result.overallState()).isEqualTo(RunState.FAILED);
        assertThat(result.errorSummary()).startsWith("llm: Timed out");
        assertThat(record.getRunDirectory().resolve("artifacts/a.json")).exists();
    }

    @Test
    void nonZeroExit_stopsRun_laterStepsNeverStart() {
        FlowDefinition flow = new FlowDefinition(FlowKind.JIRA, List.of(
                step("export", "echo '[]' > a.json").produces("a.json").build(),
                step("llm", "echo 'quota exceeded'; exit 2").produces("b.json").build(),
                step("docx", "echo ran > docx-ran.txt").produces("docx-ran.txt").build()));
        RunRecord record = newRun(flow);

        RunSnapshot result = run(record, flow);

        assertThat(states(result)).containsExactly(StepState.SUCCESS, StepState.FAILED, StepState.PENDING);
        StepSnapshot failed = result.steps().get(1);
        assertThat(failed.failureKind()).isEqualTo(FailureKind.PROCESS_FAILURE);
        assertThat(failed.exitInfo().exitCode()).isEqualTo(2);
        assertThat(failed.errorSummary()).contains("Exited with code 2").contains("quota exceeded");
        assertThat(record.getRunDirectory().resolve("docx-ran.txt")).doesNotExist();
        assertThat(store.readLog(record.getRunId(), 0).text())
                .contains("=== STEP END: llm - FAILED ===")
                .contains("=== RUN END: FAILED ===");
    }

    @Test
    void invalidOutput_afterExitZero_failsValidation() {
        FlowDefinition flow = new FlowDefinition(FlowKind.JITBIT, List.of(
                step("llm", "printf '[{' > out.json").produces("out.json").build()));
        RunRecord record = newRun(flow);

        RunSnapshot result = run(record, flow);

        StepSnapshot step = result.steps().get(0);
        assertThat(step.state()).isEqualTo(StepState.FAILED);
        assertThat(step.failureKind()).isEqualTo(FailureKind.OUTPUT_VALIDATION_FAILED);
        assertThat(step.exitInfo().exitCode()).isZero();
        assertThat(step.errorSummary()).contains("out.json").contains("malformed JSON");
    }

    @Test
    void missingInput_failsWithoutLaunching() {
        FlowDefinition flow = new FlowDefinition(FlowKind.JITBIT, List.of(
                step("docx", "echo ran > launched.txt").requires("Ticket_Data_Jitbit.json").produces("launched.txt").build()));
        RunRecord record = newRun(flow);

        RunSnapshot result = run(record, flow);

        StepSnapshot step = result.steps().get(0);
        assertThat(step.failureKind()).isEqualTo(FailureKind.MISSING_INPUT);
        assertThat(step.exitInfo()).isNull();
        assertThat(step.errorSummary()).contains("Ticket_Data_Jitbit.json");
        assertThat(record.getRunDirectory().resolve("launched.txt")).doesNotExist();
        assertThat(result.overallState()).isEqualTo(RunState.FAILED);
    }

    @Test
    void disabledStep_isSkipped_runStillSucceeds() {
        FlowDefinition flow = new FlowDefinition(FlowKind.JIRA, List.of(
                step("dedup", "exit 1").produces("d.json").build().disabled(),
                step("docx", "echo PK > t.docx").produces("t.docx").build()));
        RunRecord record = newRun(flow);

        RunSnapshot result = run(record, flow);

        assertThat(states(result)).containsExactly(StepState.SKIPPED, StepState.SUCCESS);
        assertThat(result.steps().get(0).skipReason()).isEqualTo("disabled for this run");
        assertThat(result.overallState()).isEqualTo(RunState.SUCCESS);
    }

    @Test
    void incompleteEnvironment_failsFirstStep_withoutLaunching() {
        env.remove("JITBIT_API_TOKEN");
        FlowDefinition flow = new FlowDefinition(FlowKind.JITBIT, List.of(
                step("export", "echo ran > launched.txt").produces("launched.txt").build(),
                step("docx", "echo ran > docx.txt").produces("docx.txt").build()));
        RunRecord record = newRun(flow);

        RunSnapshot result = run(record, flow);

        assertThat(states(result)).containsExactly(StepState.FAILED, StepState.PENDING);
        StepSnapshot first = result.steps().get(0);
        assertThat(first.failureKind()).isEqualTo(FailureKind.MISSING_INPUT);
        assertThat(first.errorSummary())
                .startsWith("Environment validation failed")
                .contains("JITBIT_API_TOKEN");
        assertThat(record.getRunDirectory().resolve("launched.txt")).doesNotExist();
        assertThat(store.readLog(record.getRunId(), 0).text())
                .doesNotContain("=== STEP START")
                .contains("=== RUN END: FAILED ===");
    }

    // ------------------------------------------------------------------
    // Unexpected errors
    // ------------------------------------------------------------------

    @Test
    void statusWriteFailure_afterStepSucceeds_runStillEndsFailed() {
        AtomicBoolean thrown = new AtomicBoolean();
        useStore(new FileRunStore(properties, mapper, clock) {
            @Override
            public void save(RunSnapshot snapshot) {
                boolean afterSuccess = snapshot.steps().stream().anyMatch(s -> s.state() == StepState.SUCCESS);
                if (afterSuccess && thrown.compareAndSet(false, true)) {
                    throw new UncheckedIOException(new IOException("disk full"));
                }
                super.save(snapshot);
            }
        });
        FlowDefinition flow = new FlowDefinition(FlowKind.JIRA, List.of(
                step("export", "echo '[]' > a.json").produces("a.json").build(),
                step("llm", "echo '[]' > b.json").requires("a.json").produces("b.json").build()));
        RunRecord record = newRun(flow);

        RunSnapshot result = run(record, flow);

        assertThat(thrown).isTrue();
        assertThat(record.getOverallState()).isEqualTo(RunState.FAILED);
        assertThat(result.overallState()).isEqualTo(RunState.FAILED);
        assertThat(states(result)).containsExactly(StepState.SUCCESS, StepState.FAILED);
        StepSnapshot aborted = result.steps().get(1);
        assertThat(aborted.failureKind()).isEqualTo(FailureKind.PROCESS_FAILURE);
        assertThat(aborted.errorSummary()).startsWith("Unexpected error").contains("disk full");
        assertThat(store.readLog(record.getRunId(), 0).text()).contains("=== RUN END: FAILED ===");
    }
}
