package com.ticketflow.orchestrator.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * State machine of a run and its steps.
 */
class RunRecordTest {

    static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    RunRecord record;

    @BeforeEach
    void setUp() {
        record = new RunRecord("r1", FlowKind.JIRA, List.of("a", "b", "c"),
                Map.of("project", "SUP"), Path.of("runs/r1"), T0);
    }

    // ------------------------------------------------------------------
    // Overall state derivation
    // ------------------------------------------------------------------

    @Test
    void newRecord_isPendingWithPendingSteps() {
        assertThat(record.getOverallState()).isEqualTo(RunState.PENDING);
        assertThat(record.getSteps()).extracting(StepResult::getState)
                .containsOnly(StepState.PENDING);
    }

    @Test
    void allStepsSucceededOrSkipped_runSucceeds() {
        record.markRunning(T0);
        record.skipStep(0, T0, "outputs already exist and validate");
        record.startStep(1, T0);
        record.completeStep(1, T0.plusSeconds(5), ExitInfo.exited(0), List.of("artifacts/x.json"));
        assertThat(record.getOverallState()).isEqualTo(RunState.RUNNING);

        record.startStep(2, T0.plusSeconds(5));
        record.completeStep(2, T0.plusSeconds(9), ExitInfo.exited(0), List.of());

        assertThat(record.getOverallState()).isEqualTo(RunState.SUCCESS);
        assertThat(record.getFinishedAt()).isEqualTo(T0.plusSeconds(9));
        assertThat(record.getErrorSummary()).isNull();
    }

    @Test
    void failedStep_failsRunAndCopiesSummary() {
        record.markRunning(T0);
        record.startStep(0, T0);
        record.failStep(0, T0.plusSeconds(1), FailureKind.PROCESS_FAILURE, "Exited with code 2",
                ExitInfo.exited(2), List.of());

        assertThat(record.getOverallState()).isEqualTo(RunState.FAILED);
        assertThat(record.getErrorSummary()).isEqualTo("a: Exited with code 2");
        assertThat(record.step(1).getState()).isEqualTo(StepState.PENDING);
        assertThat(record.step(0).getFailureKind()).isEqualTo(FailureKind.PROCESS_FAILURE);
    }

    @Test
    void pendingStep_canFailWithoutStarting() {
        record.markRunning(T0);
        record.failStep(0, T0, FailureKind.MISSING_INPUT, "Missing required input: x.json (missing)", null, List.of());

        assertThat(record.step(0).getState()).isEqualTo(StepState.FAILED);
        assertThat(record.step(0).getStartedAt()).isEqualTo(T0);
    }

    // ------------------------------------------------------------------
    // Illegal transitions
    // ------------------------------------------------------------------

    @Test
    void stepChange_beforeRunStarted_throws() {
        assertThatThrownBy(() -> record.startStep(0, T0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stepChange_afterRunFailed_throws() {
        record.markRunning(T0);
        record.startStep(0, T0);
        record.failStep(0, T0, FailureKind.TIMEOUT_EXCEEDED, "Timed out", ExitInfo.killedByTimeout(143), List.of());

        assertThatThrownBy(() -> record.startStep(1, T0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void completingPendingStep_throws() {
        record.markRunning(T0);
        assertThatThrownBy(() -> record.completeStep(0, T0, ExitInfo.exited(0), List.of()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void markRunningTwice_throws() {
        record.markRunning(T0);
        assertThatThrownBy(() -> record.markRunning(T0))
                .isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    @Test
    void snapshot_isDetachedFromLaterChanges() {
        record.markRunning(T0);
        RunSnapshot before = record.snapshot();

        record.startStep(0, T0);

        assertThat(before.steps().get(0).state()).isEqualTo(StepState.PENDING);
        assertThat(record.snapshot().steps().get(0).state()).isEqualTo(StepState.RUNNING);
    }

    @Test
    void interrupted_marksRunningStepFailed() {
        record.markRunning(T0);
        record.skipStep(0, T0, "disabled for this run");
        record.startStep(1, T0);

        RunSnapshot interrupted = record.snapshot().interrupted(T0.plusSeconds(60), "Engine stopped");

        assertThat(interrupted.overallState()).isEqualTo(RunState.FAILED);
        assertThat(interrupted.steps()).extracting(StepSnapshot::state)
                .containsExactly(StepState.SKIPPED, StepState.FAILED, StepState.PENDING);
        assertThat(interrupted.steps().get(1).failureKind()).isEqualTo(FailureKind.INTERRUPTED);
    }
}
