package com.ticketflow.orchestrator.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ticketflow.orchestrator.artifact.ArtifactValidator;
import com.ticketflow.orchestrator.flow.RunOptions;
import com.ticketflow.orchestrator.model.CommandTemplate;
import com.ticketflow.orchestrator.model.StepDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Decision table of the skip policy.
 */
class SkipPolicyTest {

    @TempDir Path runDir;

    SkipPolicy policy;
    StepDescriptor appendable;
    StepDescriptor overwritable;

    @BeforeEach
    void setUp() {
        policy = new SkipPolicy(new ArtifactValidator(new ObjectMapper()));
        appendable = StepDescriptor.builder("llm",
                        CommandTemplate.program("x").appendVariant("--append").build())
                .produces("out.json")
                .supportsAppend()
                .build();
        overwritable = StepDescriptor.builder("export",
                        CommandTemplate.program("x").overwriteVariant("--overwrite").build())
                .produces("out.json")
                .supportsOverwriteFlag()
                .build();
    }

    static RunOptions options(boolean skipExisting, boolean overwrite, boolean append) {
        return new RunOptions(skipExisting, overwrite, append, false, null);
    }

    private void writeValidOutput() throws IOException {
        Files.writeString(runDir.resolve("out.json"), "[]");
    }

    @Test
    void skipExisting_withValidOutputs_skips() throws IOException {
        writeValidOutput();

        SkipDecision d = policy.decide(appendable, options(true, false, false), runDir);

        assertThat(d.shouldSkip()).isTrue();
        assertThat(d.reason()).isEqualTo("outputs already exist and validate");
    }

    @Test
    void skipExisting_withInvalidOutputs_runs() throws IOException {
        Files.writeString(runDir.resolve("out.json"), "[{");

        SkipDecision d = policy.decide(appendable, options(true, false, false), runDir);

        assertThat(d.action()).isEqualTo(SkipDecision.Action.RUN);
        assertThat(d.reason()).isEqualTo("outputs missing or invalid");
    }

    @Test
    void skipExistingDisabled_runsEvenWithValidOutputs() throws IOException {
        writeValidOutput();
        assertThat(policy.decide(appendable, options(false, false, false), runDir).action())
                .isEqualTo(SkipDecision.Action.RUN);
    }

    @Test
    void overwrite_winsOverSkipExisting() throws IOException {
        writeValidOutput();

        SkipDecision d = policy.decide(overwritable, options(true, true, false), runDir);

        assertThat(d.action()).isEqualTo(SkipDecision.Action.FORCE);
        assertThat(d.overwriteMode()).isTrue();
        assertThat(d.appendMode()).isFalse();
    }

    @Test
    void overwrite_withoutOverwriteFlagSupport_forcesPlainRun() {
        SkipDecision d = policy.decide(appendable, options(true, true, false), runDir);

        assertThat(d.action()).isEqualTo(SkipDecision.Action.FORCE);
        assertThat(d.overwriteMode()).isFalse();
    }

    @Test
    void append_honoredOnlyWhenSupported() {
        assertThat(policy.decide(appendable, options(false, false, true), runDir).appendMode()).isTrue();
        assertThat(policy.decide(overwritable, options(false, false, true), runDir).appendMode()).isFalse();
    }

    @Test
    void appendAndOverwrite_appendWins() {
        StepDescriptor both = StepDescriptor.builder("both",
                        CommandTemplate.program("x").appendVariant("--append").overwriteVariant("--overwrite").build())
                .produces("out.json")
                .supportsAppend()
                .supportsOverwriteFlag()
                .build();

        SkipDecision d = policy.decide(both, options(true, true, true), runDir);

        assertThat(d.appendMode()).isTrue();
        assertThat(d.overwriteMode()).isFalse();
    }

    @Test
    void disabledStep_alwaysSkipped() {
        SkipDecision d = policy.decide(appendable.disabled(), options(false, true, false), runDir);
        assertThat(d.shouldSkip()).isTrue();
        assertThat(d.reason()).isEqualTo("disabled for this run");
    }

    @Test
    void stepWithoutOutputs_neverSkippedByExistence() {
        StepDescriptor noOutputs = StepDescriptor.builder("n", CommandTemplate.program("x").build()).build();

        SkipDecision d = policy.decide(noOutputs, options(true, false, false), runDir);

        assertThat(d.action()).isEqualTo(SkipDecision.Action.RUN);
        assertThat(d.reason()).isEqualTo("step declares no outputs");
    }
}
