package com.ticketflow.orchestrator.policy;

import com.ticketflow.orchestrator.artifact.ArtifactValidator;
import com.ticketflow.orchestrator.flow.RunOptions;
import com.ticketflow.orchestrator.model.StepDescriptor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Decides whether a step must execute, may be skipped, or must be forced.
 *
 * <pre>
 *   skipExisting | overwrite | outputs valid | decision
 *   -------------+-----------+---------------+---------------------------------
 *   true         | false     | yes           | SKIP
 *   true         | false     | no            | RUN
 *   false        | false     | any           | RUN
 *   any          | true      | any           | FORCE (append / overwrite variant)
 * </pre>
 *
 * Disabled steps are always skipped. A step that declares no outputs cannot
 * prove it already ran, so skipExisting never skips it. Append mode is only
 * honoured for descriptors that support it.
 */
@Component
public class SkipPolicy {

    private final ArtifactValidator validator;

    public SkipPolicy(ArtifactValidator validator) {
        this.validator = validator;
    }

    public SkipDecision decide(StepDescriptor step, RunOptions options, Path runDirectory) {
        if (!step.enabled()) {
            return SkipDecision.skip("disabled for this run");
        }

        boolean appendMode = options.append() && step.supportsAppend();

        if (options.overwrite()) {
            boolean overwriteMode = step.supportsOverwriteFlag() && !appendMode;
            return new SkipDecision(SkipDecision.Action.FORCE, appendMode, overwriteMode,
                    appendMode ? "forced (append mode)" : "forced (overwrite mode)");
        }

        if (options.skipExisting()
                && !step.declaredOutputs().isEmpty()
                && validator.allValid(runDirectory, step.declaredOutputs())) {
            return SkipDecision.skip("outputs already exist and validate");
        }

        String reason;
        if (!options.skipExisting()) {
            reason = "skip-existing disabled";
        } else if (step.declaredOutputs().isEmpty()) {
            reason = "step declares no outputs";
        } else {
            reason = "outputs missing or invalid";
        }
        return new SkipDecision(SkipDecision.Action.RUN, appendMode, false,
                appendMode ? reason + " (append mode)" : reason);
    }
}
