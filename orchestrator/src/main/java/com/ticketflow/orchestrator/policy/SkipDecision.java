package com.ticketflow.orchestrator.policy;

/**
 * What the run controller should do with one step.
 *
 * @param action        skip, run, or force-run the step
 * @param appendMode    resolve the command with the append variant
 * @param overwriteMode resolve the command with the overwrite variant
 * @param reason        short explanation, written to the run log and (for skips) the step result
 */
public record SkipDecision(Action action, boolean appendMode, boolean overwriteMode, String reason) {

    public enum Action { SKIP, RUN, FORCE }

    public static SkipDecision skip(String reason) {
        return new SkipDecision(Action.SKIP, false, false, reason);
    }

    public boolean shouldSkip() {
        return action == Action.SKIP;
    }
}
