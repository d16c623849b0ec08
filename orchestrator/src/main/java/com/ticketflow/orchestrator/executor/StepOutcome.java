package com.ticketflow.orchestrator.executor;

import com.ticketflow.orchestrator.model.ExitInfo;

import java.time.Duration;

/**
 * Result of one external program invocation.
 *
 * @param exitCode exit status; -1 when the process was killed and reported none
 * @param timedOut true when the process tree was killed for exceeding its timeout
 * @param elapsed  wall-clock time from launch to exit
 */
public record StepOutcome(int exitCode, boolean timedOut, Duration elapsed) {

    public boolean success() {
        return !timedOut && exitCode == 0;
    }

    public ExitInfo exitInfo() {
        return timedOut ? ExitInfo.killedByTimeout(exitCode) : ExitInfo.exited(exitCode);
    }
}
