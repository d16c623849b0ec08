package com.ticketflow.orchestrator.model;

/**
 * How an external program ended.
 *
 * @param exitCode process exit status; on Unix a process killed by a signal reports 128 + signal
 * @param timedOut true when the engine terminated the process because its timeout expired
 */
public record ExitInfo(int exitCode, boolean timedOut) {

    public static ExitInfo exited(int exitCode) {
        return new ExitInfo(exitCode, false);
    }

    public static ExitInfo killedByTimeout(int exitCode) {
        return new ExitInfo(exitCode, true);
    }
}
