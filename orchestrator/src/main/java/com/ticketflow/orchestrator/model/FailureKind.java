package com.ticketflow.orchestrator.model;

/**
 * Why a step ended in {@link StepState#FAILED}.
 *
 * All kinds are fatal to the run; the engine never retries a step itself.
 */
public enum FailureKind {
    /** A required input was absent or malformed before the step started. No process was launched. */
    MISSING_INPUT,
    /** The external program exited non-zero, or could not be launched at all. */
    PROCESS_FAILURE,
    /** The external program exceeded its time budget and its process tree was terminated. */
    TIMEOUT_EXCEEDED,
    /** The program exited zero but a declared output is missing or malformed. */
    OUTPUT_VALIDATION_FAILED,
    /** The engine stopped while the step was running. Set when runs are reloaded from disk. */
    INTERRUPTED
}
