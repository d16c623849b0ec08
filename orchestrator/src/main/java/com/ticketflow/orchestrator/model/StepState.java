package com.ticketflow.orchestrator.model;

/**
 * Execution state of a single step within a run.
 *
 * Transitions:
 *   PENDING → RUNNING → SUCCESS
 *                     → FAILED
 *   PENDING → SKIPPED          (skip policy, no process launched)
 *   PENDING → FAILED           (required input missing, no process launched)
 *
 * Terminal states never change again.
 */
public enum StepState {
    PENDING,
    RUNNING,
    SUCCESS,
    SKIPPED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == SKIPPED || this == FAILED;
    }
}
