package com.ticketflow.orchestrator.model;

/**
 * Overall state of a run.
 *
 * Transitions:
 *   PENDING → RUNNING → SUCCESS
 *                     → FAILED
 *
 * A run never moves backwards and never leaves a terminal state.
 */
public enum RunState {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
