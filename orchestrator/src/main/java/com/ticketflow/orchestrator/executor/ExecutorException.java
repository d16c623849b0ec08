package com.ticketflow.orchestrator.executor;

/**
 * Thrown when an external program cannot be launched, or when the thread
 * waiting on it is interrupted.
 */
public class ExecutorException extends RuntimeException {

    private final String program;

    public ExecutorException(String program, String message, Throwable cause) {
        super(message, cause);
        this.program = program;
    }

    /** The executable (first command element) that failed. */
    public String getProgram() { return program; }
}
