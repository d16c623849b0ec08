package com.ticketflow.orchestrator.flow;

import java.util.List;

/**
 * Thrown when a run request is missing required parameters or carries
 * invalid ones. Every problem found is reported, not just the first.
 */
public class ParameterValidationException extends RuntimeException {

    private final List<String> problems;

    public ParameterValidationException(List<String> problems) {
        super("Invalid run parameters: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ParameterValidationException(String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() { return problems; }
}
