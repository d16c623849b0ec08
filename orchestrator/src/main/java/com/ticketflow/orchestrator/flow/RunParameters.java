package com.ticketflow.orchestrator.flow;

import java.util.Map;
import java.util.Objects;

/**
 * Normalized request parameters of one run plus its option flags.
 *
 * {@code values} hold the string form of every parameter the flow's command
 * templates may reference. They are captured into params.json with secrets
 * redacted; the unredacted map never leaves memory.
 */
public record RunParameters(Map<String, String> values, RunOptions options) {

    public RunParameters {
        values  = Map.copyOf(values);
        options = Objects.requireNonNull(options, "options");
    }

    public String get(String name) {
        return values.get(name);
    }
}
