package com.ticketflow.orchestrator.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, immutable list of steps for one workflow variant.
 * Built once per request by the flow catalog and never mutated.
 */
public record FlowDefinition(FlowKind kind, List<StepDescriptor> steps) {

    public FlowDefinition {
        Objects.requireNonNull(kind, "kind");
        steps = List.copyOf(steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A flow needs at least one step");
        }
        Set<String> names = new HashSet<>();
        for (StepDescriptor step : steps) {
            if (!names.add(step.name())) {
                throw new IllegalArgumentException("Duplicate step name in flow: " + step.name());
            }
        }
    }

    public List<String> stepNames() {
        return steps.stream().map(StepDescriptor::name).toList();
    }
}
