package com.ticketflow.orchestrator.flow;

import com.ticketflow.orchestrator.model.FlowDefinition;

/**
 * A validated request: the flow to run and the parameters to run it with.
 */
public record FlowPlan(FlowDefinition definition, RunParameters parameters) {}
