package com.ticketflow.orchestrator.model;

import java.util.Locale;

/**
 * The workflow variants the engine knows how to build, one per ticket source.
 *
 * JITBIT exports tickets and the knowledge base from Jitbit;
 * JIRA exports resolved issues from one Jira project and deduplicates them.
 */
public enum FlowKind {
    JITBIT,
    JIRA;

    /** Lower-case identifier used in run ids and in the REST API. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a flow identifier case-insensitively.
     *
     * @throws IllegalArgumentException for unknown identifiers
     */
    public static FlowKind fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Flow kind is required");
        }
        for (FlowKind kind : values()) {
            if (kind.name().equalsIgnoreCase(id.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown flow: " + id);
    }
}
