package com.ticketflow.orchestrator.environment;

/**
 * Presence and format of one credential variable. Never carries the value.
 * An optional variable that is not set counts as ok.
 */
public record VariableCheck(String key, boolean present, boolean valid, String message) {

    public boolean ok() {
        return valid;
    }
}
