package com.ticketflow.orchestrator.environment;

import java.util.List;

/**
 * Environment status of one external service the programs talk to.
 *
 * @param status "ok" when every variable is ok, "error" otherwise
 */
public record ServiceStatus(String service, String status, int ok, int total, List<VariableCheck> details) {

    public static ServiceStatus of(String service, List<VariableCheck> details) {
        int ok = (int) details.stream().filter(VariableCheck::ok).count();
        return new ServiceStatus(service, ok == details.size() ? "ok" : "error", ok, details.size(),
                List.copyOf(details));
    }

    public boolean allOk() {
        return ok == total;
    }
}
