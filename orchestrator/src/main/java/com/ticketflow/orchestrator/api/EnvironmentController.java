package com.ticketflow.orchestrator.api;

import com.ticketflow.orchestrator.environment.EnvironmentCheck;
import com.ticketflow.orchestrator.environment.ServiceStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /env-status: which credentials the external programs will see.
 * Reports presence and format only, never values.
 */
@RestController
public class EnvironmentController {

    private final EnvironmentCheck environmentCheck;

    public EnvironmentController(EnvironmentCheck environmentCheck) {
        this.environmentCheck = environmentCheck;
    }

    @GetMapping("/env-status")
    public List<ServiceStatus> status() {
        return environmentCheck.checkAll();
    }
}
