package com.ticketflow.orchestrator.service;

/**
 * Thrown when a run is submitted while the concurrency bound is reached.
 * The caller may retry once a running run has finished.
 */
public class AdmissionRejectedException extends RuntimeException {

    public AdmissionRejectedException(int activeRuns) {
        super("Concurrency limit reached: " + activeRuns + " runs active, try again later");
    }
}
