package com.planview.core.model;

/**
 * Thrown when a phase ID does not resolve to any phase in the plan.
 */
public class PhaseNotFoundException extends RuntimeException {

    private final String phaseId;

    public PhaseNotFoundException(String phaseId) {
        super("Phase '" + phaseId + "' not found");
        this.phaseId = phaseId;
    }

    public String getPhaseId() {
        return phaseId;
    }
}
