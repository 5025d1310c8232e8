package com.planview.core.relocation;

/**
 * Thrown when a relocation target is neither an existing phase nor a reserved one.
 */
public class UnknownPhaseException extends RuntimeException {

    public UnknownPhaseException(String phaseId) {
        super("Unknown phase '" + phaseId + "': not in the plan and not one of bugs, ideas, deferred");
    }
}
