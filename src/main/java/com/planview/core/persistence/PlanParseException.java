package com.planview.core.persistence;

/**
 * Thrown when the plan file is not a readable plan document.
 */
public class PlanParseException extends RuntimeException {

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
