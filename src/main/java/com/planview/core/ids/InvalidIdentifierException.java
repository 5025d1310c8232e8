package com.planview.core.ids;

/**
 * Thrown when a task ID has the {@code phase.section.task} shape but a
 * segment that should be numeric is not. Allocation stops rather than guess.
 */
public class InvalidIdentifierException extends RuntimeException {

    public InvalidIdentifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
