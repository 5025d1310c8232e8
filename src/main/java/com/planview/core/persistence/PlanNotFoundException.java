package com.planview.core.persistence;

import java.nio.file.Path;

/**
 * Thrown when the plan file does not exist.
 */
public class PlanNotFoundException extends RuntimeException {

    public PlanNotFoundException(Path path) {
        super(path + " not found");
    }
}
