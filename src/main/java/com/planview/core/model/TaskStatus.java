package com.planview.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Status of a task, a subtask or a phase.
 * <p>
 * Phases share the task vocabulary: their status is derived from task statuses
 * on save, except for a manually set {@code blocked} or {@code skipped}.
 */
public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    BLOCKED("blocked"),
    SKIPPED("skipped");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses the on-disk spelling of a status.
     *
     * @throws IllegalArgumentException when the value is not one of the five statuses
     */
    @JsonCreator
    public static TaskStatus fromValue(String value) {
        for (TaskStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid status '" + value + "'. Use: " + validValues());
    }

    public static String validValues() {
        return Arrays.stream(values()).map(TaskStatus::value).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return value;
    }
}
