package com.planview.core.model;

/**
 * Thrown when a task ID does not resolve to any task in the plan.
 */
public class TaskNotFoundException extends RuntimeException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task '" + taskId + "' not found");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
