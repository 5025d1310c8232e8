package com.planview.core.model;

import java.util.List;

/**
 * Fluent fixture builder for plans used across the test suite.
 * <pre>
 * Plan plan = PlanBuilder.plan("Demo")
 *         .phase("0", "Setup")
 *             .task("0.1.1", "Scaffold", TaskStatus.COMPLETED)
 *             .task("0.1.2", "Wire CI", TaskStatus.PENDING, "0.1.1")
 *         .build();
 * </pre>
 */
public final class PlanBuilder {

    public static final String CREATED_AT = "2025-01-01T00:00:00Z";

    private final Plan plan;
    private Phase currentPhase;

    private PlanBuilder(String project) {
        this.plan = new Plan(new PlanMeta(project, PlanMeta.DEFAULT_VERSION, CREATED_AT, PlanMeta.DEFAULT_BUSINESS_PLAN_PATH));
    }

    public static PlanBuilder plan(String project) {
        return new PlanBuilder(project);
    }

    public static PlanBuilder plan() {
        return plan("Test Project");
    }

    public PlanBuilder phase(String id, String name) {
        currentPhase = Phase.create(id, name, name + " phase");
        plan.addPhase(currentPhase);
        return this;
    }

    public PlanBuilder phase(String id, String name, TaskStatus status) {
        phase(id, name);
        currentPhase.setStatus(status);
        return this;
    }

    public PlanBuilder task(String id, String title, TaskStatus status, String... dependsOn) {
        Task task = Task.create(id, title);
        task.setStatus(status);
        task.setDependsOn(List.of(dependsOn));
        currentPhase.addTask(task);
        return this;
    }

    /** Adds a completed task with a {@code completed_at} stamp. */
    public PlanBuilder completed(String id, String title, String completedAt) {
        Task task = Task.create(id, title);
        task.setStatus(TaskStatus.COMPLETED);
        task.tracking().setCompletedAt(completedAt);
        currentPhase.addTask(task);
        return this;
    }

    public PlanBuilder with(Task task) {
        currentPhase.addTask(task);
        return this;
    }

    public Plan build() {
        return plan;
    }

    public static Task task(Plan plan, String id) {
        return plan.requireTask(id).task();
    }
}
