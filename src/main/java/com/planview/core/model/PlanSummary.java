package com.planview.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Derived whole-plan counters, recomputed on every save.
 */
public record PlanSummary(
    @JsonProperty("total_phases") int totalPhases,
    @JsonProperty("total_tasks") int totalTasks,
    @JsonProperty("completed_tasks") int completedTasks,
    @JsonProperty("overall_progress") double overallProgress
) {

    public static final PlanSummary EMPTY = new PlanSummary(0, 0, 0, 0);
}
