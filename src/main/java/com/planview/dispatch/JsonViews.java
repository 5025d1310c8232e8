package com.planview.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.planview.core.model.Phase;
import com.planview.core.model.PlanSummary;
import com.planview.core.model.Task;
import com.planview.core.model.TaskLocation;
import com.planview.core.model.Tracking;
import com.planview.core.scheduler.UpcomingTask;

import java.util.List;

/**
 * JSON shapes shared by the {@code --json} views and the HTTP API.
 */
public final class JsonViews {

    private JsonViews() {}

    public record TaskView(
            String id,
            String title,
            String status,
            @JsonProperty("phase_id") String phaseId,
            @JsonProperty("phase_name") String phaseName,
            @JsonProperty("agent_type") String agentType,
            @JsonProperty("depends_on") List<String> dependsOn,
            Tracking tracking
    ) {
        public static TaskView of(Phase phase, Task task) {
            return new TaskView(task.getId(), task.getTitle(), String.valueOf(task.getStatus()),
                    phase.getId(), phase.getName(), task.getAgentType(), task.getDependsOn(),
                    task.getTracking() == null ? new Tracking() : task.getTracking());
        }

        public static TaskView of(TaskLocation location) {
            return of(location.phase(), location.task());
        }
    }

    public record CurrentView(
            PlanSummary summary,
            @JsonProperty("current_phase") Phase currentPhase,
            @JsonProperty("next_task") TaskView nextTask
    ) {}

    public record CompletedView(
            String id,
            String title,
            @JsonProperty("phase_id") String phaseId,
            @JsonProperty("phase_name") String phaseName,
            @JsonProperty("completed_at") String completedAt,
            @JsonProperty("agent_type") String agentType
    ) {
        public static CompletedView of(TaskLocation location) {
            Task task = location.task();
            return new CompletedView(task.getId(), task.getTitle(), location.phase().getId(),
                    location.phase().getName(),
                    task.getTracking() == null ? null : task.getTracking().getCompletedAt(),
                    task.getAgentType());
        }
    }

    public record UpcomingView(
            String id,
            String title,
            String status,
            @JsonProperty("phase_id") String phaseId,
            boolean actionable,
            @JsonProperty("depends_on") List<String> dependsOn
    ) {
        public static UpcomingView of(UpcomingTask entry) {
            return new UpcomingView(entry.task().getId(), entry.task().getTitle(),
                    String.valueOf(entry.task().getStatus()), entry.phase().getId(),
                    entry.actionable(), entry.task().getDependsOn());
        }
    }
}
