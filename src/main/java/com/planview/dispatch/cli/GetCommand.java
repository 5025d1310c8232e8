package com.planview.dispatch.cli;

import com.planview.core.model.Plan;
import com.planview.core.model.Task;
import com.planview.core.model.TaskLocation;
import com.planview.core.model.Tracking;
import com.planview.core.persistence.PlanJson;
import com.planview.core.persistence.PlanStore;
import com.planview.dispatch.JsonViews;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Optional;

/**
 * CLI command: pv get &lt;task-id&gt;
 */
@Command(name = "get", aliases = "g", mixinStandardHelpOptions = true,
        description = "Show a specific task by ID")
@Component
public class GetCommand extends PlanSubcommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final PlanStore planStore;

    public GetCommand(PlanStore planStore) {
        this.planStore = planStore;
    }

    @Override
    protected int execute(Path planFile) {
        Plan plan = planStore.load(planFile);
        Optional<TaskLocation> found = plan.findTask(taskId);
        if (found.isEmpty()) {
            System.out.println(json() ? "null" : "Task '" + taskId + "' not found!");
            return 0;
        }
        if (json()) {
            System.out.println(PlanJson.write(JsonViews.TaskView.of(found.get())));
            return 0;
        }

        Task task = found.get().task();
        System.out.println();
        System.out.println(ConsoleOutput.bold("[" + task.getId() + "] " + task.getTitle()));
        System.out.println("  " + ConsoleOutput.dim("Status:") + " " + ConsoleOutput.statusIcon(task.getStatus())
                + " " + task.getStatus());
        System.out.println("  " + ConsoleOutput.dim("Phase:") + " " + found.get().phase().getName());
        System.out.println("  " + ConsoleOutput.dim("Agent:") + " "
                + (task.getAgentType() == null ? "general-purpose" : task.getAgentType()));
        if (task.getSkill() != null) {
            System.out.println("  " + ConsoleOutput.dim("Skill:") + " " + task.getSkill());
        }
        if (!task.getDependsOn().isEmpty()) {
            System.out.println("  " + ConsoleOutput.dim("Depends on:") + " " + String.join(", ", task.getDependsOn()));
        }
        Tracking tracking = task.getTracking();
        if (tracking != null) {
            if (tracking.getStartedAt() != null) {
                System.out.println("  " + ConsoleOutput.dim("Started:") + " " + ConsoleOutput.date(tracking.getStartedAt()));
            }
            if (tracking.getCompletedAt() != null) {
                System.out.println("  " + ConsoleOutput.dim("Completed:") + " " + ConsoleOutput.date(tracking.getCompletedAt()));
            }
            Object reason = tracking.get(Tracking.DEFER_REASON);
            if (reason != null) {
                System.out.println("  " + ConsoleOutput.dim("Defer reason:") + " " + reason);
            }
        }
        System.out.println();
        return 0;
    }
}
