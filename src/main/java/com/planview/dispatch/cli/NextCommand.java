package com.planview.dispatch.cli;

import com.planview.core.model.Plan;
import com.planview.core.model.Task;
import com.planview.core.model.TaskLocation;
import com.planview.core.persistence.PlanJson;
import com.planview.core.persistence.PlanStore;
import com.planview.core.scheduler.DependencyResolver;
import com.planview.dispatch.JsonViews;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.nio.file.Path;
import java.util.Optional;

/**
 * CLI command: pv next
 */
@Command(name = "next", aliases = "n", mixinStandardHelpOptions = true,
        description = "Show next task to work on")
@Component
public class NextCommand extends PlanSubcommand {

    private final PlanStore planStore;
    private final DependencyResolver resolver;

    public NextCommand(PlanStore planStore, DependencyResolver resolver) {
        this.planStore = planStore;
        this.resolver = resolver;
    }

    @Override
    protected int execute(Path planFile) {
        Plan plan = planStore.load(planFile);
        Optional<TaskLocation> next = resolver.nextActionableTask(plan);
        if (next.isEmpty()) {
            System.out.println(json() ? "null" : "No pending tasks found!");
            return 0;
        }
        if (json()) {
            System.out.println(PlanJson.write(JsonViews.TaskView.of(next.get())));
            return 0;
        }

        Task task = next.get().task();
        System.out.println();
        System.out.println(ConsoleOutput.bold("Next Task:"));
        System.out.println("  " + ConsoleOutput.statusIcon(task.getStatus()) + " [" + task.getId() + "] " + task.getTitle());
        System.out.println("  " + ConsoleOutput.dim("Phase:") + " " + next.get().phase().getName());
        System.out.println("  " + ConsoleOutput.dim("Agent:") + " "
                + (task.getAgentType() == null ? "general-purpose" : task.getAgentType()));
        if (!task.getDependsOn().isEmpty()) {
            System.out.println("  " + ConsoleOutput.dim("Depends on:") + " " + String.join(", ", task.getDependsOn()));
        }
        System.out.println();
        return 0;
    }
}
