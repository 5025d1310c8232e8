package com.planview.dispatch.cli;

import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.Task;
import com.planview.core.model.TaskLocation;
import com.planview.core.model.TaskStatus;
import com.planview.core.persistence.PlanJson;
import com.planview.core.persistence.PlanStore;
import com.planview.core.scheduler.DependencyResolver;
import com.planview.dispatch.JsonViews;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.nio.file.Path;
import java.util.Optional;

/**
 * CLI command: pv current
 * <p>
 * Completed phases, then the current phase with its tasks, then the next task.
 */
@Command(name = "current", aliases = "c", mixinStandardHelpOptions = true,
        description = "Show current progress and next task")
@Component
public class CurrentCommand extends PlanSubcommand {

    private final PlanStore planStore;
    private final DependencyResolver resolver;

    public CurrentCommand(PlanStore planStore, DependencyResolver resolver) {
        this.planStore = planStore;
        this.resolver = resolver;
    }

    @Override
    protected int execute(Path planFile) {
        Plan plan = planStore.load(planFile);
        Optional<Phase> current = resolver.currentPhase(plan);
        Optional<TaskLocation> next = resolver.nextActionableTask(plan);

        if (json()) {
            System.out.println(PlanJson.write(new JsonViews.CurrentView(plan.getSummary(),
                    current.orElse(null), next.map(JsonViews.TaskView::of).orElse(null))));
            return 0;
        }

        PlanViewCommand.printHeader(plan);
        for (Phase phase : plan.getPhases()) {
            if (phase.hasStatus(TaskStatus.COMPLETED)) {
                System.out.println(ConsoleOutput.green("✅ Phase " + phase.getId() + ": " + phase.getName() + " (100%)"));
            }
        }

        current.ifPresent(phase -> {
            String icon = phase.hasStatus(TaskStatus.IN_PROGRESS) ? "🔄" : "⏳";
            System.out.println();
            System.out.println(icon + " " + ConsoleOutput.boldYellow("Phase " + phase.getId() + ": " + phase.getName()
                    + " (" + ConsoleOutput.percent(phase.getProgress().percentage()) + ")"));
            System.out.println("   " + PlanViewCommand.nullToEmpty(phase.getDescription()));
            System.out.println();
            for (Task task : phase.getTasks()) {
                System.out.println("   " + PlanViewCommand.taskLine(task));
            }
        });

        next.ifPresent(location -> {
            System.out.println();
            System.out.println(ConsoleOutput.bold("👉 Next:") + " [" + location.task().getId() + "] "
                    + location.task().getTitle());
        });
        System.out.println();
        return 0;
    }
}
