package com.planview.dispatch.cli;

import com.planview.core.model.Plan;
import com.planview.core.model.TaskLocation;
import com.planview.core.persistence.PlanJson;
import com.planview.core.persistence.PlanStore;
import com.planview.core.scheduler.DependencyResolver;
import com.planview.dispatch.JsonViews;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: pv last [-n COUNT]
 */
@Command(name = "last", aliases = "l", mixinStandardHelpOptions = true,
        description = "Show recently completed tasks")
@Component
public class LastCommand extends PlanSubcommand {

    @Option(names = {"-n", "--number"}, defaultValue = "5",
            description = "Number of tasks to show (default: ${DEFAULT-VALUE})")
    private int count;

    private final PlanStore planStore;
    private final DependencyResolver resolver;

    public LastCommand(PlanStore planStore, DependencyResolver resolver) {
        this.planStore = planStore;
        this.resolver = resolver;
    }

    @Override
    protected int execute(Path planFile) {
        Plan plan = planStore.load(planFile);
        List<TaskLocation> completed = resolver.recentlyCompleted(plan, count);

        if (json()) {
            System.out.println(PlanJson.write(completed.stream().map(JsonViews.CompletedView::of).toList()));
            return 0;
        }
        if (completed.isEmpty()) {
            System.out.println("No completed tasks found!");
            return 0;
        }

        System.out.println();
        System.out.println(ConsoleOutput.bold("Recently Completed:"));
        System.out.println();
        for (TaskLocation location : completed) {
            var tracking = location.task().getTracking();
            String completedAt = tracking == null ? null : tracking.getCompletedAt();
            System.out.println("   ✅ [" + location.task().getId() + "] " + location.task().getTitle());
            System.out.println("      " + ConsoleOutput.dim(location.phase().getName() + " · " + ConsoleOutput.date(completedAt)));
        }
        System.out.println();
        return 0;
    }
}
