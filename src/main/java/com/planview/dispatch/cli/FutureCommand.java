package com.planview.dispatch.cli;

import com.planview.core.model.Plan;
import com.planview.core.persistence.PlanJson;
import com.planview.core.persistence.PlanStore;
import com.planview.core.scheduler.DependencyResolver;
import com.planview.core.scheduler.UpcomingTask;
import com.planview.dispatch.JsonViews;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: pv future [-n COUNT | --all]
 * <p>
 * Upcoming work in order: in progress, ready, waiting on dependencies, blocked.
 */
@Command(name = "future", aliases = "f", mixinStandardHelpOptions = true,
        description = "Show upcoming tasks")
@Component
public class FutureCommand extends PlanSubcommand {

    @Option(names = {"-n", "--number"}, defaultValue = "5",
            description = "Number of tasks to show (default: ${DEFAULT-VALUE})")
    private int count;

    @Option(names = {"-a", "--all"}, description = "Show every upcoming task")
    private boolean all;

    private final PlanStore planStore;
    private final DependencyResolver resolver;

    public FutureCommand(PlanStore planStore, DependencyResolver resolver) {
        this.planStore = planStore;
        this.resolver = resolver;
    }

    @Override
    protected int execute(Path planFile) {
        Plan plan = planStore.load(planFile);
        List<UpcomingTask> upcoming = all ? resolver.classifyUpcoming(plan) : resolver.classifyUpcoming(plan, count);

        if (json()) {
            System.out.println(PlanJson.write(upcoming.stream().map(JsonViews.UpcomingView::of).toList()));
            return 0;
        }
        if (upcoming.isEmpty()) {
            System.out.println("No upcoming tasks found!");
            return 0;
        }

        System.out.println();
        System.out.println(ConsoleOutput.bold("Upcoming Tasks:"));
        System.out.println();
        for (UpcomingTask entry : upcoming) {
            String icon = ConsoleOutput.upcomingIcon(entry.task().getStatus(), entry.actionable());
            System.out.println("   " + icon + " [" + entry.task().getId() + "] " + entry.task().getTitle()
                    + " " + ConsoleOutput.dim("(" + describe(entry) + ")"));
            if (!entry.actionable() && !entry.task().getDependsOn().isEmpty()) {
                System.out.println("      " + ConsoleOutput.dim("Depends on: " + String.join(", ", entry.task().getDependsOn())));
            }
        }
        System.out.println();
        return 0;
    }

    private static String describe(UpcomingTask entry) {
        return switch (entry.task().getStatus()) {
            case IN_PROGRESS -> "in progress";
            case BLOCKED -> "blocked";
            default -> entry.actionable() ? "ready" : "waiting";
        };
    }
}
