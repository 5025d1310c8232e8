package com.planview.dispatch.cli;

import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.PlanSummary;
import com.planview.core.model.Task;
import com.planview.core.persistence.PlanJson;
import com.planview.core.persistence.PlanStore;
import com.planview.core.persistence.PlanStoreProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ScopeType;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Top-level CLI command for plan-view.
 * Without a subcommand it prints the full plan overview.
 */
@Command(
        name = "pv",
        mixinStandardHelpOptions = true,
        version = "Plan View 0.1.0",
        description = "View and edit plan.json for task tracking",
        subcommands = {
                CurrentCommand.class,
                NextCommand.class,
                PhaseCommand.class,
                GetCommand.class,
                LastCommand.class,
                FutureCommand.class,
                BugsCommand.class,
                DeferredCommand.class,
                IdeasCommand.class,
                InitCommand.class,
                AddPhaseCommand.class,
                AddTaskCommand.class,
                SetCommand.class,
                DoneCommand.class,
                StartCommand.class,
                BlockCommand.class,
                SkipCommand.class,
                DeferCommand.class,
                BugCommand.class,
                IdeaCommand.class,
                MoveCommand.class,
                RmCommand.class,
                CompactCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlanViewCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, scope = ScopeType.INHERIT,
            description = "Path to plan.json (default: planview.file, plan.json)")
    private Path file;

    @Option(names = "--json", scope = ScopeType.INHERIT, description = "Output as JSON (view commands only)")
    private boolean json;

    private final PlanStore planStore;
    private final PlanStoreProperties properties;

    public PlanViewCommand(PlanStore planStore, PlanStoreProperties properties) {
        this.planStore = planStore;
        this.properties = properties;
    }

    public Path planFile() {
        return file != null ? file : properties.defaultPlanFile();
    }

    public boolean isJson() {
        return json;
    }

    @Override
    public Integer call() {
        return PlanSubcommand.guard(planFile(), () -> {
            Plan plan = planStore.load(planFile());
            if (json) {
                System.out.println(PlanJson.write(plan));
                return 0;
            }
            printOverview(plan);
            return 0;
        });
    }

    private static void printOverview(Plan plan) {
        printHeader(plan);
        for (Phase phase : plan.getPhases()) {
            System.out.println(ConsoleOutput.statusIcon(phase.getStatus()) + " "
                    + ConsoleOutput.bold("Phase " + phase.getId() + ": " + phase.getName())
                    + " (" + ConsoleOutput.percent(phase.getProgress().percentage()) + ")");
            System.out.println("   " + nullToEmpty(phase.getDescription()));
            System.out.println();
            for (Task task : phase.getTasks()) {
                System.out.println("   " + taskLine(task));
            }
            System.out.println();
        }
    }

    static void printHeader(Plan plan) {
        PlanSummary summary = plan.getSummary();
        String project = plan.getMeta().getProject();
        String version = plan.getMeta().getVersion();
        ConsoleOutput.printBanner(project == null ? "Unknown Project" : project, version == null ? "0.0.0" : version);
        System.out.println("Progress: " + ConsoleOutput.percent(summary.overallProgress())
                + " (" + summary.completedTasks() + "/" + summary.totalTasks() + " tasks)");
        System.out.println();
    }

    /** {@code <icon> [id] title (agent)} as used by the overview and current views. */
    static String taskLine(Task task) {
        String agent = task.getAgentType() == null ? "general" : task.getAgentType();
        return ConsoleOutput.statusIcon(task.getStatus()) + " [" + task.getId() + "] " + task.getTitle()
                + " " + ConsoleOutput.dim("(" + agent + ")");
    }

    static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
