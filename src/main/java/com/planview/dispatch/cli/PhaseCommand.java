package com.planview.dispatch.cli;

import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.Task;
import com.planview.core.persistence.PlanJson;
import com.planview.core.persistence.PlanStore;
import com.planview.core.scheduler.DependencyResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.nio.file.Path;
import java.util.Optional;

/**
 * CLI command: pv phase
 * <p>
 * Details of the current phase, including each task's dependencies.
 */
@Command(name = "phase", aliases = "p", mixinStandardHelpOptions = true,
        description = "Show current phase details")
@Component
public class PhaseCommand extends PlanSubcommand {

    private final PlanStore planStore;
    private final DependencyResolver resolver;

    public PhaseCommand(PlanStore planStore, DependencyResolver resolver) {
        this.planStore = planStore;
        this.resolver = resolver;
    }

    @Override
    protected int execute(Path planFile) {
        Plan plan = planStore.load(planFile);
        Optional<Phase> current = resolver.currentPhase(plan);
        if (current.isEmpty()) {
            System.out.println(json() ? "null" : "No active phase found!");
            return 0;
        }
        Phase phase = current.get();
        if (json()) {
            System.out.println(PlanJson.write(phase));
            return 0;
        }
        printPhase(phase);
        return 0;
    }

    static void printPhase(Phase phase) {
        System.out.println();
        System.out.println(ConsoleOutput.boldCyan("Phase " + phase.getId() + ": " + phase.getName()));
        System.out.println("   " + PlanViewCommand.nullToEmpty(phase.getDescription()));
        System.out.println("   Progress: " + ConsoleOutput.percent(phase.getProgress().percentage())
                + " (" + phase.getProgress().completed() + "/" + phase.getProgress().total() + " tasks)");
        System.out.println();
        for (Task task : phase.getTasks()) {
            String agent = task.getAgentType() == null ? "" : "(" + task.getAgentType() + ")";
            String deps = task.getDependsOn().isEmpty() ? "" : " [deps: " + String.join(", ", task.getDependsOn()) + "]";
            System.out.println("   " + ConsoleOutput.statusIcon(task.getStatus()) + " [" + task.getId() + "] "
                    + task.getTitle() + " " + ConsoleOutput.dim(agent) + ConsoleOutput.dim(deps));
        }
        System.out.println();
    }
}
