package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * CLI command: pv rm task|phase &lt;id&gt;
 */
@Command(name = "rm", mixinStandardHelpOptions = true, description = "Remove a phase or task")
@Component
public class RmCommand extends PlanEditCommand {

    enum Target { task, phase }

    @Parameters(index = "0", description = "What to remove: ${COMPLETION-CANDIDATES}")
    private Target target;

    @Parameters(index = "1", description = "Task or phase ID")
    private String id;

    public RmCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine);
    }

    @Override
    protected int execute(Path planFile) {
        return edit(planFile, plan -> {
            if (target == Target.task) {
                planEngine.removeTask(plan, id);
                return "Removed task [" + id + "]";
            }
            planEngine.removePhase(plan, id);
            return "Removed phase " + id;
        });
    }
}
