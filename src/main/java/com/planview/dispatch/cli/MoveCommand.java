package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.persistence.PlanStore;
import com.planview.core.relocation.Relocation;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * CLI command: pv move &lt;task-id&gt; &lt;phase-id&gt;
 */
@Command(name = "move", mixinStandardHelpOptions = true,
        description = "Move a task to another phase (bugs, ideas and deferred are created on demand)")
@Component
public class MoveCommand extends PlanEditCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Parameters(index = "1", description = "Target phase ID")
    private String targetPhaseId;

    public MoveCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine);
    }

    @Override
    protected int execute(Path planFile) {
        return edit(planFile, plan -> {
            Relocation relocation = planEngine.move(plan, taskId, targetPhaseId);
            return "[" + relocation.oldId() + "] → [" + relocation.newId() + "] (" + relocation.target().getId() + ")";
        });
    }
}
