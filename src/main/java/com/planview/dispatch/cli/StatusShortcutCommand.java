package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.TaskStatus;
import com.planview.core.persistence.PlanStore;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * {@code pv set <id> status <value>} with the status fixed by the subclass.
 */
abstract class StatusShortcutCommand extends PlanEditCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final TaskStatus status;

    protected StatusShortcutCommand(PlanStore planStore, PlanEngine planEngine, TaskStatus status) {
        super(planStore, planEngine);
        this.status = status;
    }

    @Override
    protected int execute(Path planFile) {
        return edit(planFile, plan -> {
            planEngine.setStatus(plan, taskId, status);
            return "[" + taskId + "] status → " + status;
        });
    }
}
