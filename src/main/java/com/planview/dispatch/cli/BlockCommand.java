package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.TaskStatus;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "block", mixinStandardHelpOptions = true, description = "Mark task as blocked")
@Component
public class BlockCommand extends StatusShortcutCommand {

    public BlockCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine, TaskStatus.BLOCKED);
    }
}
