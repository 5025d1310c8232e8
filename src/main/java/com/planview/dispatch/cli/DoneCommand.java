package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.TaskStatus;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "done", mixinStandardHelpOptions = true, description = "Mark task as completed")
@Component
public class DoneCommand extends StatusShortcutCommand {

    public DoneCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine, TaskStatus.COMPLETED);
    }
}
