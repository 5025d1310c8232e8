package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.TaskStatus;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "start", mixinStandardHelpOptions = true, description = "Mark task as in_progress")
@Component
public class StartCommand extends StatusShortcutCommand {

    public StartCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine, TaskStatus.IN_PROGRESS);
    }
}
