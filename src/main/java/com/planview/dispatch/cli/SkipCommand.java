package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.TaskStatus;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "skip", mixinStandardHelpOptions = true, description = "Mark task as skipped")
@Component
public class SkipCommand extends StatusShortcutCommand {

    public SkipCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine, TaskStatus.SKIPPED);
    }
}
