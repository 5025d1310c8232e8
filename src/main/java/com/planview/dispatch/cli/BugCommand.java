package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.ReservedPhase;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "bug", mixinStandardHelpOptions = true, description = "Move task to bugs phase")
@Component
public class BugCommand extends TriageCommand {

    public BugCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine, ReservedPhase.BUGS);
    }
}
