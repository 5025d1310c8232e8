package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.ReservedPhase;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "idea", mixinStandardHelpOptions = true, description = "Move task to ideas phase")
@Component
public class IdeaCommand extends TriageCommand {

    public IdeaCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine, ReservedPhase.IDEAS);
    }
}
