package com.planview.dispatch.cli;

import com.planview.core.model.ReservedPhase;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "deferred", aliases = "def", mixinStandardHelpOptions = true,
        description = "Show deferred tasks")
@Component
public class DeferredCommand extends ReservedPhaseView {

    public DeferredCommand(PlanStore planStore) {
        super(planStore, ReservedPhase.DEFERRED);
    }
}
