package com.planview.dispatch.cli;

import com.planview.core.model.ReservedPhase;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "ideas", aliases = "i", mixinStandardHelpOptions = true,
        description = "Show tasks in the ideas phase")
@Component
public class IdeasCommand extends ReservedPhaseView {

    public IdeasCommand(PlanStore planStore) {
        super(planStore, ReservedPhase.IDEAS);
    }
}
