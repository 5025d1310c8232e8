package com.planview.dispatch.cli;

import com.planview.core.model.ReservedPhase;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "bugs", aliases = "b", mixinStandardHelpOptions = true,
        description = "Show tasks in the bugs phase")
@Component
public class BugsCommand extends ReservedPhaseView {

    public BugsCommand(PlanStore planStore) {
        super(planStore, ReservedPhase.BUGS);
    }
}
