package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.ReservedPhase;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: pv defer &lt;id|title&gt; [--reason TEXT]
 */
@Command(name = "defer", mixinStandardHelpOptions = true, description = "Move task to deferred phase")
@Component
public class DeferCommand extends TriageCommand {

    @Option(names = {"-r", "--reason"}, description = "Why the task is deferred")
    private String reason;

    public DeferCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine, ReservedPhase.DEFERRED);
    }

    @Override
    protected String reason() {
        return reason;
    }
}
