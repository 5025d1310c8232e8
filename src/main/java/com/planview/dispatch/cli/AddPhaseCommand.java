package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.Phase;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * CLI command: pv add-phase &lt;name&gt; [--desc TEXT]
 */
@Command(name = "add-phase", mixinStandardHelpOptions = true, description = "Add a new phase")
@Component
public class AddPhaseCommand extends PlanEditCommand {

    @Parameters(index = "0", description = "Phase name")
    private String name;

    @Option(names = "--desc", description = "Phase description")
    private String description;

    public AddPhaseCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine);
    }

    @Override
    protected int execute(Path planFile) {
        return edit(planFile, plan -> {
            Phase phase = planEngine.addPhase(plan, name, description);
            return "Added Phase " + phase.getId() + ": " + name;
        });
    }
}
