package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI command: pv init &lt;project-name&gt; [--force]
 */
@Command(name = "init", mixinStandardHelpOptions = true, description = "Create a new plan.json")
@Component
public class InitCommand extends PlanEditCommand {

    @Parameters(index = "0", description = "Project name")
    private String name;

    @Option(names = "--force", description = "Overwrite an existing file")
    private boolean force;

    public InitCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine);
    }

    @Override
    protected int execute(Path planFile) {
        if (Files.exists(planFile) && !force) {
            ConsoleOutput.error(planFile + " already exists. Use --force to overwrite.");
            return 1;
        }
        String message = "Created " + planFile + " for '" + name + "'";
        if (options.dryRun) {
            ConsoleOutput.wouldDo(message);
            return 0;
        }
        planStore.save(planFile, planEngine.init(name));
        report(message);
        return 0;
    }
}
