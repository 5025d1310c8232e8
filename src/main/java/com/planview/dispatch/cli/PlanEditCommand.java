package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.Plan;
import com.planview.core.persistence.PlanStore;
import picocli.CommandLine.Mixin;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Load, change, save. The change returns the message printed on success;
 * a dry run prints it after {@code Would:} and skips the save.
 */
abstract class PlanEditCommand extends PlanSubcommand {

    @Mixin
    protected EditOptions options = new EditOptions();

    protected final PlanStore planStore;
    protected final PlanEngine planEngine;

    protected PlanEditCommand(PlanStore planStore, PlanEngine planEngine) {
        this.planStore = planStore;
        this.planEngine = planEngine;
    }

    protected int edit(Path planFile, Function<Plan, String> change) {
        Plan plan = planStore.load(planFile);
        String message = change.apply(plan);
        if (options.dryRun) {
            ConsoleOutput.wouldDo(message);
            return 0;
        }
        planStore.save(planFile, plan);
        report(message);
        return 0;
    }

    protected void report(String message) {
        if (!options.quiet) {
            ConsoleOutput.success(message);
        }
    }
}
