package com.planview.dispatch.cli;

import com.planview.core.engine.CompactionResult;
import com.planview.core.engine.PlanEngine;
import com.planview.core.persistence.PlanStore;
import com.planview.core.persistence.PlanStoreProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * CLI command: pv compact [--max-backups K]
 * <p>
 * Rotates backups of the plan file, then strips completed tasks down to
 * their minimal record.
 */
@Command(name = "compact", mixinStandardHelpOptions = true,
        description = "Back up plan.json and strip completed tasks to id, title, status and completion time")
@Component
public class CompactCommand extends PlanEditCommand {

    @Option(names = "--max-backups", description = "Backups to keep (default: planview.max-backups)")
    private Integer maxBackups;

    private final PlanStoreProperties properties;

    public CompactCommand(PlanStore planStore, PlanEngine planEngine, PlanStoreProperties properties) {
        super(planStore, planEngine);
        this.properties = properties;
    }

    @Override
    protected int execute(Path planFile) {
        int keep = maxBackups != null ? maxBackups : properties.getMaxBackups();
        CompactionResult result = planEngine.compact(planFile, keep, options.dryRun);
        String summary = result.compacted() + " completed task" + (result.compacted() == 1 ? "" : "s");
        if (options.dryRun) {
            ConsoleOutput.wouldDo("compact " + summary + " (backup to " + properties.resolveBackupDir(planFile) + ")");
            return 0;
        }
        report("Backed up to " + result.backup());
        report("Compacted " + summary);
        return 0;
    }
}
