package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.engine.TriageResult;
import com.planview.core.model.ReservedPhase;
import com.planview.core.persistence.PlanStore;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;

/**
 * Sends a task to a reserved phase, or files a new one there when the
 * argument is a title rather than a task ID.
 */
abstract class TriageCommand extends PlanEditCommand {

    @Parameters(arity = "1..*", paramLabel = "ID|TITLE", description = "Task ID to move, or title of a new task")
    private List<String> words;

    private final ReservedPhase bucket;

    protected TriageCommand(PlanStore planStore, PlanEngine planEngine, ReservedPhase bucket) {
        super(planStore, planEngine);
        this.bucket = bucket;
    }

    /** Reason stored on the task; only deferral records one. */
    protected String reason() {
        return null;
    }

    @Override
    protected int execute(Path planFile) {
        String idOrTitle = String.join(" ", words);
        return edit(planFile, plan -> {
            TriageResult result = planEngine.triage(plan, idOrTitle, bucket, reason());
            if (result.created()) {
                return "Added [" + result.task().getId() + "] " + result.task().getTitle() + " (" + bucket.id() + ")";
            }
            return "[" + result.previousId() + "] → [" + result.task().getId() + "] (" + bucket.id() + ")";
        });
    }
}
