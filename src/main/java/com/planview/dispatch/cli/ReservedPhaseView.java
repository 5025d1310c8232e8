package com.planview.dispatch.cli;

import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.ReservedPhase;
import com.planview.core.model.Task;
import com.planview.core.model.Tracking;
import com.planview.core.persistence.PlanJson;
import com.planview.core.persistence.PlanStore;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Lists the tasks of one reserved phase. Deferred tasks show their reason.
 */
abstract class ReservedPhaseView extends PlanSubcommand {

    private final PlanStore planStore;
    private final ReservedPhase bucket;

    protected ReservedPhaseView(PlanStore planStore, ReservedPhase bucket) {
        this.planStore = planStore;
        this.bucket = bucket;
    }

    @Override
    protected int execute(Path planFile) {
        Plan plan = planStore.load(planFile);
        Optional<Phase> found = plan.findPhase(bucket.id()).filter(phase -> !phase.getTasks().isEmpty());
        if (found.isEmpty()) {
            System.out.println(json() ? "null" : "No " + bucket.id() + " phase found!");
            return 0;
        }
        Phase phase = found.get();
        if (json()) {
            System.out.println(PlanJson.write(phase));
            return 0;
        }

        System.out.println();
        System.out.println(ConsoleOutput.boldCyan(phase.getName()) + " " + ConsoleOutput.dim("(" + phase.getTasks().size() + " tasks)"));
        System.out.println("   " + PlanViewCommand.nullToEmpty(phase.getDescription()));
        System.out.println();
        for (Task task : phase.getTasks()) {
            System.out.println("   " + ConsoleOutput.statusIcon(task.getStatus()) + " [" + task.getId() + "] " + task.getTitle());
            Object reason = task.getTracking() == null ? null : task.getTracking().get(Tracking.DEFER_REASON);
            if (reason != null) {
                System.out.println("      " + ConsoleOutput.dim("Reason: " + reason));
            }
        }
        System.out.println();
        return 0;
    }
}
