package com.planview.core.progress;

import com.planview.core.model.Phase;
import com.planview.core.model.PhaseProgress;
import com.planview.core.model.Plan;
import com.planview.core.model.PlanSummary;
import com.planview.core.model.Task;
import com.planview.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recomputes the derived parts of a plan: per-phase progress, phase status
 * and the whole-plan summary.
 * <p>
 * Phase status is only ever promoted to {@code in_progress} or {@code completed};
 * a manually set {@code blocked} or {@code skipped} phase with no progress keeps
 * its status. Running this twice yields the same result as running it once.
 */
@Component
public class ProgressAggregator {

    private static final Logger log = LoggerFactory.getLogger(ProgressAggregator.class);

    public void recalculate(Plan plan) {
        int totalTasks = 0;
        int completedTasks = 0;

        for (Phase phase : plan.getPhases()) {
            int total = phase.getTasks().size();
            int completed = (int) phase.getTasks().stream()
                    .filter(t -> t.hasStatus(TaskStatus.COMPLETED))
                    .count();

            phase.setProgress(PhaseProgress.of(completed, total));

            if (total > 0 && completed == total) {
                phase.setStatus(TaskStatus.COMPLETED);
            } else if (completed > 0 || anyInProgress(phase)) {
                phase.setStatus(TaskStatus.IN_PROGRESS);
            }

            totalTasks += total;
            completedTasks += completed;
        }

        double overall = totalTasks > 0 ? completedTasks * 100.0 / totalTasks : 0;
        plan.setSummary(new PlanSummary(plan.getPhases().size(), totalTasks, completedTasks, overall));

        log.debug("Recalculated progress: {}/{} tasks across {} phases",
                completedTasks, totalTasks, plan.getPhases().size());
    }

    private static boolean anyInProgress(Phase phase) {
        for (Task task : phase.getTasks()) {
            if (task.hasStatus(TaskStatus.IN_PROGRESS)) {
                return true;
            }
        }
        return false;
    }
}
