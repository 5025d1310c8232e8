package com.planview.core.compaction;

import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.Task;
import com.planview.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Shrinks completed tasks down to {@code id}, {@code title}, {@code status} and
 * {@code tracking.completed_at}.
 * <p>
 * This is lossy. Callers persist the result only after
 * {@link BackupRotator#backup} has saved the previous document.
 */
@Component
public class Compactor {

    private static final Logger log = LoggerFactory.getLogger(Compactor.class);

    /**
     * @return the number of completed tasks that actually lost fields
     */
    public int compact(Plan plan) {
        int modified = 0;
        for (Phase phase : plan.getPhases()) {
            for (Task task : phase.getTasks()) {
                if (task.hasStatus(TaskStatus.COMPLETED) && task.stripToCompletedRecord()) {
                    modified++;
                }
            }
        }
        log.info("Compacted {} completed task{}", modified, modified == 1 ? "" : "s");
        return modified;
    }
}
