package com.planview.core.engine;

import com.planview.core.model.Phase;
import com.planview.core.model.Task;

/**
 * Outcome of sending a task to a reserved phase.
 *
 * @param previousId the task's ID before the move, or {@code null} if the task was created
 */
public record TriageResult(String previousId, Task task, Phase phase) {

    public boolean created() {
        return previousId == null;
    }
}
