package com.planview.core.scheduler;

import com.planview.core.model.Phase;
import com.planview.core.model.Task;

/**
 * One entry of the forward-looking task list.
 *
 * @param phase      phase holding the task
 * @param task       the upcoming task
 * @param actionable whether the task is pending or in progress with every dependency completed
 */
public record UpcomingTask(Phase phase, Task task, boolean actionable) {
}
