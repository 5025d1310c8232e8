package com.planview.core.relocation;

import com.planview.core.model.Phase;
import com.planview.core.model.Task;

/**
 * Outcome of moving a task.
 *
 * @param oldId  ID the task had before the move
 * @param task   the moved task, now carrying its new ID
 * @param source phase the task was taken from
 * @param target phase the task now belongs to
 */
public record Relocation(String oldId, Task task, Phase source, Phase target) {

    public String newId() {
        return task.getId();
    }
}
