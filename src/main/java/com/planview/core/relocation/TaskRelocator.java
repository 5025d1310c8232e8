package com.planview.core.relocation;

import com.planview.core.ids.IdentifierAllocator;
import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.ReservedPhase;
import com.planview.core.model.Task;
import com.planview.core.model.TaskLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Moves a task from its phase into another one.
 * <p>
 * The task gets a fresh ID in the target phase and loses its dependencies,
 * since they referred to its old position. Tasks that depend on the old ID are
 * not rewritten. Every other field, tracking included, travels unchanged.
 */
@Service
public class TaskRelocator {

    private static final Logger log = LoggerFactory.getLogger(TaskRelocator.class);

    private final IdentifierAllocator identifierAllocator;

    public TaskRelocator(IdentifierAllocator identifierAllocator) {
        this.identifierAllocator = identifierAllocator;
    }

    /**
     * @param plan          plan to mutate
     * @param taskId        ID of the task to move
     * @param targetPhaseId an existing phase, or {@code bugs}, {@code ideas} or {@code deferred}
     * @throws com.planview.core.model.TaskNotFoundException if no task has {@code taskId}
     * @throws UnknownPhaseException if the target phase does not exist and is not reserved
     */
    public Relocation relocate(Plan plan, String taskId, String targetPhaseId) {
        TaskLocation location = plan.requireTask(taskId);
        Phase target = resolveTarget(plan, targetPhaseId);

        Phase source = location.phase();
        Task task = location.task();
        source.removeTask(task);

        String newId = identifierAllocator.allocateTaskId(target);
        task.setId(newId);
        task.setDependsOn(List.of());
        target.addTask(task);

        log.info("Relocated task {} -> {} (phase {} -> {})", taskId, newId, source.getId(), target.getId());
        return new Relocation(taskId, task, source, target);
    }

    /**
     * Finds the target phase, creating a reserved phase on first use.
     */
    public Phase resolveTarget(Plan plan, String targetPhaseId) {
        return plan.findPhase(targetPhaseId).orElseGet(() -> {
            ReservedPhase reserved = ReservedPhase.fromId(targetPhaseId)
                    .orElseThrow(() -> new UnknownPhaseException(targetPhaseId));
            Phase created = reserved.newPhase();
            plan.addPhase(created);
            log.info("Created reserved phase '{}'", created.getId());
            return created;
        });
    }
}
