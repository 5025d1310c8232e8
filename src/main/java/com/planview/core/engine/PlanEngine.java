package com.planview.core.engine;

import com.planview.core.compaction.BackupRotator;
import com.planview.core.compaction.Compactor;
import com.planview.core.ids.IdentifierAllocator;
import com.planview.core.metrics.PlanMetrics;
import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.PlanMeta;
import com.planview.core.model.ReservedPhase;
import com.planview.core.model.Subtask;
import com.planview.core.model.Task;
import com.planview.core.model.TaskLocation;
import com.planview.core.model.TaskNotFoundException;
import com.planview.core.model.TaskStatus;
import com.planview.core.model.Timestamps;
import com.planview.core.model.Tracking;
import com.planview.core.persistence.PlanStore;
import com.planview.core.persistence.PlanStoreProperties;
import com.planview.core.relocation.Relocation;
import com.planview.core.relocation.TaskRelocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Mutation operations on a loaded {@link Plan}.
 * <p>
 * Apart from {@link #compact}, nothing here touches the file system: callers
 * load the plan, apply one operation and save it through {@link PlanStore}.
 * A dry run is the same sequence without the save.
 */
@Service
public class PlanEngine {

    private static final Logger log = LoggerFactory.getLogger(PlanEngine.class);

    /** Arguments shaped like {@code <phase>.<n>.<n>} are treated as task IDs, never as titles. */
    private static final Pattern TASK_ID_SHAPE = Pattern.compile("^[^\\s.]+\\.\\d+\\.\\d+$");

    private static final String NONE = "none";

    private final IdentifierAllocator identifierAllocator;
    private final TaskRelocator taskRelocator;
    private final Compactor compactor;
    private final BackupRotator backupRotator;
    private final PlanStore planStore;
    private final PlanStoreProperties properties;
    private final PlanMetrics metrics;
    private final Clock clock;

    public PlanEngine(IdentifierAllocator identifierAllocator,
                      TaskRelocator taskRelocator,
                      Compactor compactor,
                      BackupRotator backupRotator,
                      PlanStore planStore,
                      PlanStoreProperties properties,
                      PlanMetrics metrics,
                      Clock clock) {
        this.identifierAllocator = identifierAllocator;
        this.taskRelocator = taskRelocator;
        this.compactor = compactor;
        this.backupRotator = backupRotator;
        this.planStore = planStore;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Plan init(String project) {
        PlanMeta meta = new PlanMeta(project, PlanMeta.DEFAULT_VERSION, now(), PlanMeta.DEFAULT_BUSINESS_PLAN_PATH);
        log.info("Initialised plan for '{}'", project);
        return new Plan(meta);
    }

    public Phase addPhase(Plan plan, String name, String description) {
        String id = identifierAllocator.allocatePhaseId(plan);
        Phase phase = Phase.create(id, name, description == null ? "" : description);
        plan.addPhase(phase);
        log.info("Added phase {}: {}", id, name);
        return phase;
    }

    /**
     * @throws com.planview.core.model.PhaseNotFoundException if {@code phaseId} does not exist
     */
    public Task addTask(Plan plan, String phaseId, String title, String agentType, String skill, List<String> dependsOn) {
        Phase phase = plan.requirePhase(phaseId);
        return appendTask(phase, title, agentType, skill, dependsOn);
    }

    /**
     * Applies a status together with its side effects: {@code in_progress}
     * stamps {@code started_at}; {@code completed} stamps {@code completed_at}
     * and completes every subtask. No other status touches tracking or subtasks.
     */
    public Task setStatus(Plan plan, String taskId, TaskStatus status) {
        Task task = plan.requireTask(taskId).task();
        task.setStatus(status);
        if (status == TaskStatus.IN_PROGRESS) {
            task.tracking().setStartedAt(now());
        } else if (status == TaskStatus.COMPLETED) {
            task.tracking().setCompletedAt(now());
            for (Subtask subtask : task.getSubtasks()) {
                subtask.setStatus(TaskStatus.COMPLETED);
            }
        }
        metrics.recordStatusChange(status);
        log.info("Task {} -> {}", taskId, status);
        return task;
    }

    /**
     * Sets one field from its textual form. {@code none} clears {@code agent}
     * and {@code skill}.
     *
     * @throws IllegalArgumentException for an unknown field or an invalid status value
     */
    public Task setField(Plan plan, String taskId, String field, String value) {
        Task task = plan.requireTask(taskId).task();
        switch (field) {
            case "status" -> setStatus(plan, taskId, TaskStatus.fromValue(value));
            case "agent" -> task.setAgentType(NONE.equals(value) ? null : value);
            case "skill" -> task.setSkill(NONE.equals(value) ? null : value);
            case "title" -> task.setTitle(value);
            default -> throw new IllegalArgumentException(
                    "Unknown field '" + field + "'. Use: status, agent, title, skill");
        }
        return task;
    }

    /**
     * Replaces title, agent and skill. A {@code null} title keeps the current
     * one; a blank or {@code null} agent or skill removes it.
     */
    public Task editTask(Plan plan, String taskId, String title, String agentType, String skill) {
        Task task = plan.requireTask(taskId).task();
        if (title != null) {
            task.setTitle(title);
        }
        task.setAgentType(blankToNull(agentType));
        task.setSkill(blankToNull(skill));
        log.info("Edited task {}", taskId);
        return task;
    }

    public Task removeTask(Plan plan, String taskId) {
        TaskLocation location = plan.requireTask(taskId);
        location.phase().removeTask(location.task());
        log.info("Removed task {}", taskId);
        return location.task();
    }

    public Phase removePhase(Plan plan, String phaseId) {
        Phase phase = plan.requirePhase(phaseId);
        plan.removePhase(phase);
        log.info("Removed phase {} ({} tasks)", phaseId, phase.getTasks().size());
        return phase;
    }

    public Relocation move(Plan plan, String taskId, String targetPhaseId) {
        Relocation relocation = taskRelocator.relocate(plan, taskId, targetPhaseId);
        metrics.recordRelocation(relocation.target().getId());
        return relocation;
    }

    /**
     * Sends work to a reserved phase. An existing task ID relocates that task;
     * any other argument that does not look like a task ID becomes the title
     * of a new pending task in the bucket. A non-blank {@code reason} is kept
     * as {@code tracking.defer_reason} when deferring.
     *
     * @throws TaskNotFoundException if {@code idOrTitle} looks like a task ID but matches no task
     */
    public TriageResult triage(Plan plan, String idOrTitle, ReservedPhase bucket, String reason) {
        TriageResult result;
        Optional<TaskLocation> existing = plan.findTask(idOrTitle);
        if (existing.isPresent()) {
            Relocation relocation = move(plan, idOrTitle, bucket.id());
            result = new TriageResult(relocation.oldId(), relocation.task(), relocation.target());
        } else if (TASK_ID_SHAPE.matcher(idOrTitle).matches()) {
            throw new TaskNotFoundException(idOrTitle);
        } else {
            Phase target = taskRelocator.resolveTarget(plan, bucket.id());
            result = new TriageResult(null, appendTask(target, idOrTitle, null, null, List.of()), target);
        }

        if (bucket == ReservedPhase.DEFERRED && reason != null && !reason.isBlank()) {
            result.task().tracking().put(Tracking.DEFER_REASON, reason.strip());
        }
        return result;
    }

    /**
     * Backs up the plan file, strips completed tasks and saves. The backup is
     * written before the compacted document. A dry run only counts.
     */
    public CompactionResult compact(Path planFile, int maxBackups, boolean dryRun) {
        Plan plan = planStore.load(planFile);
        if (dryRun) {
            return new CompactionResult(compactor.compact(plan), null);
        }
        Path backup = backupRotator.backup(planFile, properties.resolveBackupDir(planFile), maxBackups);
        int compacted = compactor.compact(plan);
        planStore.save(planFile, plan);
        metrics.recordCompaction(compacted);
        return new CompactionResult(compacted, backup);
    }

    public CompactionResult compact(Path planFile, boolean dryRun) {
        return compact(planFile, properties.getMaxBackups(), dryRun);
    }

    private Task appendTask(Phase phase, String title, String agentType, String skill, List<String> dependsOn) {
        String id = identifierAllocator.allocateTaskId(phase);
        Task task = Task.create(id, title);
        task.setAgentType(blankToNull(agentType));
        task.setSkill(blankToNull(skill));
        task.setDependsOn(dependsOn == null ? List.of() : dependsOn);
        phase.addTask(task);
        metrics.recordTaskCreated(phase.getId());
        log.info("Added task {} to phase {}", id, phase.getId());
        return task;
    }

    private String now() {
        return Timestamps.now(clock);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
