package com.planview.core.scheduler;

import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.Task;
import com.planview.core.model.TaskLocation;
import com.planview.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers "what can be worked on right now" from the live status of every task.
 * <p>
 * A dependency is met only when it names an existing task whose status is
 * {@code completed}; an ID that matches no task is unmet. There is no graph
 * analysis: a task on a dependency cycle, or depending on itself, never
 * becomes actionable, while unrelated tasks stay selectable.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Finds the next task to work on.
     * <p>
     * Phases are scanned in stored order, skipping {@code completed} and
     * {@code skipped} ones. The first {@code in_progress} task wins outright;
     * otherwise the first {@code pending} task whose dependencies are all met.
     *
     * @param plan the plan to scan
     * @return the task and its phase, or empty when nothing is actionable
     */
    public Optional<TaskLocation> nextActionableTask(Plan plan) {
        Map<String, TaskStatus> statuses = statusIndex(plan);

        for (Phase phase : plan.getPhases()) {
            if (isClosed(phase)) {
                log.debug("  phase {} [{}]: skipped", phase.getId(), phase.getStatus());
                continue;
            }
            for (Task task : phase.getTasks()) {
                if (task.hasStatus(TaskStatus.IN_PROGRESS)) {
                    log.debug("  {} in progress, selected", task.getId());
                    return Optional.of(new TaskLocation(phase, task));
                }
                if (task.hasStatus(TaskStatus.PENDING)) {
                    if (dependenciesMet(task, statuses)) {
                        log.debug("  {} pending, deps met: {}", task.getId(), task.getDependsOn());
                        return Optional.of(new TaskLocation(phase, task));
                    }
                    log.debug("  {} pending, deps unmet: {}", task.getId(), task.getDependsOn());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Lists every in-progress, pending or blocked task of the open, numbered
     * phases, ordered: in progress, ready, waiting, blocked. Scan order is kept
     * within each group.
     */
    public List<UpcomingTask> classifyUpcoming(Plan plan) {
        Map<String, TaskStatus> statuses = statusIndex(plan);
        List<UpcomingTask> upcoming = new ArrayList<>();

        for (Phase phase : plan.getPhases()) {
            if (isClosed(phase) || phase.isReserved()) {
                continue;
            }
            for (Task task : phase.getTasks()) {
                TaskStatus status = task.getStatus();
                if (status == TaskStatus.IN_PROGRESS || status == TaskStatus.PENDING) {
                    upcoming.add(new UpcomingTask(phase, task, dependenciesMet(task, statuses)));
                } else if (status == TaskStatus.BLOCKED) {
                    upcoming.add(new UpcomingTask(phase, task, false));
                }
            }
        }

        upcoming.sort(Comparator.comparingInt(DependencyResolver::priority));
        return upcoming;
    }

    /**
     * Same as {@link #classifyUpcoming(Plan)}, truncated to {@code limit} entries.
     *
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    public List<UpcomingTask> classifyUpcoming(Plan plan, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got " + limit);
        }
        List<UpcomingTask> all = classifyUpcoming(plan);
        return all.size() > limit ? List.copyOf(all.subList(0, limit)) : all;
    }

    /**
     * Returns the first {@code in_progress} phase, else the first {@code pending} one.
     */
    public Optional<Phase> currentPhase(Plan plan) {
        Optional<Phase> active = plan.getPhases().stream()
                .filter(p -> p.hasStatus(TaskStatus.IN_PROGRESS))
                .findFirst();
        if (active.isPresent()) {
            return active;
        }
        return plan.getPhases().stream()
                .filter(p -> p.hasStatus(TaskStatus.PENDING))
                .findFirst();
    }

    /**
     * Completed tasks, most recently completed first. Tasks without a
     * {@code completed_at} timestamp come last.
     */
    public List<TaskLocation> recentlyCompleted(Plan plan, int count) {
        Comparator<TaskLocation> byCompletion = Comparator.comparing(
                DependencyResolver::completedAt, Comparator.nullsFirst(Comparator.naturalOrder()));
        return plan.tasks()
                .filter(loc -> loc.task().hasStatus(TaskStatus.COMPLETED))
                .sorted(byCompletion.reversed())
                .limit(count)
                .toList();
    }

    /**
     * Checks a single task's dependencies against the current plan.
     */
    public boolean dependenciesMet(Plan plan, Task task) {
        return dependenciesMet(task, statusIndex(plan));
    }

    private boolean dependenciesMet(Task task, Map<String, TaskStatus> statuses) {
        for (String dep : task.getDependsOn()) {
            if (statuses.get(dep) != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, TaskStatus> statusIndex(Plan plan) {
        Map<String, TaskStatus> statuses = new HashMap<>();
        plan.tasks().forEach(loc -> statuses.putIfAbsent(loc.task().getId(), loc.task().getStatus()));
        return statuses;
    }

    private static boolean isClosed(Phase phase) {
        return phase.hasStatus(TaskStatus.COMPLETED) || phase.hasStatus(TaskStatus.SKIPPED);
    }

    private static int priority(UpcomingTask entry) {
        return switch (entry.task().getStatus()) {
            case IN_PROGRESS -> 0;
            case PENDING -> entry.actionable() ? 1 : 2;
            default -> 3;
        };
    }

    private static String completedAt(TaskLocation location) {
        var tracking = location.task().getTracking();
        return tracking == null ? null : tracking.getCompletedAt();
    }
}
