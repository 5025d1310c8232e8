package com.planview.core.ids;

import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generates IDs for new or relocated tasks and for new phases.
 * <p>
 * Task IDs have the form {@code <phase>.<section>.<n>}. A new task always goes
 * into the highest section present, after the highest task number of that
 * section, even if a lower section holds a larger task number.
 */
@Component
public class IdentifierAllocator {

    private static final Logger log = LoggerFactory.getLogger(IdentifierAllocator.class);

    /**
     * Allocates the next task ID within the given phase.
     * <p>
     * IDs with fewer than three dot-separated parts are ignored. If every ID is
     * ignored the section and task number both start from 0, giving
     * {@code <phase>.0.1}.
     *
     * @throws InvalidIdentifierException if a section or task segment is not an
     *         integer, or the next task number would not fit in an {@code int}
     */
    public String allocateTaskId(Phase phase) {
        if (phase.getTasks().isEmpty()) {
            return phase.getId() + ".1.1";
        }

        int maxSection = 0;
        int maxTask = 0;
        for (Task task : phase.getTasks()) {
            String[] parts = task.getId().split("\\.", -1);
            if (parts.length < 3) {
                log.debug("Ignoring malformed task ID '{}' in phase {}", task.getId(), phase.getId());
                continue;
            }
            int section = parseSegment(task.getId(), parts[1]);
            int number = parseSegment(task.getId(), parts[2]);
            if (section > maxSection || (section == maxSection && number > maxTask)) {
                maxSection = section;
                maxTask = number;
            }
        }
        return phase.getId() + "." + maxSection + "." + increment(phase.getId() + "." + maxSection, maxTask);
    }

    /**
     * Returns one more than the highest numbered phase ID, starting at {@code "0"}.
     * Reserved phases do not take part.
     *
     * @throws InvalidIdentifierException if a numbered phase ID does not fit in an {@code int}
     */
    public String allocatePhaseId(Plan plan) {
        int max = -1;
        for (Phase phase : plan.getPhases()) {
            if (phase.isNumbered()) {
                max = Math.max(max, parsePhaseId(phase.getId()));
            }
        }
        return String.valueOf(increment("phase", max));
    }

    private static int parseSegment(String taskId, String segment) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            throw new InvalidIdentifierException(
                    "Task ID '" + taskId + "' has non-numeric segment '" + segment + "'", e);
        }
    }

    private static int parsePhaseId(String phaseId) {
        try {
            return Integer.parseInt(phaseId);
        } catch (NumberFormatException e) {
            throw new InvalidIdentifierException("Phase ID '" + phaseId + "' is out of range", e);
        }
    }

    private static int increment(String scope, int value) {
        try {
            return Math.addExact(value, 1);
        } catch (ArithmeticException e) {
            throw new InvalidIdentifierException("No ID left after " + value + " in " + scope, e);
        }
    }
}
