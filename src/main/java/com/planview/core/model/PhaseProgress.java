package com.planview.core.model;

/**
 * Derived completion counters for one phase.
 *
 * @param completed  number of tasks with status {@code completed}
 * @param total      number of tasks in the phase
 * @param percentage {@code 100 * completed / total}, or 0 for an empty phase
 */
public record PhaseProgress(int completed, int total, double percentage) {

    public static final PhaseProgress EMPTY = new PhaseProgress(0, 0, 0);

    public static PhaseProgress of(int completed, int total) {
        return new PhaseProgress(completed, total, total > 0 ? completed * 100.0 / total : 0);
    }
}
