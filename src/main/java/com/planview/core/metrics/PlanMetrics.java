package com.planview.core.metrics;

import com.planview.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for plan mutations.
 */
@Service
public class PlanMetrics {

    private final MeterRegistry registry;

    public PlanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStatusChange(TaskStatus status) {
        Counter.builder("planview.task.status_changes")
                .tag("status", status.value())
                .register(registry)
                .increment();
    }

    public void recordTaskCreated(String phaseId) {
        Counter.builder("planview.task.created")
                .tag("phase", phaseId)
                .register(registry)
                .increment();
    }

    public void recordRelocation(String targetPhaseId) {
        Counter.builder("planview.task.relocations")
                .tag("target", targetPhaseId)
                .register(registry)
                .increment();
    }

    /**
     * Records one compaction run and how many tasks it stripped.
     */
    public void recordCompaction(int compactedTasks) {
        Counter.builder("planview.compaction.runs")
                .register(registry)
                .increment();
        Counter.builder("planview.compaction.tasks")
                .description("Completed tasks reduced to their minimal record")
                .register(registry)
                .increment(compactedTasks);
    }
}
