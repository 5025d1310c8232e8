package com.planview.core.progress;

import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.PlanBuilder;
import com.planview.core.model.PlanSummary;
import com.planview.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProgressAggregatorTest {

    private ProgressAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new ProgressAggregator();
    }

    @Test
    @DisplayName("computes per-phase progress and the plan summary")
    void computesProgress() {
        Plan plan = PlanBuilder.plan()
                .phase("0", "Setup")
                    .task("0.1.1", "A", TaskStatus.COMPLETED)
                    .task("0.1.2", "B", TaskStatus.PENDING)
                .phase("1", "Build")
                    .task("1.1.1", "C", TaskStatus.COMPLETED)
                    .task("1.1.2", "D", TaskStatus.COMPLETED)
                .build();

        aggregator.recalculate(plan);

        Phase setup = plan.requirePhase("0");
        assertEquals(1, setup.getProgress().completed());
        assertEquals(2, setup.getProgress().total());
        assertEquals(50.0, setup.getProgress().percentage());
        assertEquals(TaskStatus.IN_PROGRESS, setup.getStatus());
        assertEquals(TaskStatus.COMPLETED, plan.requirePhase("1").getStatus());

        assertEquals(new PlanSummary(2, 4, 3, 75.0), plan.getSummary());
    }

    @Test
    @DisplayName("an in-progress task promotes its phase even with nothing completed")
    void inProgressPromotesPhase() {
        Plan plan = PlanBuilder.plan()
                .phase("0", "Setup").task("0.1.1", "A", TaskStatus.IN_PROGRESS)
                .build();

        aggregator.recalculate(plan);

        assertEquals(TaskStatus.IN_PROGRESS, plan.requirePhase("0").getStatus());
        assertEquals(0.0, plan.requirePhase("0").getProgress().percentage());
    }

    @Test
    @DisplayName("empty phases report zero and keep their status")
    void emptyPhase() {
        Plan plan = PlanBuilder.plan().phase("0", "Setup", TaskStatus.SKIPPED).build();

        aggregator.recalculate(plan);

        Phase phase = plan.requirePhase("0");
        assertEquals(0, phase.getProgress().total());
        assertEquals(0.0, phase.getProgress().percentage());
        assertEquals(TaskStatus.SKIPPED, phase.getStatus());
        assertEquals(0.0, plan.getSummary().overallProgress());
    }

    @Test
    @DisplayName("a blocked phase with pending tasks is left blocked")
    void manualStatusSurvives() {
        Plan plan = PlanBuilder.plan()
                .phase("0", "Setup", TaskStatus.BLOCKED).task("0.1.1", "A", TaskStatus.PENDING)
                .build();

        aggregator.recalculate(plan);

        assertEquals(TaskStatus.BLOCKED, plan.requirePhase("0").getStatus());
    }

    @Test
    @DisplayName("running twice gives the same result as running once")
    void idempotent() {
        Plan plan = PlanBuilder.plan()
                .phase("0", "Setup")
                    .task("0.1.1", "A", TaskStatus.COMPLETED)
                    .task("0.1.2", "B", TaskStatus.BLOCKED)
                .phase("bugs", "Bugs")
                .build();

        aggregator.recalculate(plan);
        PlanSummary first = plan.getSummary();
        var firstProgress = plan.requirePhase("0").getProgress();
        var firstStatus = plan.requirePhase("0").getStatus();

        aggregator.recalculate(plan);

        assertEquals(first, plan.getSummary());
        assertEquals(firstProgress, plan.requirePhase("0").getProgress());
        assertEquals(firstStatus, plan.requirePhase("0").getStatus());
    }
}
