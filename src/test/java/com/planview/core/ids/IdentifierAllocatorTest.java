package com.planview.core.ids;

import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.PlanBuilder;
import com.planview.core.model.Task;
import com.planview.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierAllocatorTest {

    private IdentifierAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new IdentifierAllocator();
    }

    private static Phase phaseWith(String phaseId, String... taskIds) {
        Phase phase = Phase.create(phaseId, "Phase " + phaseId, "");
        for (String id : taskIds) {
            phase.addTask(Task.create(id, "Task " + id));
        }
        return phase;
    }

    @Nested
    @DisplayName("allocateTaskId")
    class TaskIds {

        @Test
        @DisplayName("an empty phase starts at <phase>.1.1")
        void emptyPhase() {
            assertEquals("2.1.1", allocator.allocateTaskId(phaseWith("2")));
            assertEquals("ideas.1.1", allocator.allocateTaskId(phaseWith("ideas")));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "1.1.1,1.1.2           | 1.1.3",
                "1.1.5,1.2.1           | 1.2.2",
                "1.2.1,1.1.9           | 1.2.2",
                "1.1.9,1.1.10          | 1.1.11",
                "1.3.2,1.1.1,1.3.7     | 1.3.8",
                "1.1.1,1.2.1           | 1.2.2"
        })
        @DisplayName("continues after the highest task of the highest section")
        void highestSection(String existing, String expected) {
            Phase phase = phaseWith("1", existing.split(","));

            assertEquals(expected, allocator.allocateTaskId(phase));
        }

        @Test
        @DisplayName("IDs with fewer than three parts are ignored")
        void shortIdsIgnored() {
            assertEquals("1.2.4", allocator.allocateTaskId(phaseWith("1", "1.2.3", "legacy", "1.9")));
        }

        @Test
        @DisplayName("a phase holding only short IDs gets <phase>.0.1")
        void onlyShortIds() {
            assertEquals("bugs.0.1", allocator.allocateTaskId(phaseWith("bugs", "oops", "bugs.1")));
        }

        @Test
        @DisplayName("allocate-then-append never repeats an ID, whatever the starting order")
        void uniqueness() {
            Phase phase = phaseWith("3", "3.2.9", "junk", "3.1.40", "3.2.1", "3");
            Set<String> seen = new HashSet<>();
            phase.getTasks().forEach(task -> seen.add(task.getId()));

            for (int i = 0; i < 20; i++) {
                String id = allocator.allocateTaskId(phase);
                assertTrue(seen.add(id), "duplicate " + id);
                phase.addTask(Task.create(id, "New " + i));
            }
        }

        @Test
        @DisplayName("a non-numeric segment fails instead of guessing")
        void nonNumericSegment() {
            Phase phase = phaseWith("1", "1.1.1", "1.x.2");

            InvalidIdentifierException error = assertThrows(InvalidIdentifierException.class,
                    () -> allocator.allocateTaskId(phase));
            assertTrue(error.getMessage().contains("1.x.2"));
        }

        @Test
        @DisplayName("a trailing dot is an empty numeric segment, not a short ID")
        void trailingDot() {
            Phase phase = phaseWith("0", "0.1.");

            InvalidIdentifierException error = assertThrows(InvalidIdentifierException.class,
                    () -> allocator.allocateTaskId(phase));
            assertTrue(error.getMessage().contains("0.1."));
        }

        @Test
        @DisplayName("fails rather than wrap past the largest task number")
        void taskNumberOverflow() {
            Phase phase = phaseWith("0", "0.1." + Integer.MAX_VALUE);

            assertThrows(InvalidIdentifierException.class, () -> allocator.allocateTaskId(phase));
        }

        @Test
        @DisplayName("a task number too large to parse is invalid")
        void taskNumberOutOfRange() {
            Phase phase = phaseWith("0", "0.1.99999999999");

            assertThrows(InvalidIdentifierException.class, () -> allocator.allocateTaskId(phase));
        }
    }

    @Nested
    @DisplayName("allocatePhaseId")
    class PhaseIds {

        @Test
        @DisplayName("an empty plan starts at 0")
        void emptyPlan() {
            assertEquals("0", allocator.allocatePhaseId(PlanBuilder.plan().build()));
        }

        @Test
        @DisplayName("numbers after the highest numbered phase, ignoring reserved ones")
        void afterHighest() {
            Plan plan = PlanBuilder.plan()
                    .phase("0", "Setup")
                    .phase("3", "Later")
                    .phase("bugs", "Bugs", TaskStatus.PENDING)
                    .phase("deferred", "Deferred")
                    .build();

            assertEquals("4", allocator.allocatePhaseId(plan));
        }

        @Test
        @DisplayName("a plan with only reserved phases starts at 0")
        void onlyReserved() {
            Plan plan = PlanBuilder.plan().phase("bugs", "Bugs").phase("ideas", "Ideas").build();

            assertEquals("0", allocator.allocatePhaseId(plan));
        }

        @Test
        @DisplayName("a phase ID too large to parse is invalid")
        void phaseIdOutOfRange() {
            Plan plan = PlanBuilder.plan().phase("0", "Setup").phase("99999999999", "Huge").build();

            InvalidIdentifierException error = assertThrows(InvalidIdentifierException.class,
                    () -> allocator.allocatePhaseId(plan));
            assertTrue(error.getMessage().contains("99999999999"));
        }

        @Test
        @DisplayName("fails rather than wrap past the largest phase number")
        void phaseIdOverflow() {
            Plan plan = PlanBuilder.plan().phase(String.valueOf(Integer.MAX_VALUE), "Last").build();

            assertThrows(InvalidIdentifierException.class, () -> allocator.allocatePhaseId(plan));
        }
    }
}
