package com.planview.core.engine;

import com.planview.core.compaction.BackupRotator;
import com.planview.core.compaction.Compactor;
import com.planview.core.ids.IdentifierAllocator;
import com.planview.core.metrics.PlanMetrics;
import com.planview.core.model.Phase;
import com.planview.core.model.PhaseNotFoundException;
import com.planview.core.model.Plan;
import com.planview.core.model.PlanBuilder;
import com.planview.core.model.ReservedPhase;
import com.planview.core.model.Subtask;
import com.planview.core.model.Task;
import com.planview.core.model.TaskNotFoundException;
import com.planview.core.model.TaskStatus;
import com.planview.core.model.Tracking;
import com.planview.core.persistence.PlanStore;
import com.planview.core.persistence.PlanStoreProperties;
import com.planview.core.progress.ProgressAggregator;
import com.planview.core.relocation.Relocation;
import com.planview.core.relocation.TaskRelocator;
import com.planview.core.relocation.UnknownPhaseException;
import com.planview.core.scheduler.DependencyResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the PlanEngine service.
 * Wires the real collaborators with a fixed clock and an in-memory meter registry.
 */
class PlanEngineTest {

    private static final String NOW = "2025-01-02T03:04:05.123456Z";

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private PlanStore planStore;
    private PlanEngine engine;
    private Plan plan;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse(NOW), ZoneOffset.UTC);
        IdentifierAllocator allocator = new IdentifierAllocator();
        registry = new SimpleMeterRegistry();
        planStore = new PlanStore(new ProgressAggregator(), clock);
        engine = new PlanEngine(allocator, new TaskRelocator(allocator), new Compactor(), new BackupRotator(),
                planStore, new PlanStoreProperties(), new PlanMetrics(registry), clock);

        plan = PlanBuilder.plan()
                .phase("0", "Setup")
                    .task("0.1.1", "Scaffold", TaskStatus.COMPLETED)
                    .task("0.1.2", "Wire CI", TaskStatus.PENDING, "0.1.1")
                .phase("1", "Build")
                    .task("1.1.1", "Feature", TaskStatus.PENDING)
                .phase("bugs", "Bugs")
                .phase("deferred", "Deferred")
                .build();
    }

    private Task task(String id) {
        return PlanBuilder.task(plan, id);
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("init creates an empty plan stamped with the clock")
        void init() {
            Plan created = engine.init("Demo");

            assertEquals("Demo", created.getMeta().getProject());
            assertEquals("1.0.0", created.getMeta().getVersion());
            assertEquals(NOW, created.getMeta().getCreatedAt());
            assertEquals(NOW, created.getMeta().getUpdatedAt());
            assertEquals(".claude/BUSINESS_PLAN.md", created.getMeta().getBusinessPlanPath());
            assertTrue(created.getPhases().isEmpty());
            assertEquals(0, created.getSummary().totalTasks());
        }

        @Test
        @DisplayName("addPhase numbers after the highest numbered phase")
        void addPhase() {
            Phase phase = engine.addPhase(plan, "Ship", null);

            assertEquals("2", phase.getId());
            assertEquals("", phase.getDescription());
            assertEquals(TaskStatus.PENDING, phase.getStatus());
        }

        @Test
        @DisplayName("addTask appends a pending task with the next ID")
        void addTask() {
            Task added = engine.addTask(plan, "0", "Docs", "writer", " ", List.of("0.1.2"));

            assertEquals("0.1.3", added.getId());
            assertEquals(TaskStatus.PENDING, added.getStatus());
            assertEquals("writer", added.getAgentType());
            assertNull(added.getSkill());
            assertEquals(List.of("0.1.2"), added.getDependsOn());
            assertNotNull(added.getTracking());
            assertEquals(1.0, registry.find("planview.task.created").tag("phase", "0").counter().count());
        }

        @Test
        @DisplayName("addTask into a missing phase fails")
        void addTaskMissingPhase() {
            assertThrows(PhaseNotFoundException.class,
                    () -> engine.addTask(plan, "9", "Nope", null, null, List.of()));
        }

        @Test
        @DisplayName("removeTask and removePhase drop the element")
        void remove() {
            engine.removeTask(plan, "0.1.2");
            assertTrue(plan.findTask("0.1.2").isEmpty());

            Phase removed = engine.removePhase(plan, "1");
            assertEquals(1, removed.getTasks().size());
            assertTrue(plan.findPhase("1").isEmpty());

            assertThrows(TaskNotFoundException.class, () -> engine.removeTask(plan, "0.1.2"));
            assertThrows(PhaseNotFoundException.class, () -> engine.removePhase(plan, "1"));
        }
    }

    @Nested
    @DisplayName("Status and fields")
    class Status {

        @Test
        @DisplayName("in_progress stamps started_at")
        void start() {
            engine.setStatus(plan, "1.1.1", TaskStatus.IN_PROGRESS);

            assertEquals(TaskStatus.IN_PROGRESS, task("1.1.1").getStatus());
            assertEquals(NOW, task("1.1.1").getTracking().getStartedAt());
            assertNull(task("1.1.1").getTracking().getCompletedAt());
        }

        @Test
        @DisplayName("completed stamps completed_at and completes every subtask")
        void completeCascades() {
            task("1.1.1").setSubtasks(List.of(
                    new Subtask("1.1.1.1", "One", TaskStatus.PENDING),
                    new Subtask("1.1.1.2", "Two", TaskStatus.BLOCKED)));

            engine.setStatus(plan, "1.1.1", TaskStatus.COMPLETED);

            assertEquals(NOW, task("1.1.1").getTracking().getCompletedAt());
            assertTrue(task("1.1.1").getSubtasks().stream().allMatch(s -> s.getStatus() == TaskStatus.COMPLETED));
            assertEquals(1.0, registry.find("planview.task.status_changes").tag("status", "completed").counter().count());
        }

        @Test
        @DisplayName("blocked and skipped leave tracking and subtasks alone")
        void blockLeavesTracking() {
            task("1.1.1").setSubtasks(List.of(new Subtask("1.1.1.1", "One", TaskStatus.PENDING)));

            engine.setStatus(plan, "1.1.1", TaskStatus.BLOCKED);

            assertNull(task("1.1.1").getTracking().getStartedAt());
            assertNull(task("1.1.1").getTracking().getCompletedAt());
            assertEquals(TaskStatus.PENDING, task("1.1.1").getSubtasks().get(0).getStatus());
        }

        @Test
        @DisplayName("setStatus on a missing task fails")
        void missingTask() {
            assertThrows(TaskNotFoundException.class, () -> engine.setStatus(plan, "7.7.7", TaskStatus.COMPLETED));
        }

        @Test
        @DisplayName("setField handles title, agent, skill and status")
        void setField() {
            engine.setField(plan, "1.1.1", "title", "Renamed");
            engine.setField(plan, "1.1.1", "agent", "backend");
            engine.setField(plan, "1.1.1", "skill", "java");
            engine.setField(plan, "1.1.1", "status", "in_progress");

            Task edited = task("1.1.1");
            assertEquals("Renamed", edited.getTitle());
            assertEquals("backend", edited.getAgentType());
            assertEquals("java", edited.getSkill());
            assertEquals(TaskStatus.IN_PROGRESS, edited.getStatus());
            assertEquals(NOW, edited.getTracking().getStartedAt());

            engine.setField(plan, "1.1.1", "agent", "none");
            engine.setField(plan, "1.1.1", "skill", "none");
            assertNull(edited.getAgentType());
            assertNull(edited.getSkill());
        }

        @Test
        @DisplayName("setField rejects unknown fields and invalid statuses")
        void setFieldRejects() {
            IllegalArgumentException field = assertThrows(IllegalArgumentException.class,
                    () -> engine.setField(plan, "1.1.1", "priority", "high"));
            assertEquals("Unknown field 'priority'. Use: status, agent, title, skill", field.getMessage());

            IllegalArgumentException status = assertThrows(IllegalArgumentException.class,
                    () -> engine.setField(plan, "1.1.1", "status", "finished"));
            assertTrue(status.getMessage().contains("finished"));
            assertEquals(TaskStatus.PENDING, task("1.1.1").getStatus());
        }

        @Test
        @DisplayName("editTask keeps a null title and clears blank agent and skill")
        void editTask() {
            task("1.1.1").setAgentType("backend");
            task("1.1.1").setSkill("java");

            engine.editTask(plan, "1.1.1", null, "", null);

            assertEquals("Feature", task("1.1.1").getTitle());
            assertNull(task("1.1.1").getAgentType());
            assertNull(task("1.1.1").getSkill());

            engine.editTask(plan, "1.1.1", "New title", "frontend", "css");
            assertEquals("New title", task("1.1.1").getTitle());
            assertEquals("frontend", task("1.1.1").getAgentType());
            assertEquals("css", task("1.1.1").getSkill());
        }
    }

    @Nested
    @DisplayName("Relocation and triage")
    class Triage {

        @Test
        @DisplayName("move relocates and records the target")
        void move() {
            Relocation relocation = engine.move(plan, "0.1.2", "1");

            assertEquals("1.1.2", relocation.newId());
            assertEquals(List.of(), relocation.task().getDependsOn());
            assertEquals(1.0, registry.find("planview.task.relocations").tag("target", "1").counter().count());
        }

        @Test
        @DisplayName("move to an unknown phase fails")
        void moveUnknown() {
            assertThrows(UnknownPhaseException.class, () -> engine.move(plan, "0.1.2", "nowhere"));
        }

        @Test
        @DisplayName("triage of an existing ID moves the task")
        void triageExisting() {
            TriageResult result = engine.triage(plan, "1.1.1", ReservedPhase.BUGS, null);

            assertFalse(result.created());
            assertEquals("1.1.1", result.previousId());
            assertEquals("bugs.1.1", result.task().getId());
            assertEquals("bugs", result.phase().getId());
        }

        @Test
        @DisplayName("triage of free text creates a task in the bucket")
        void triageCreates() {
            TriageResult result = engine.triage(plan, "Login fails on Safari", ReservedPhase.BUGS, null);

            assertTrue(result.created());
            assertEquals("bugs.1.1", result.task().getId());
            assertEquals("Login fails on Safari", result.task().getTitle());
            assertEquals(TaskStatus.PENDING, result.task().getStatus());
        }

        @Test
        @DisplayName("the ideas bucket is created on first use")
        void triageCreatesIdeas() {
            TriageResult result = engine.triage(plan, "Dark mode", ReservedPhase.IDEAS, null);

            assertEquals("ideas.1.1", result.task().getId());
            assertEquals("Ideas", plan.requirePhase("ideas").getName());
        }

        @Test
        @DisplayName("an argument shaped like a task ID that matches nothing fails")
        void triageUnknownId() {
            assertThrows(TaskNotFoundException.class, () -> engine.triage(plan, "9.9.9", ReservedPhase.DEFERRED, null));
            assertTrue(plan.requirePhase("deferred").getTasks().isEmpty());
        }

        @Test
        @DisplayName("defer stores a stripped reason and keeps other tracking fields")
        void deferReason() {
            task("1.1.1").tracking().setStartedAt("2025-01-01T08:00:00Z");

            TriageResult result = engine.triage(plan, "1.1.1", ReservedPhase.DEFERRED, "  waiting on design  ");

            Tracking tracking = result.task().getTracking();
            assertEquals("waiting on design", tracking.get(Tracking.DEFER_REASON));
            assertEquals("2025-01-01T08:00:00Z", tracking.getStartedAt());
        }

        @Test
        @DisplayName("a blank reason is not stored, and only defer stores reasons")
        void reasonIgnored() {
            TriageResult deferred = engine.triage(plan, "Later", ReservedPhase.DEFERRED, "   ");
            TriageResult bug = engine.triage(plan, "Crash", ReservedPhase.BUGS, "ignored");

            assertNull(deferred.task().getTracking().get(Tracking.DEFER_REASON));
            assertNull(bug.task().getTracking().get(Tracking.DEFER_REASON));
        }
    }

    @Test
    @DisplayName("completing a chain of two tasks walks next and finishes the phase")
    void twoTaskScenario() {
        Plan chain = PlanBuilder.plan()
                .phase("0", "Setup")
                    .task("0.1.1", "A", TaskStatus.PENDING)
                    .task("0.1.2", "B", TaskStatus.PENDING, "0.1.1")
                .build();
        DependencyResolver resolver = new DependencyResolver();
        ProgressAggregator aggregator = new ProgressAggregator();

        assertEquals("0.1.1", resolver.nextActionableTask(chain).orElseThrow().task().getId());
        engine.setStatus(chain, "0.1.1", TaskStatus.COMPLETED);
        assertEquals("0.1.2", resolver.nextActionableTask(chain).orElseThrow().task().getId());
        engine.setStatus(chain, "0.1.2", TaskStatus.COMPLETED);
        aggregator.recalculate(chain);

        assertEquals(TaskStatus.COMPLETED, chain.requirePhase("0").getStatus());
        assertEquals(100.0, chain.getSummary().overallProgress());
        assertTrue(resolver.nextActionableTask(chain).isEmpty());
    }

    @Nested
    @DisplayName("Compaction")
    class Compaction {

        private Path planFile;

        @BeforeEach
        void savePlan() {
            planFile = tempDir.resolve("plan.json");
            Task rich = task("0.1.1");
            rich.setAgentType("backend");
            rich.tracking().setStartedAt("2025-01-01T08:00:00Z");
            rich.tracking().setCompletedAt("2025-01-01T09:00:00Z");
            planStore.save(planFile, plan);
        }

        @Test
        @DisplayName("backs up the original file before saving the compacted one")
        void compacts() throws IOException {
            String before = Files.readString(planFile);

            CompactionResult result = engine.compact(planFile, 3, false);

            assertEquals(1, result.compacted());
            assertEquals(tempDir.resolve(".claude/plan-view/plan.json.1"), result.backup());
            assertEquals(before, Files.readString(result.backup()));

            Task stripped = planStore.load(planFile).requireTask("0.1.1").task();
            assertNull(stripped.getAgentType());
            assertNull(stripped.getTracking().getStartedAt());
            assertEquals("2025-01-01T09:00:00Z", stripped.getTracking().getCompletedAt());
            assertEquals(1.0, registry.find("planview.compaction.runs").counter().count());
        }

        @Test
        @DisplayName("a dry run counts without touching the file or the backups")
        void dryRun() throws IOException {
            String before = Files.readString(planFile);

            CompactionResult result = engine.compact(planFile, true);

            assertEquals(1, result.compacted());
            assertNull(result.backup());
            assertEquals(before, Files.readString(planFile));
            assertFalse(Files.exists(tempDir.resolve(".claude")));
        }

        @Test
        @DisplayName("a run with nothing to strip still backs up and saves")
        void nothingToStrip() {
            engine.compact(planFile, false);

            CompactionResult second = engine.compact(planFile, false);

            assertEquals(0, second.compacted());
            assertTrue(Files.exists(tempDir.resolve(".claude/plan-view/plan.json.2")));
        }
    }
}
