package com.planview.dispatch.api;

import com.planview.core.engine.PlanEngine;
import com.planview.core.ids.InvalidIdentifierException;
import com.planview.core.logging.MdcContext;
import com.planview.core.model.PhaseNotFoundException;
import com.planview.core.model.Plan;
import com.planview.core.model.Task;
import com.planview.core.model.TaskNotFoundException;
import com.planview.core.model.TaskStatus;
import com.planview.core.persistence.PlanNotFoundException;
import com.planview.core.persistence.PlanParseException;
import com.planview.core.persistence.PlanStore;
import com.planview.core.persistence.PlanStoreProperties;
import com.planview.core.relocation.Relocation;
import com.planview.core.relocation.UnknownPhaseException;
import com.planview.core.scheduler.DependencyResolver;
import com.planview.dispatch.JsonViews;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * JSON API over the configured plan file.
 * <p>
 * Every action is one load-change-save cycle. Cycles are serialised by a
 * single lock, which covers concurrent requests to this process only.
 */
@RestController
@RequestMapping("/api")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final PlanStore planStore;
    private final PlanEngine planEngine;
    private final DependencyResolver resolver;
    private final PlanStoreProperties properties;
    private final ReentrantLock lock = new ReentrantLock();

    public PlanController(PlanStore planStore,
                          PlanEngine planEngine,
                          DependencyResolver resolver,
                          PlanStoreProperties properties) {
        this.planStore = planStore;
        this.planEngine = planEngine;
        this.resolver = resolver;
        this.properties = properties;
    }

    /**
     * GET /api/plan: the whole document, as last saved.
     */
    @GetMapping("/plan")
    public ResponseEntity<?> getPlan() {
        return read(plan -> ResponseEntity.ok(plan));
    }

    /**
     * GET /api/next: the next actionable task, or 204 when there is none.
     */
    @GetMapping("/next")
    public ResponseEntity<?> getNext() {
        return read(plan -> resolver.nextActionableTask(plan)
                .<ResponseEntity<?>>map(location -> ResponseEntity.ok(JsonViews.TaskView.of(location)))
                .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    /**
     * GET /api/upcoming?limit=N: upcoming tasks, in progress first; all of them without a limit.
     */
    @GetMapping("/upcoming")
    public ResponseEntity<?> getUpcoming(@RequestParam(required = false) Integer limit) {
        if (limit != null && limit < 0) {
            return failure(HttpStatus.BAD_REQUEST, "limit must not be negative");
        }
        return read(plan -> {
            var upcoming = limit == null ? resolver.classifyUpcoming(plan) : resolver.classifyUpcoming(plan, limit);
            List<JsonViews.UpcomingView> body = upcoming.stream().map(JsonViews.UpcomingView::of).toList();
            return ResponseEntity.ok(body);
        });
    }

    /**
     * POST /api/{action}: one of done, start, block, skip, move, add-task, edit-task.
     */
    @PostMapping("/{action}")
    public ResponseEntity<Map<String, Object>> act(@PathVariable String action,
                                                   @RequestBody(required = false) PlanActionRequest request) {
        PlanActionRequest body = request != null ? request : new PlanActionRequest(null, null, null, null, null, null);
        Path planFile = properties.defaultPlanFile();
        lock.lock();
        try {
            MdcContext.setTask(planFile, body.id() == null ? "-" : body.id());
            Plan plan = planStore.load(planFile);
            Map<String, Object> result = apply(plan, action, body);
            planStore.save(planFile, plan);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("ok", true);
            response.putAll(result);
            return ResponseEntity.ok(response);
        } catch (RuntimeException e) {
            return failure(statusFor(e), e.getMessage());
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    private Map<String, Object> apply(Plan plan, String action, PlanActionRequest body) {
        return switch (action) {
            case "done" -> status(plan, body, TaskStatus.COMPLETED);
            case "start" -> status(plan, body, TaskStatus.IN_PROGRESS);
            case "block" -> status(plan, body, TaskStatus.BLOCKED);
            case "skip" -> status(plan, body, TaskStatus.SKIPPED);
            case "move" -> {
                Relocation relocation = planEngine.move(plan, require(body.id(), "id"), require(body.target(), "target"));
                yield Map.of("id", relocation.newId(), "previous_id", relocation.oldId());
            }
            case "add-task" -> {
                Task task = planEngine.addTask(plan, require(body.phase(), "phase"), require(body.title(), "title"),
                        body.agent(), body.skill(), List.of());
                yield Map.of("id", task.getId());
            }
            case "edit-task" -> {
                Task task = planEngine.editTask(plan, require(body.id(), "id"), body.title(), body.agent(), body.skill());
                yield Map.of("id", task.getId());
            }
            default -> throw new IllegalArgumentException("Unknown action: " + action);
        };
    }

    private Map<String, Object> status(Plan plan, PlanActionRequest body, TaskStatus status) {
        Task task = planEngine.setStatus(plan, require(body.id(), "id"), status);
        return Map.of("id", task.getId(), "status", status.value());
    }

    private ResponseEntity<?> read(Function<Plan, ResponseEntity<?>> view) {
        lock.lock();
        try {
            return view.apply(planStore.load(properties.defaultPlanFile()));
        } catch (RuntimeException e) {
            return failure(statusFor(e), e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required field '" + field + "'");
        }
        return value;
    }

    private static HttpStatus statusFor(RuntimeException e) {
        if (e instanceof TaskNotFoundException || e instanceof PhaseNotFoundException
                || e instanceof PlanNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof IllegalArgumentException || e instanceof UnknownPhaseException
                || e instanceof InvalidIdentifierException || e instanceof PlanParseException) {
            return HttpStatus.BAD_REQUEST;
        }
        log.error("Plan action failed", e);
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<Map<String, Object>> failure(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
