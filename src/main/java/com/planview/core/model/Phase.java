package com.planview.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level grouping of tasks. Either numbered ({@code "0"}, {@code "1"}, ...)
 * or one of the {@link ReservedPhase} buckets.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "name", "description", "status", "progress", "tasks"})
public class Phase {

    private String id;
    private String name;
    private String description;
    private TaskStatus status;
    private PhaseProgress progress;
    private List<Task> tasks = new ArrayList<>();

    @JsonIgnore
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public Phase() {
    }

    public static Phase create(String id, String name, String description) {
        Phase phase = new Phase();
        phase.id = id;
        phase.name = name;
        phase.description = description;
        phase.status = TaskStatus.PENDING;
        phase.progress = PhaseProgress.EMPTY;
        return phase;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public boolean hasStatus(TaskStatus expected) {
        return status == expected;
    }

    public PhaseProgress getProgress() {
        return progress == null ? PhaseProgress.EMPTY : progress;
    }

    public void setProgress(PhaseProgress progress) {
        this.progress = progress;
    }

    public List<Task> getTasks() {
        if (tasks == null) {
            tasks = new ArrayList<>();
        }
        return Collections.unmodifiableList(tasks);
    }

    public void addTask(Task task) {
        getTasks();
        tasks.add(task);
    }

    public boolean removeTask(Task task) {
        return tasks != null && tasks.remove(task);
    }

    public Optional<Task> findTask(String taskId) {
        return getTasks().stream().filter(t -> taskId.equals(t.getId())).findFirst();
    }

    public boolean isReserved() {
        return ReservedPhase.isReserved(id);
    }

    /** True when the ID is a non-negative integer such as {@code "0"} or {@code "12"}. */
    public boolean isNumbered() {
        return id != null && !id.isEmpty() && id.chars().allMatch(Character::isDigit);
    }

    @JsonAnySetter
    void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonAnyGetter
    Map<String, Object> extras() {
        return extra;
    }
}
