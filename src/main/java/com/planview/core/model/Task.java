package com.planview.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single trackable unit of work inside a {@link Phase}.
 * <p>
 * Optional fields stay {@code null} when absent from the document so that a
 * load/save cycle does not add keys the author never wrote. Keys this model
 * does not know about are carried in {@link #extras()}.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "title", "status", "agent_type", "skill", "depends_on", "tracking", "subtasks"})
public class Task {

    private String id;
    private String title;
    private TaskStatus status;

    @JsonProperty("agent_type")
    private String agentType;

    private String skill;

    @JsonProperty("depends_on")
    private List<String> dependsOn;

    private Tracking tracking;

    private List<Subtask> subtasks;

    @JsonIgnore
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public Task() {
    }

    /**
     * Creates a fresh pending task with empty tracking and no dependencies.
     */
    public static Task create(String id, String title) {
        Task task = new Task();
        task.id = id;
        task.title = title;
        task.status = TaskStatus.PENDING;
        task.dependsOn = new ArrayList<>();
        task.tracking = new Tracking();
        return task;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
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

    public String getAgentType() {
        return agentType;
    }

    public void setAgentType(String agentType) {
        this.agentType = agentType;
    }

    public String getSkill() {
        return skill;
    }

    public void setSkill(String skill) {
        this.skill = skill;
    }

    /** Dependencies in declaration order; empty when the task declares none. */
    public List<String> getDependsOn() {
        return dependsOn == null ? List.of() : Collections.unmodifiableList(dependsOn);
    }

    public void setDependsOn(List<String> dependsOn) {
        this.dependsOn = dependsOn == null ? null : new ArrayList<>(dependsOn);
    }

    /** The tracking record, or {@code null} when the document has none. */
    public Tracking getTracking() {
        return tracking;
    }

    public void setTracking(Tracking tracking) {
        this.tracking = tracking;
    }

    /** Returns the tracking record, creating an empty one if needed. */
    public Tracking tracking() {
        if (tracking == null) {
            tracking = new Tracking();
        }
        return tracking;
    }

    public List<Subtask> getSubtasks() {
        return subtasks == null ? List.of() : Collections.unmodifiableList(subtasks);
    }

    public void setSubtasks(List<Subtask> subtasks) {
        this.subtasks = subtasks == null ? null : new ArrayList<>(subtasks);
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> extras() {
        return Collections.unmodifiableMap(extra);
    }

    /**
     * Drops everything except {@code id}, {@code title}, {@code status} and
     * {@code tracking.completed_at}.
     *
     * @return {@code true} if any field was removed
     */
    public boolean stripToCompletedRecord() {
        boolean minimal = agentType == null && skill == null && dependsOn == null
                && subtasks == null && extra.isEmpty()
                && tracking != null && tracking.isCompletedOnly();
        if (minimal) {
            return false;
        }
        String completedAt = tracking == null ? null : tracking.getCompletedAt();
        agentType = null;
        skill = null;
        dependsOn = null;
        subtasks = null;
        extra.clear();
        tracking = Tracking.completedOnly(completedAt);
        return true;
    }
}
