package com.planview.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Root aggregate of a plan document.
 * <p>
 * {@link #getSummary()} and every {@link Phase#getProgress()} are derived values;
 * they are only meaningful after the progress aggregator has run.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"meta", "summary", "phases", "decisions", "blockers"})
public class Plan {

    private PlanMeta meta;
    private PlanSummary summary;
    private List<Phase> phases = new ArrayList<>();
    private Decisions decisions;
    private List<Map<String, Object>> blockers;

    @JsonIgnore
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public Plan() {
    }

    public Plan(PlanMeta meta) {
        this.meta = meta;
        this.summary = PlanSummary.EMPTY;
    }

    public PlanMeta getMeta() {
        if (meta == null) {
            meta = new PlanMeta();
        }
        return meta;
    }

    public PlanSummary getSummary() {
        return summary == null ? PlanSummary.EMPTY : summary;
    }

    public void setSummary(PlanSummary summary) {
        this.summary = summary;
    }

    public List<Phase> getPhases() {
        if (phases == null) {
            phases = new ArrayList<>();
        }
        return Collections.unmodifiableList(phases);
    }

    public void addPhase(Phase phase) {
        getPhases();
        phases.add(phase);
    }

    public boolean removePhase(Phase phase) {
        return phases != null && phases.remove(phase);
    }

    /** Stable sort of the phase list. */
    public void sortPhases(Comparator<Phase> order) {
        getPhases();
        phases.sort(order);
    }

    public Decisions getDecisions() {
        return decisions;
    }

    public List<Map<String, Object>> getBlockers() {
        return blockers == null ? List.of() : Collections.unmodifiableList(blockers);
    }

    public Optional<Phase> findPhase(String phaseId) {
        return getPhases().stream().filter(p -> phaseId.equals(p.getId())).findFirst();
    }

    public Phase requirePhase(String phaseId) {
        return findPhase(phaseId).orElseThrow(() -> new PhaseNotFoundException(phaseId));
    }

    public Optional<TaskLocation> findTask(String taskId) {
        for (Phase phase : getPhases()) {
            Optional<Task> task = phase.findTask(taskId);
            if (task.isPresent()) {
                return Optional.of(new TaskLocation(phase, task.get()));
            }
        }
        return Optional.empty();
    }

    public TaskLocation requireTask(String taskId) {
        return findTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /** Every task of every phase, in phase-then-task order. */
    public Stream<TaskLocation> tasks() {
        return getPhases().stream()
                .flatMap(phase -> phase.getTasks().stream().map(task -> new TaskLocation(phase, task)));
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
