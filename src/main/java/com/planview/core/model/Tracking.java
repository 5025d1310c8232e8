package com.planview.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bookkeeping attached to a task: two well-known timestamps plus an open
 * extension map for keys such as {@code defer_reason}, {@code notes} or
 * {@code time_spent_minutes}.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"started_at", "completed_at"})
public class Tracking {

    public static final String DEFER_REASON = "defer_reason";

    @JsonProperty("started_at")
    private String startedAt;

    @JsonProperty("completed_at")
    private String completedAt;

    @JsonIgnore
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public Tracking() {
    }

    public static Tracking completedOnly(String completedAt) {
        Tracking tracking = new Tracking();
        tracking.completedAt = completedAt;
        return tracking;
    }

    public String getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(String startedAt) {
        this.startedAt = startedAt;
    }

    public String getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(String completedAt) {
        this.completedAt = completedAt;
    }

    public Object get(String key) {
        return extra.get(key);
    }

    @JsonAnySetter
    public void put(String key, Object value) {
        extra.put(key, value);
    }

    public void remove(String key) {
        extra.remove(key);
    }

    @JsonAnyGetter
    public Map<String, Object> extras() {
        return Collections.unmodifiableMap(extra);
    }

    /** True when nothing but {@code completed_at} (or nothing at all) is recorded. */
    public boolean isCompletedOnly() {
        return startedAt == null && extra.isEmpty();
    }
}
