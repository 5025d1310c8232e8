package com.planview.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Project-level metadata of a plan document.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"project", "version", "created_at", "updated_at", "business_plan_path"})
public class PlanMeta {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final String DEFAULT_BUSINESS_PLAN_PATH = ".claude/BUSINESS_PLAN.md";

    private String project;
    private String version;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;

    @JsonProperty("business_plan_path")
    private String businessPlanPath;

    @JsonIgnore
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public PlanMeta() {
    }

    public PlanMeta(String project, String version, String createdAt, String businessPlanPath) {
        this.project = project;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.businessPlanPath = businessPlanPath;
    }

    public String getProject() {
        return project;
    }

    public String getVersion() {
        return version;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getBusinessPlanPath() {
        return businessPlanPath;
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
