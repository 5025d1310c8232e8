package com.planview.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Free-form decision records, split into open and settled ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Decisions(
    List<Map<String, Object>> pending,
    List<Map<String, Object>> resolved
) {
}
