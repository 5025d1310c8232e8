package com.planview.dispatch.api;

/**
 * Request body for {@code POST /api/{action}}. Each action reads only the
 * fields it needs.
 */
public record PlanActionRequest(
    String id,
    String target,
    String phase,
    String title,
    String agent,
    String skill
) {}
