package com.planview.core.model;

import java.util.Optional;

/**
 * Triage buckets that exist alongside the numbered phases.
 * <p>
 * Declaration order is the order in which they sort after the numbered phases.
 */
public enum ReservedPhase {
    BUGS("bugs", "Bugs", "Tasks identified as bugs requiring fixes"),
    IDEAS("ideas", "Ideas", "Tasks stored as future ideas or concepts"),
    DEFERRED("deferred", "Deferred", "Tasks postponed for later consideration");

    private final String id;
    private final String displayName;
    private final String description;

    ReservedPhase(String id, String displayName, String description) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public Phase newPhase() {
        return Phase.create(id, displayName, description);
    }

    public static Optional<ReservedPhase> fromId(String phaseId) {
        for (ReservedPhase reserved : values()) {
            if (reserved.id.equals(phaseId)) {
                return Optional.of(reserved);
            }
        }
        return Optional.empty();
    }

    public static boolean isReserved(String phaseId) {
        return fromId(phaseId).isPresent();
    }
}
