package com.reqgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A single entity affected by a change. Produced transiently, never persisted.
 *
 * @param entityId affected entity ID
 * @param entityType affected entity type
 * @param impactType impact classification (e.g. {@code implementation_change}, {@code indirect_dependency_impact})
 * @param severity impact severity
 * @param description human-readable description
 * @param path entity IDs from the changed entity to this one, inclusive
 * @param recommendations suggested follow-up actions
 */
public record ImpactItem(
    String entityId,
    EntityType entityType,
    String impactType,
    Severity severity,
    String description,
    List<String> path,
    List<String> recommendations
) {
    /**
     * Compact constructor with validation.
     */
    public ImpactItem {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(entityType, "entityType must not be null");
        Objects.requireNonNull(impactType, "impactType must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (description == null) {
            description = "";
        }
        path = path == null ? List.of() : List.copyOf(path);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
