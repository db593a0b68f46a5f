package com.reqgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Read-only projection of what removing an entity would break.
 *
 * @param removedEntity ID of the entity whose removal is simulated
 * @param brokenRelationships every relationship incident to the entity
 * @param orphanedEntities targets of {@code IMPLEMENTS} edges sourced at the entity
 * @param cascadeRemovals dependents with no alternative {@code DEPENDS_ON} target
 * @param affectedContracts contracts whose {@code applies_to} names the entity
 * @param recoveryPlan suggested recovery steps
 */
public record RemovalSimulation(
    String removedEntity,
    List<Relationship> brokenRelationships,
    List<String> orphanedEntities,
    List<String> cascadeRemovals,
    List<String> affectedContracts,
    List<String> recoveryPlan
) {
    /**
     * Compact constructor with validation.
     */
    public RemovalSimulation {
        Objects.requireNonNull(removedEntity, "removedEntity must not be null");
        brokenRelationships = brokenRelationships == null ? List.of() : List.copyOf(brokenRelationships);
        orphanedEntities = orphanedEntities == null ? List.of() : List.copyOf(orphanedEntities);
        cascadeRemovals = cascadeRemovals == null ? List.of() : List.copyOf(cascadeRemovals);
        affectedContracts = affectedContracts == null ? List.of() : List.copyOf(affectedContracts);
        recoveryPlan = recoveryPlan == null ? List.of() : List.copyOf(recoveryPlan);
    }
}
