package com.reqgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An entity whose criticality score reaches the critical threshold.
 *
 * @param entityId entity ID
 * @param entityType entity type
 * @param criticalityScore score in [0, 1]
 * @param incomingDependencies IDs of entities depending on or implementing this one
 * @param outgoingDependencies IDs of entities this one depends on
 * @param riskFactors reasons the entity is critical
 */
public record CriticalDependency(
    String entityId,
    EntityType entityType,
    double criticalityScore,
    List<String> incomingDependencies,
    List<String> outgoingDependencies,
    List<String> riskFactors
) {
    /**
     * Compact constructor with validation.
     */
    public CriticalDependency {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(entityType, "entityType must not be null");
        incomingDependencies = incomingDependencies == null ? List.of() : List.copyOf(incomingDependencies);
        outgoingDependencies = outgoingDependencies == null ? List.of() : List.copyOf(outgoingDependencies);
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }
}
