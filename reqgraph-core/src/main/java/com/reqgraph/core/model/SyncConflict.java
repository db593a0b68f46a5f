package com.reqgraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A divergence between the authoritative and derived view of one entity.
 *
 * <p>Both values are kept; neither is discarded by resolution.
 *
 * @param entityId entity ID
 * @param conflictType conflict classification
 * @param authoritativeValue entity as derived from the documents, or null if absent there
 * @param derivedValue entity as stored in the index, or null if absent there
 * @param resolution chosen resolution, or null while unresolved
 */
public record SyncConflict(
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("conflict_type") ConflictType conflictType,
    @JsonProperty("authoritative_value") Entity authoritativeValue,
    @JsonProperty("derived_value") Entity derivedValue,
    @JsonProperty("resolution") ConflictResolution resolution
) {
    /**
     * Compact constructor with validation.
     */
    public SyncConflict {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(conflictType, "conflictType must not be null");
    }

    public SyncConflict withResolution(ConflictResolution chosen) {
        return new SyncConflict(entityId, conflictType, authoritativeValue, derivedValue, chosen);
    }

    /**
     * Returns true when the conflict was classified but needs manual handling.
     *
     * @return true if unresolved
     */
    public boolean unresolved() {
        return resolution == null || !resolution.automatic();
    }
}
