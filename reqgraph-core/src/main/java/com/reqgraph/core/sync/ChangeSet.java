package com.reqgraph.core.sync;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reqgraph.core.model.SyncConflict;

import java.util.List;

/**
 * Drift between the authoritative documents and the derived index.
 *
 * @param authoritativeUpdates entities whose document content changed or that are missing from the index
 * @param derivedUpdates derived knowledge not yet promoted into the documents
 * @param conflicts index-only entities of authoritative types
 */
public record ChangeSet(
    @JsonProperty("authoritative_updates") List<String> authoritativeUpdates,
    @JsonProperty("derived_updates") List<String> derivedUpdates,
    @JsonProperty("conflicts") List<SyncConflict> conflicts
) {
    /**
     * Compact constructor with validation.
     */
    public ChangeSet {
        authoritativeUpdates = authoritativeUpdates == null ? List.of() : List.copyOf(authoritativeUpdates);
        derivedUpdates = derivedUpdates == null ? List.of() : List.copyOf(derivedUpdates);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public boolean hasChanges() {
        return !authoritativeUpdates.isEmpty() || !derivedUpdates.isEmpty() || !conflicts.isEmpty();
    }

    public List<String> conflictIds() {
        return conflicts.stream().map(SyncConflict::entityId).toList();
    }
}
