package com.reqgraph.core.sync;

import com.reqgraph.core.model.SyncConflict;

import java.util.List;

/**
 * Outcome of a sync operation.
 *
 * @param success true if every phase completed
 * @param entitiesUpdated entities re-indexed or promoted
 * @param conflicts conflicts with their chosen resolutions
 * @param error failure description including the failed phase, null on success
 */
public record SyncResult(
    boolean success,
    int entitiesUpdated,
    List<SyncConflict> conflicts,
    String error
) {
    /**
     * Compact constructor with validation.
     */
    public SyncResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static SyncResult ok(int entitiesUpdated, List<SyncConflict> conflicts) {
        return new SyncResult(true, entitiesUpdated, conflicts, null);
    }

    public static SyncResult failed(String error) {
        return new SyncResult(false, 0, List.of(), error);
    }
}
