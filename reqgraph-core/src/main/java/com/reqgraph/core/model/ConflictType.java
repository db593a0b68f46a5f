package com.reqgraph.core.model;

/**
 * Classification of a divergence between the authoritative and derived stores.
 */
public enum ConflictType {
    /** Same content, different descriptive metadata (type, source). */
    METADATA_MISMATCH,

    /** Content differs, or one side is missing. */
    CONTENT_DIVERGENCE,

    /** Only the cross-reference fields differ. */
    DEPENDENCY_CONFLICT,

    /** The derived index was written by a different schema version. */
    SCHEMA_MISMATCH
}
