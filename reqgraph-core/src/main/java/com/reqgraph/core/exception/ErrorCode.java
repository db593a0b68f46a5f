package com.reqgraph.core.exception;

/**
 * Stable error codes for failures surfaced by the core engines.
 */
public enum ErrorCode {
    /** Empty or malformed query text, entity id, or option value. */
    INVALID_INPUT,

    /** A required entity is absent from the graph. */
    ENTITY_NOT_FOUND,

    /** The index store is unreadable or malformed. Fatal to reads until re-indexed. */
    INDEX_CORRUPT,

    /** A synchronization phase failed. */
    SYNC_FAILURE,

    /** A stored or supplied value violates the data model (e.g. unknown severity). */
    DATA_VALIDATION,

    /** Reading or writing one of the stores failed. */
    IO_FAILURE
}
