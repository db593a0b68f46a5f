package com.reqgraph.core.model;

/**
 * Resolution chosen for a sync conflict.
 */
public enum ConflictResolution {
    PREFER_AUTHORITATIVE,
    MANUAL_REVIEW_REQUIRED,
    MERGE_DEPENDENCIES,
    UPGRADE_TO_LATEST_SCHEMA;

    /**
     * Returns false for resolutions that must be handled by a person.
     *
     * @return true if the resolution is applied automatically
     */
    public boolean automatic() {
        return this != MANUAL_REVIEW_REQUIRED;
    }
}
