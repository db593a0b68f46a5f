package com.reqgraph.core.store;

/**
 * Raw contents of the index artifacts at one point in time, for rollback.
 *
 * <p>A null component means the artifact did not exist.
 *
 * @param entities entities.json content
 * @param relationships relationships.json content
 * @param metadata metadata.json content
 */
public record IndexSnapshot(
    String entities,
    String relationships,
    String metadata
) {}
