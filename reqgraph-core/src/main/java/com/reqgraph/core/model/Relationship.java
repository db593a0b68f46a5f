package com.reqgraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Directed, typed edge between two entities.
 *
 * <p>Duplicates of the same (source, target, type) are not collapsed by the model;
 * engines treat them as inert.
 *
 * @param source source entity ID
 * @param target target entity ID (may not resolve, see {@link DanglingReference})
 * @param type relationship type
 * @param metadata additional metadata such as the originating file
 */
public record Relationship(
    @JsonProperty("source") String source,
    @JsonProperty("target") String target,
    @JsonProperty("type") RelationshipType type,
    @JsonProperty("metadata") Map<String, String> metadata
) {
    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(type, "type must not be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Returns the endpoint opposite to {@code entityId}.
     *
     * @param entityId one endpoint of this relationship
     * @return the other endpoint
     */
    public String otherEnd(String entityId) {
        return source.equals(entityId) ? target : source;
    }

    /**
     * Returns true if either endpoint equals {@code entityId}.
     *
     * @param entityId entity ID
     * @return true if incident
     */
    public boolean touches(String entityId) {
        return source.equals(entityId) || target.equals(entityId);
    }
}
