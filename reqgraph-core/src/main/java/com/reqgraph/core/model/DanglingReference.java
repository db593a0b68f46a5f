package com.reqgraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A relationship whose target does not resolve to a known entity.
 *
 * <p>Recorded in the index summary; never fatal.
 *
 * @param source entity declaring the reference
 * @param target unresolved target ID
 * @param type relationship type of the reference
 */
public record DanglingReference(
    @JsonProperty("source") String source,
    @JsonProperty("target") String target,
    @JsonProperty("type") RelationshipType type
) {
    /**
     * Compact constructor with validation.
     */
    public DanglingReference {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
