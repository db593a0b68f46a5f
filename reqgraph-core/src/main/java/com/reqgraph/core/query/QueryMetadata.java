package com.reqgraph.core.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Query result metadata. Holds no timestamp so repeated queries compare equal.
 *
 * @param queryType type the query was executed as, after auto-detection
 * @param resultsCount number of results
 */
public record QueryMetadata(
    @JsonProperty("query_type") QueryType queryType,
    @JsonProperty("results_count") int resultsCount
) {
    /**
     * Compact constructor with validation.
     */
    public QueryMetadata {
        Objects.requireNonNull(queryType, "queryType must not be null");
    }
}
