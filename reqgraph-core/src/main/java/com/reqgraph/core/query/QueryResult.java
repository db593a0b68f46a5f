package com.reqgraph.core.query;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link QueryEngine#query(String, QueryType)}.
 *
 * @param query query text as given
 * @param results hits in ranked order
 * @param metadata query type and result count
 */
public record QueryResult(
    String query,
    List<QueryHit> results,
    QueryMetadata metadata
) {
    /**
     * Compact constructor with validation.
     */
    public QueryResult {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        results = results == null ? List.of() : List.copyOf(results);
    }
}
