package com.reqgraph.core.query;

/**
 * A single query result. Each query type produces its own hit record.
 */
public interface QueryHit {

    /**
     * Returns a one-line description for console output.
     *
     * @return summary line
     */
    String summary();
}
