package com.reqgraph.core.query;

import com.reqgraph.core.model.CoverageReport;

import java.util.Objects;

/**
 * Whole-graph coverage analysis, returned by coverage and gap queries.
 *
 * @param coverage coverage gaps
 */
public record CoverageHit(
    CoverageReport coverage
) implements QueryHit {
    /**
     * Compact constructor with validation.
     */
    public CoverageHit {
        Objects.requireNonNull(coverage, "coverage must not be null");
    }

    @Override
    public String summary() {
        return coverage.gapCount() + " coverage gaps";
    }
}
