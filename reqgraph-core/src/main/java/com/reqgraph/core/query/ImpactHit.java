package com.reqgraph.core.query;

import com.reqgraph.core.model.ImpactReport;

import java.util.Objects;

/**
 * Impact report for an entity named in an impact query.
 *
 * @param entityId analyzed entity
 * @param report impact report for a modification of the entity
 */
public record ImpactHit(
    String entityId,
    ImpactReport report
) implements QueryHit {
    /**
     * Compact constructor with validation.
     */
    public ImpactHit {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(report, "report must not be null");
    }

    @Override
    public String summary() {
        return entityId + ": " + report.allImpacts().size() + " impacts, risk "
            + report.riskAssessment().overallRisk().label();
    }
}
