package com.reqgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated risk of a change.
 *
 * @param overallRisk risk level derived from the score
 * @param riskScore additive risk score
 * @param riskFactors human-readable contributors to the score
 * @param mitigationRequired true iff the overall risk is high or critical
 */
public record RiskAssessment(
    RiskLevel overallRisk,
    int riskScore,
    List<String> riskFactors,
    boolean mitigationRequired
) {
    /**
     * Compact constructor with validation.
     */
    public RiskAssessment {
        Objects.requireNonNull(overallRisk, "overallRisk must not be null");
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }
}
