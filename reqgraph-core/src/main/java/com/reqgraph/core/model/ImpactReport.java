package com.reqgraph.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Result of a change-impact analysis.
 *
 * <p>Carries no timestamp so that repeated analyses of unchanged state compare equal.
 *
 * @param sourceEntity ID of the changed entity
 * @param changeType analyzed change type
 * @param directImpacts entities one edge away
 * @param indirectImpacts entities two edges away
 * @param cascadeImpacts entities beyond the second hop (bounded)
 * @param riskAssessment aggregated risk
 * @param mitigationStrategies suggested mitigations
 * @param affectedLayers sorted architectural layers touched by the impacts
 * @param testingRecommendations suggested testing actions
 */
public record ImpactReport(
    String sourceEntity,
    ChangeType changeType,
    List<ImpactItem> directImpacts,
    List<ImpactItem> indirectImpacts,
    List<ImpactItem> cascadeImpacts,
    RiskAssessment riskAssessment,
    List<String> mitigationStrategies,
    List<String> affectedLayers,
    List<String> testingRecommendations
) {
    /**
     * Compact constructor with validation.
     */
    public ImpactReport {
        Objects.requireNonNull(sourceEntity, "sourceEntity must not be null");
        Objects.requireNonNull(changeType, "changeType must not be null");
        Objects.requireNonNull(riskAssessment, "riskAssessment must not be null");
        directImpacts = directImpacts == null ? List.of() : List.copyOf(directImpacts);
        indirectImpacts = indirectImpacts == null ? List.of() : List.copyOf(indirectImpacts);
        cascadeImpacts = cascadeImpacts == null ? List.of() : List.copyOf(cascadeImpacts);
        mitigationStrategies = mitigationStrategies == null ? List.of() : List.copyOf(mitigationStrategies);
        affectedLayers = affectedLayers == null ? List.of() : List.copyOf(affectedLayers);
        testingRecommendations = testingRecommendations == null ? List.of() : List.copyOf(testingRecommendations);
    }

    /**
     * Returns direct, indirect and cascade impacts in that order.
     *
     * @return all impact items
     */
    public List<ImpactItem> allImpacts() {
        return Stream.of(directImpacts, indirectImpacts, cascadeImpacts)
            .flatMap(List::stream)
            .toList();
    }
}
