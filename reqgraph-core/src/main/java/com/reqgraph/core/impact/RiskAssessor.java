package com.reqgraph.core.impact;

import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.EntityType;
import com.reqgraph.core.model.ImpactItem;
import com.reqgraph.core.model.RiskAssessment;
import com.reqgraph.core.model.RiskLevel;
import com.reqgraph.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Scores the risk of a change and derives mitigation and testing advice.
 *
 * <p>Score contributions:
 * <ul>
 *   <li>+3 when the changed entity is a requirement or contract</li>
 *   <li>+2 when there are more than 10 impacts in total, +1 when more than 5</li>
 *   <li>+1 per critical impact among direct and indirect impacts</li>
 *   <li>+1 when impacts span more than two architectural layers</li>
 * </ul>
 */
public class RiskAssessor {

    static final int CRITICAL_TYPE_WEIGHT = 3;

    /**
     * Computes the risk assessment for a change.
     *
     * @param source changed entity
     * @param direct direct impacts
     * @param indirect indirect impacts
     * @param cascade cascade impacts
     * @param affectedLayers layers touched by the impacts
     * @return risk assessment
     */
    public RiskAssessment assess(Entity source, List<ImpactItem> direct, List<ImpactItem> indirect,
                                 List<ImpactItem> cascade, List<String> affectedLayers) {
        List<String> factors = new ArrayList<>();
        int score = 0;

        if (source.type() == EntityType.REQUIREMENT || source.type() == EntityType.CONTRACT) {
            factors.add("Critical entity type");
            score += CRITICAL_TYPE_WEIGHT;
        }

        int total = direct.size() + indirect.size() + cascade.size();
        if (total > 10) {
            factors.add("High impact count");
            score += 2;
        } else if (total > 5) {
            factors.add("Medium impact count");
            score += 1;
        }

        long critical = Stream.concat(direct.stream(), indirect.stream())
            .filter(item -> item.severity() == Severity.CRITICAL)
            .count();
        if (critical > 0) {
            factors.add("Critical severity impacts");
            score += (int) critical;
        }

        if (affectedLayers.size() > 2) {
            factors.add("Multiple layer impact");
            score += 1;
        }

        RiskLevel level = RiskLevel.fromScore(score);
        return new RiskAssessment(level, score, factors, level.requiresMitigation());
    }

    /**
     * Suggests mitigations from the risk level, impact types and layer spread.
     */
    public List<String> mitigationStrategies(RiskAssessment risk, List<ImpactItem> direct,
                                             List<ImpactItem> indirect, List<String> affectedLayers) {
        List<String> strategies = new ArrayList<>();
        if (risk.overallRisk() == RiskLevel.CRITICAL) {
            strategies.add("Implement phased rollout with rollback plan");
            strategies.add("Create comprehensive test suite covering all impacts");
            strategies.add("Set up monitoring for all affected entities");
            strategies.add("Prepare hotfix deployment process");
        } else if (risk.overallRisk() == RiskLevel.HIGH) {
            strategies.add("Perform staged deployment");
            strategies.add("Enhanced testing of affected components");
            strategies.add("Monitor key metrics during rollout");
        }

        Set<String> impactTypes = new LinkedHashSet<>();
        Stream.concat(direct.stream(), indirect.stream()).forEach(item -> impactTypes.add(item.impactType()));
        if (impactTypes.contains(ImpactAnalyzer.IMPLEMENTATION_CHANGE)) {
            strategies.add("Update related contracts and BDD scenarios");
        }
        if (impactTypes.contains(ImpactAnalyzer.DEPENDENCY_IMPACT)) {
            strategies.add("Verify dependency compatibility");
        }
        if (impactTypes.contains(ImpactAnalyzer.CONTRACT_VALIDATION)) {
            strategies.add("Re-validate all affected contracts");
        }
        if (affectedLayers.size() > 1) {
            strategies.add("Coordinate changes across affected layers");
        }
        return strategies;
    }

    /**
     * Suggests testing activities for the impacted scope.
     */
    public List<String> testingRecommendations(List<ImpactItem> direct, List<ImpactItem> indirect,
                                               List<String> affectedLayers) {
        List<String> recommendations = new ArrayList<>();
        recommendations.add("Unit tests for modified entity");
        recommendations.add("Integration tests for direct impacts");

        if (direct.size() + indirect.size() > 5) {
            recommendations.add("Regression test suite execution");
            recommendations.add("End-to-end testing of affected workflows");
        }
        if (affectedLayers.contains("foundation")) {
            recommendations.add("Infrastructure and configuration testing");
        }
        if (affectedLayers.contains("application")) {
            recommendations.add("Business logic validation testing");
        }
        if (affectedLayers.contains("deployment")) {
            recommendations.add("Deployment and operational testing");
        }
        boolean contractImpact = Stream.concat(direct.stream(), indirect.stream())
            .anyMatch(item -> ImpactAnalyzer.CONTRACT_VALIDATION.equals(item.impactType()));
        if (contractImpact) {
            recommendations.add("Contract compliance verification");
        }
        return recommendations;
    }
}
