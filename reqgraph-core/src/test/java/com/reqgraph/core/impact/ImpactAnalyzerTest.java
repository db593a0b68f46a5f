package com.reqgraph.core.impact;

import com.reqgraph.core.WorkspaceTestBase;
import com.reqgraph.core.exception.EntityNotFoundException;
import com.reqgraph.core.exception.ErrorCode;
import com.reqgraph.core.graph.RequirementGraph;
import com.reqgraph.core.model.ChangeType;
import com.reqgraph.core.model.CriticalDependency;
import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.EntityType;
import com.reqgraph.core.model.ImpactItem;
import com.reqgraph.core.model.ImpactLevel;
import com.reqgraph.core.model.ImpactMatrix;
import com.reqgraph.core.model.ImpactReport;
import com.reqgraph.core.model.Relationship;
import com.reqgraph.core.model.RelationshipType;
import com.reqgraph.core.model.RemovalSimulation;
import com.reqgraph.core.model.RiskLevel;
import com.reqgraph.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link ImpactAnalyzer}.
 */
class ImpactAnalyzerTest extends WorkspaceTestBase {

    @Test
    void removal_ofRequirementWithThreeCriticalImplementers_isHighRisk() {
        RequirementGraph graph = graph(
            List.of(
                entity("FR-001", EntityType.REQUIREMENT, "title", "Login"),
                entity("UOW-001", EntityType.UNIT_OF_WORK, "priority", "critical"),
                entity("UOW-002", EntityType.UNIT_OF_WORK, "priority", "critical"),
                entity("UOW-003", EntityType.UNIT_OF_WORK, "priority", "critical")
            ),
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-002", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-003", "FR-001", RelationshipType.IMPLEMENTS)
        );

        ImpactReport report = new ImpactAnalyzer(graph).analyzeChangeImpact("FR-001", ChangeType.REMOVAL);

        assertThat(report.directImpacts())
            .extracting(ImpactItem::entityId, ImpactItem::severity, ImpactItem::impactType)
            .containsExactly(
                tuple("UOW-001", Severity.CRITICAL, ImpactAnalyzer.IMPLEMENTATION_CHANGE),
                tuple("UOW-002", Severity.CRITICAL, ImpactAnalyzer.IMPLEMENTATION_CHANGE),
                tuple("UOW-003", Severity.CRITICAL, ImpactAnalyzer.IMPLEMENTATION_CHANGE));
        assertThat(report.riskAssessment().riskScore()).isEqualTo(6);
        assertThat(report.riskAssessment().overallRisk()).isIn(RiskLevel.HIGH, RiskLevel.CRITICAL);
        assertThat(report.riskAssessment().mitigationRequired()).isTrue();
        assertThat(report.riskAssessment().riskFactors())
            .containsExactly("Critical entity type", "Critical severity impacts");
        assertThat(report.mitigationStrategies())
            .contains("Perform staged deployment", "Update related contracts and BDD scenarios");
    }

    @Test
    void modification_decaysSeverityFromDirectToIndirectToCascade() {
        RequirementGraph graph = chain(6);

        ImpactReport report = new ImpactAnalyzer(graph).analyzeChangeImpact("FR-001", ChangeType.MODIFICATION);

        assertThat(report.directImpacts())
            .extracting(ImpactItem::entityId, ImpactItem::severity)
            .containsExactly(tuple("UOW-001", Severity.HIGH));
        assertThat(report.indirectImpacts())
            .extracting(ImpactItem::entityId, ImpactItem::severity, ImpactItem::path)
            .containsExactly(tuple("UOW-002", Severity.MEDIUM, List.of("FR-001", "UOW-001", "UOW-002")));
        assertThat(report.cascadeImpacts())
            .extracting(ImpactItem::entityId, ImpactItem::severity)
            .containsExactly(
                tuple("UOW-003", Severity.MEDIUM),
                tuple("UOW-004", Severity.LOW));
        assertThat(report.cascadeImpacts())
            .allSatisfy(item -> assertThat(item.path()).hasSizeLessThanOrEqualTo(ImpactAnalyzer.MAX_CASCADE_PATH));
        assertThat(report.riskAssessment().overallRisk()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void cascade_isCappedAtMaximumItems() {
        List<Entity> entities = new ArrayList<>(List.of(
            entity("FR-001", EntityType.REQUIREMENT),
            entity("UOW-001", EntityType.UNIT_OF_WORK),
            entity("UOW-002", EntityType.UNIT_OF_WORK)));
        List<Relationship> relationships = new ArrayList<>(List.of(
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-002", "UOW-001", RelationshipType.DEPENDS_ON)));
        for (int i = 100; i < 140; i++) {
            entities.add(entity("UOW-" + i, EntityType.UNIT_OF_WORK));
            relationships.add(relationship("UOW-" + i, "UOW-002", RelationshipType.DEPENDS_ON));
        }
        RequirementGraph graph = new RequirementGraph(entities, relationships);

        ImpactReport report = new ImpactAnalyzer(graph).analyzeChangeImpact("FR-001", ChangeType.MAJOR_MODIFICATION);

        assertThat(report.cascadeImpacts()).hasSize(ImpactAnalyzer.MAX_CASCADE_ITEMS);
        assertThat(report.cascadeImpacts()).extracting(ImpactItem::entityId).doesNotHaveDuplicates();
        assertThat(report.riskAssessment().riskFactors()).contains("High impact count");
    }

    @Test
    void directImpacts_multipleEdgesToSameEntity_keepHighestSeverity() {
        RequirementGraph graph = graph(
            List.of(
                entity("FR-001", EntityType.REQUIREMENT),
                entity("CON-001", EntityType.CONTRACT)),
            relationship("CON-001", "FR-001", RelationshipType.EXTENDS),
            relationship("CON-001", "FR-001", RelationshipType.VALIDATES));

        ImpactReport report = new ImpactAnalyzer(graph).analyzeChangeImpact("FR-001", ChangeType.MODIFICATION);

        assertThat(report.directImpacts())
            .singleElement()
            .satisfies(item -> {
                assertThat(item.severity()).isEqualTo(Severity.HIGH);
                assertThat(item.impactType()).isEqualTo(ImpactAnalyzer.CONTRACT_VALIDATION);
            });
        assertThat(report.testingRecommendations()).contains("Contract compliance verification");
    }

    @Test
    void analyze_collectsAffectedLayers() {
        RequirementGraph graph = graph(
            List.of(
                entity("FR-001", EntityType.REQUIREMENT),
                entity("UOW-001", EntityType.UNIT_OF_WORK, "layer", "application"),
                entity("UOW-002", EntityType.UNIT_OF_WORK, "layer", "foundation"),
                entity("UOW-003", EntityType.UNIT_OF_WORK, "layer", "deployment")),
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-002", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-003", "FR-001", RelationshipType.IMPLEMENTS));

        ImpactReport report = new ImpactAnalyzer(graph).analyzeChangeImpact("FR-001", ChangeType.MODIFICATION);

        assertThat(report.affectedLayers()).containsExactly("application", "deployment", "foundation");
        assertThat(report.riskAssessment().riskFactors()).contains("Multiple layer impact");
        assertThat(report.testingRecommendations()).contains(
            "Infrastructure and configuration testing",
            "Business logic validation testing",
            "Deployment and operational testing");
    }

    @Test
    void analyze_unknownEntity_throwsEntityNotFoundException() {
        ImpactAnalyzer analyzer = new ImpactAnalyzer(chain(2));

        assertThatThrownBy(() -> analyzer.analyzeChangeImpact("FR-404", ChangeType.MODIFICATION))
            .isInstanceOf(EntityNotFoundException.class)
            .hasMessage("Entity FR-404 not found")
            .satisfies(e -> {
                EntityNotFoundException notFound = (EntityNotFoundException) e;
                assertThat(notFound.getEntityId()).isEqualTo("FR-404");
                assertThat(notFound.getCode()).isEqualTo(ErrorCode.ENTITY_NOT_FOUND);
            });
    }

    @Test
    void generateImpactMatrix_levelsFollowPathLength() {
        List<Entity> entities = new ArrayList<>(chain(4).entities());
        entities.add(entity("FR-009", EntityType.REQUIREMENT));
        RequirementGraph graph = new RequirementGraph(entities, chain(4).relationships());

        ImpactMatrix matrix = new ImpactAnalyzer(graph)
            .generateImpactMatrix(List.of("FR-001", "UOW-001", "UOW-002", "UOW-003", "FR-009"));

        assertThat(matrix.level("FR-001", "UOW-001")).isEqualTo(ImpactLevel.HIGH);
        assertThat(matrix.level("FR-001", "UOW-002")).isEqualTo(ImpactLevel.MEDIUM);
        assertThat(matrix.level("FR-001", "UOW-003")).isEqualTo(ImpactLevel.LOW);
        assertThat(matrix.level("UOW-003", "FR-001")).isEqualTo(ImpactLevel.LOW);
        assertThat(matrix.level("FR-001", "FR-009")).isEqualTo(ImpactLevel.NONE);
        assertThat(matrix.levels().get("FR-001")).doesNotContainKey("FR-001");
    }

    @Test
    void findCriticalDependencies_ranksByScoreAboveThreshold() {
        RequirementGraph graph = graph(
            List.of(
                entity("FR-001", EntityType.REQUIREMENT),
                entity("FR-002", EntityType.REQUIREMENT),
                entity("CON-001", EntityType.CONTRACT),
                entity("UOW-001", EntityType.UNIT_OF_WORK),
                entity("UOW-002", EntityType.UNIT_OF_WORK),
                entity("UOW-003", EntityType.UNIT_OF_WORK),
                entity("UOW-004", EntityType.UNIT_OF_WORK)),
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-002", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-003", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-004", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-001", "FR-002", RelationshipType.IMPLEMENTS),
            relationship("UOW-002", "FR-002", RelationshipType.IMPLEMENTS),
            relationship("UOW-003", "FR-002", RelationshipType.IMPLEMENTS),
            relationship("CON-001", "UOW-001", RelationshipType.VALIDATES));

        List<CriticalDependency> critical = new ImpactAnalyzer(graph).findCriticalDependencies();

        assertThat(critical)
            .extracting(CriticalDependency::entityId, CriticalDependency::criticalityScore)
            .containsExactly(
                tuple("FR-001", 0.8),
                tuple("FR-002", 0.7));
        assertThat(critical.get(0).incomingDependencies())
            .containsExactly("UOW-001", "UOW-002", "UOW-003", "UOW-004");
        assertThat(critical.get(0).riskFactors()).containsExactly("Critical entity type");
    }

    @Test
    void findCriticalDependencies_repeatedEdges_countOnce() {
        List<Entity> entities = List.of(
            entity("FR-001", EntityType.REQUIREMENT),
            entity("UOW-001", EntityType.UNIT_OF_WORK));
        RequirementGraph single = graph(entities,
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS));
        RequirementGraph repeated = graph(entities,
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS));

        assertThat(new ImpactAnalyzer(single).findCriticalDependencies()).isEmpty();
        assertThat(new ImpactAnalyzer(repeated).findCriticalDependencies()).isEmpty();
    }

    @Test
    void findCriticalDependencies_repeatedEdges_listDependentOnce() {
        RequirementGraph graph = graph(
            List.of(
                entity("FR-001", EntityType.REQUIREMENT),
                entity("UOW-001", EntityType.UNIT_OF_WORK),
                entity("UOW-002", EntityType.UNIT_OF_WORK),
                entity("UOW-003", EntityType.UNIT_OF_WORK)),
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-002", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-003", "FR-001", RelationshipType.IMPLEMENTS));

        List<CriticalDependency> critical = new ImpactAnalyzer(graph).findCriticalDependencies();

        assertThat(critical)
            .extracting(CriticalDependency::entityId, CriticalDependency::criticalityScore)
            .containsExactly(tuple("FR-001", 0.7));
        assertThat(critical.get(0).incomingDependencies()).containsExactly("UOW-001", "UOW-002", "UOW-003");
    }

    @Test
    void criticalityScore_isCapped() {
        assertThat(ImpactAnalyzer.criticalityScore(EntityType.REQUIREMENT, 10, 10)).isEqualTo(100);
        assertThat(ImpactAnalyzer.criticalityScore(EntityType.UNIT_OF_WORK, 5, 2)).isEqualTo(70);
        assertThat(ImpactAnalyzer.criticalityScore(EntityType.EXTENSION, 0, 0)).isZero();
    }

    @Test
    void simulateRemoval_dependentWithoutAlternative_cascades() {
        RequirementGraph graph = graph(
            List.of(
                entity("FR-001", EntityType.REQUIREMENT),
                entity("UOW-001", EntityType.UNIT_OF_WORK),
                entity("UOW-002", EntityType.UNIT_OF_WORK),
                entity("UOW-003", EntityType.UNIT_OF_WORK),
                entity("UOW-005", EntityType.UNIT_OF_WORK),
                entity("CON-001", EntityType.CONTRACT)),
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-002", "UOW-001", RelationshipType.DEPENDS_ON),
            relationship("UOW-003", "UOW-001", RelationshipType.DEPENDS_ON),
            relationship("UOW-003", "UOW-005", RelationshipType.DEPENDS_ON),
            relationship("CON-001", "UOW-001", RelationshipType.VALIDATES));

        RemovalSimulation simulation = new ImpactAnalyzer(graph).simulateEntityRemoval("UOW-001");

        assertThat(simulation.cascadeRemovals()).containsExactly("UOW-002");
        assertThat(simulation.orphanedEntities()).containsExactly("FR-001");
        assertThat(simulation.affectedContracts()).containsExactly("CON-001");
        assertThat(simulation.brokenRelationships()).hasSize(4);
        assertThat(simulation.recoveryPlan())
            .startsWith("Create alternative implementations for orphaned requirements")
            .endsWith("Update documentation and traceability matrix",
                "Re-run indexing and coverage analysis after changes");
    }

    @Test
    void simulateRemoval_doesNotModifyGraph() {
        RequirementGraph graph = chain(5);
        List<Relationship> before = List.copyOf(graph.relationships());
        int size = graph.size();

        new ImpactAnalyzer(graph).simulateEntityRemoval("UOW-002");

        assertThat(graph.size()).isEqualTo(size);
        assertThat(graph.relationships()).isEqualTo(before);
        assertThat(graph.contains("UOW-002")).isTrue();
    }

    @Test
    void simulateRemoval_unknownEntity_throwsEntityNotFoundException() {
        assertThatThrownBy(() -> new ImpactAnalyzer(chain(2)).simulateEntityRemoval("UOW-404"))
            .isInstanceOf(EntityNotFoundException.class);
    }

    /**
     * FR-001 implemented by UOW-001, then UOW-00(n+1) depends on UOW-00n.
     */
    private static RequirementGraph chain(int units) {
        List<Entity> entities = new ArrayList<>();
        List<Relationship> relationships = new ArrayList<>();
        entities.add(entity("FR-001", EntityType.REQUIREMENT));
        for (int i = 1; i <= units; i++) {
            entities.add(entity(String.format("UOW-%03d", i), EntityType.UNIT_OF_WORK));
            relationships.add(i == 1
                ? relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS)
                : relationship(String.format("UOW-%03d", i), String.format("UOW-%03d", i - 1), RelationshipType.DEPENDS_ON));
        }
        return new RequirementGraph(entities, relationships);
    }
}
