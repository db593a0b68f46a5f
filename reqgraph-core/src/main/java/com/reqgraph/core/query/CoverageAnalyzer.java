package com.reqgraph.core.query;

import com.reqgraph.core.graph.RequirementGraph;
import com.reqgraph.core.model.CoverageReport;
import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.EntityType;
import com.reqgraph.core.model.Relationship;
import com.reqgraph.core.model.RelationshipType;

import java.util.List;
import java.util.Objects;

/**
 * Finds coverage gaps over the whole graph.
 *
 * <ul>
 *   <li>requirements (functional and non-functional) with no incoming {@code IMPLEMENTS} edge</li>
 *   <li>units of work that no contract validates</li>
 *   <li>units of work without a BDD artifact</li>
 *   <li>contracts validating an entity that does not exist</li>
 * </ul>
 */
public class CoverageAnalyzer {

    private final RequirementGraph graph;
    private final BddArtifactCatalog bddCatalog;

    public CoverageAnalyzer(RequirementGraph graph, BddArtifactCatalog bddCatalog) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.bddCatalog = Objects.requireNonNull(bddCatalog, "bddCatalog must not be null");
    }

    /**
     * Computes the coverage report. Lists follow index order.
     *
     * @return coverage report
     */
    public CoverageReport analyze() {
        List<String> requirementsWithoutUows = graph.entities().stream()
            .filter(entity -> entity.type().requirementKind())
            .filter(entity -> graph.incoming(entity.id(), RelationshipType.IMPLEMENTS).isEmpty())
            .map(Entity::id)
            .toList();

        List<Entity> units = graph.entitiesOfType(EntityType.UNIT_OF_WORK);
        List<String> uowsWithoutContracts = units.stream()
            .filter(unit -> graph.incoming(unit.id(), RelationshipType.VALIDATES).stream()
                .noneMatch(this::fromContract))
            .map(Entity::id)
            .toList();
        List<String> uowsWithoutBdd = units.stream()
            .map(Entity::id)
            .filter(id -> !bddCatalog.hasArtifact(id))
            .toList();

        List<String> orphanedContracts = graph.entitiesOfType(EntityType.CONTRACT).stream()
            .filter(contract -> graph.outgoing(contract.id(), RelationshipType.VALIDATES).stream()
                .anyMatch(rel -> !graph.contains(rel.target())))
            .map(Entity::id)
            .toList();

        return new CoverageReport(requirementsWithoutUows, uowsWithoutContracts, uowsWithoutBdd, orphanedContracts);
    }

    private boolean fromContract(Relationship relationship) {
        return graph.entity(relationship.source())
            .map(entity -> entity.type() == EntityType.CONTRACT)
            .orElse(false);
    }
}
