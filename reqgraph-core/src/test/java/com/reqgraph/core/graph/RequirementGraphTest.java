package com.reqgraph.core.graph;

import com.reqgraph.core.WorkspaceTestBase;
import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.EntityType;
import com.reqgraph.core.model.Relationship;
import com.reqgraph.core.model.RelationshipType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RequirementGraph}.
 */
class RequirementGraphTest extends WorkspaceTestBase {

    private RequirementGraph graph;

    @BeforeEach
    void setUp() {
        graph = graph(
            List.of(
                entity("FR-001", EntityType.REQUIREMENT),
                entity("UOW-001", EntityType.UNIT_OF_WORK),
                entity("UOW-002", EntityType.UNIT_OF_WORK),
                entity("CON-001", EntityType.CONTRACT),
                entity("FR-009", EntityType.REQUIREMENT)
            ),
            relationship("UOW-001", "FR-001", RelationshipType.IMPLEMENTS),
            relationship("UOW-002", "UOW-001", RelationshipType.DEPENDS_ON),
            relationship("CON-001", "UOW-002", RelationshipType.VALIDATES),
            relationship("UOW-002", "UOW-404", RelationshipType.DEPENDS_ON)
        );
    }

    @Test
    void resolveId_isCaseInsensitive() {
        assertThat(graph.resolveId("uow-001")).contains("UOW-001");
        assertThat(graph.resolveId("FR-001")).contains("FR-001");
        assertThat(graph.resolveId("fr-404")).isEmpty();
    }

    @Test
    void adjacency_isTypedAndDirected() {
        assertThat(graph.incoming("FR-001", RelationshipType.IMPLEMENTS))
            .extracting(Relationship::source).containsExactly("UOW-001");
        assertThat(graph.outgoing("UOW-002", RelationshipType.DEPENDS_ON))
            .extracting(Relationship::target).containsExactly("UOW-001", "UOW-404");
        assertThat(graph.incident("UOW-002")).hasSize(3);
        assertThat(graph.outgoing("FR-001")).isEmpty();
    }

    @Test
    void neighbours_skipUnknownEntities() {
        assertThat(graph.neighbours("UOW-002")).containsExactly("UOW-001", "CON-001");
    }

    @Test
    void distance_isUndirectedShortestPath() {
        assertThat(graph.distance("FR-001", "FR-001")).isZero();
        assertThat(graph.distance("FR-001", "UOW-001")).isEqualTo(1);
        assertThat(graph.distance("CON-001", "UOW-001")).isEqualTo(2);
        assertThat(graph.distance("CON-001", "FR-001")).isEqualTo(3);
        assertThat(graph.distance("FR-001", "FR-009")).isEqualTo(-1);
        assertThat(graph.distance("FR-001", "UOW-404")).isEqualTo(-1);
    }

    @Test
    void danglingReferences_areTracked() {
        assertThat(graph.danglingReferences())
            .singleElement()
            .satisfies(reference -> assertThat(reference.target()).isEqualTo("UOW-404"));
    }

    @Test
    void entitiesOfType_keepsIndexOrder() {
        assertThat(graph.entitiesOfType(EntityType.REQUIREMENT))
            .extracting(Entity::id).containsExactly("FR-001", "FR-009");
    }

    @Test
    void selfLoop_isIncidentOnce() {
        RequirementGraph looped = graph(
            List.of(entity("UOW-001", EntityType.UNIT_OF_WORK)),
            relationship("UOW-001", "UOW-001", RelationshipType.DEPENDS_ON));

        assertThat(looped.incident("UOW-001")).hasSize(1);
        assertThat(looped.neighbours("UOW-001")).isEmpty();
    }
}
