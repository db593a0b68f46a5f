package com.reqgraph.core.impact;

import com.reqgraph.core.exception.EntityNotFoundException;
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
import com.reqgraph.core.model.RiskAssessment;
import com.reqgraph.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Change-impact analysis over a {@link RequirementGraph}.
 *
 * <p>Impacts are found in three widening phases:
 * <ol>
 *   <li><b>Direct</b> - entities one edge away in either direction, scored by relationship type,
 *       affected entity type and change type</li>
 *   <li><b>Indirect</b> - entities two edges away, one severity level below the direct impact
 *       they were reached through</li>
 *   <li><b>Cascade</b> - breadth-first beyond the second hop, bounded by
 *       {@value #MAX_CASCADE_PATH} entities per path and {@value #MAX_CASCADE_ITEMS} items</li>
 * </ol>
 *
 * <p>The analyzer never mutates the graph; every operation is a pure function of the graph
 * and its arguments.
 */
public class ImpactAnalyzer {

    /** Longest cascade path, counted in entities including the changed one. */
    public static final int MAX_CASCADE_PATH = 5;

    /** Most cascade items reported for one analysis. */
    public static final int MAX_CASCADE_ITEMS = 20;

    /** Criticality score, in hundredths, at which an entity is reported as critical. */
    public static final int CRITICALITY_THRESHOLD = 70;

    static final String IMPLEMENTATION_CHANGE = "implementation_change";
    static final String DEPENDENCY_IMPACT = "dependency_impact";
    static final String CONTRACT_VALIDATION = "contract_validation";
    static final String EXTENSION_IMPACT = "extension_impact";
    static final String GENERAL_IMPACT = "general_impact";
    static final String CASCADE = "cascade";

    private static final int BASE_SEVERITY = 1;

    private static final Logger log = LoggerFactory.getLogger(ImpactAnalyzer.class);

    private final RequirementGraph graph;
    private final RiskAssessor riskAssessor;

    public ImpactAnalyzer(RequirementGraph graph) {
        this(graph, new RiskAssessor());
    }

    public ImpactAnalyzer(RequirementGraph graph, RiskAssessor riskAssessor) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.riskAssessor = Objects.requireNonNull(riskAssessor, "riskAssessor must not be null");
    }

    /**
     * Analyzes the impact of changing one entity.
     *
     * @param entityId changed entity ID
     * @param changeType kind of change
     * @return impact report
     * @throws EntityNotFoundException if the entity is not in the graph
     */
    public ImpactReport analyzeChangeImpact(String entityId, ChangeType changeType) {
        Entity source = require(entityId, "analyze-impact");
        Objects.requireNonNull(changeType, "changeType must not be null");
        log.debug("Analyzing {} of {}", changeType.label(), entityId);

        List<ImpactItem> direct = directImpacts(source, changeType);
        List<ImpactItem> indirect = indirectImpacts(source, direct);
        List<ImpactItem> existing = new ArrayList<>(direct);
        existing.addAll(indirect);
        List<ImpactItem> cascade = cascadeImpacts(source, existing);

        List<String> layers = affectedLayers(direct, indirect, cascade);
        RiskAssessment risk = riskAssessor.assess(source, direct, indirect, cascade, layers);

        log.info("Impact of {} on {}: {} direct, {} indirect, {} cascade, risk {}",
            changeType.label(), entityId, direct.size(), indirect.size(), cascade.size(),
            risk.overallRisk().label());

        return new ImpactReport(
            entityId,
            changeType,
            direct,
            indirect,
            cascade,
            risk,
            riskAssessor.mitigationStrategies(risk, direct, indirect, layers),
            layers,
            riskAssessor.testingRecommendations(direct, indirect, layers)
        );
    }

    /**
     * Computes pairwise impact levels from shortest undirected path lengths.
     *
     * @param entityIds entities to include, in output order
     * @return matrix covering every ordered pair of distinct IDs
     */
    public ImpactMatrix generateImpactMatrix(List<String> entityIds) {
        List<String> ids = List.copyOf(new LinkedHashSet<>(entityIds));
        Map<String, Map<String, ImpactLevel>> levels = new LinkedHashMap<>();
        for (String source : ids) {
            Map<String, ImpactLevel> row = new LinkedHashMap<>();
            for (String target : ids) {
                if (!source.equals(target)) {
                    row.put(target, ImpactLevel.fromDistance(graph.distance(source, target)));
                }
            }
            levels.put(source, row);
        }
        return new ImpactMatrix(ids, levels);
    }

    /**
     * Ranks entities by criticality and returns those at or above the critical threshold.
     *
     * <p>Score = type base (requirement 0.4, contract 0.3, unit of work 0.2)
     * + min(0.1 per incoming depends-on/implements edge, 0.4)
     * + min(0.05 per outgoing depends-on edge, 0.2), capped at 1.0.
     * Repeated edges between the same pair with the same type count once.
     *
     * @return critical entities, highest score first, ties by ID
     */
    public List<CriticalDependency> findCriticalDependencies() {
        List<CriticalDependency> critical = new ArrayList<>();
        for (Entity entity : graph.entities()) {
            // repeated edges count once
            Set<Map.Entry<String, RelationshipType>> incomingEdges = new LinkedHashSet<>();
            graph.incoming(entity.id()).stream()
                .filter(rel -> rel.type() == RelationshipType.DEPENDS_ON || rel.type() == RelationshipType.IMPLEMENTS)
                .forEach(rel -> incomingEdges.add(Map.entry(rel.source(), rel.type())));
            List<String> incoming = incomingEdges.stream()
                .map(Map.Entry::getKey)
                .distinct()
                .toList();
            List<String> outgoing = graph.outgoing(entity.id(), RelationshipType.DEPENDS_ON).stream()
                .map(Relationship::target)
                .distinct()
                .toList();

            int score = criticalityScore(entity.type(), incomingEdges.size(), outgoing.size());
            if (score >= CRITICALITY_THRESHOLD) {
                critical.add(new CriticalDependency(
                    entity.id(),
                    entity.type(),
                    score / 100.0,
                    incoming,
                    outgoing,
                    criticalityFactors(entity.type(), incomingEdges.size(), outgoing.size())
                ));
            }
        }
        critical.sort(Comparator.comparingDouble(CriticalDependency::criticalityScore).reversed()
            .thenComparing(CriticalDependency::entityId));
        return critical;
    }

    /**
     * Projects what removing an entity would break, without modifying the graph.
     *
     * @param entityId entity whose removal is simulated
     * @return removal simulation
     * @throws EntityNotFoundException if the entity is not in the graph
     */
    public RemovalSimulation simulateEntityRemoval(String entityId) {
        require(entityId, "simulate-removal");

        List<Relationship> broken = graph.incident(entityId);

        Set<String> orphaned = new LinkedHashSet<>();
        for (Relationship rel : graph.outgoing(entityId, RelationshipType.IMPLEMENTS)) {
            if (graph.contains(rel.target()) && !rel.target().equals(entityId)) {
                orphaned.add(rel.target());
            }
        }

        Set<String> cascade = new LinkedHashSet<>();
        for (Relationship rel : graph.incoming(entityId, RelationshipType.DEPENDS_ON)) {
            String dependent = rel.source();
            if (dependent.equals(entityId)) {
                continue;
            }
            boolean hasAlternative = graph.outgoing(dependent, RelationshipType.DEPENDS_ON).stream()
                .anyMatch(other -> !other.target().equals(entityId));
            if (!hasAlternative) {
                cascade.add(dependent);
            }
        }

        Set<String> contracts = new LinkedHashSet<>();
        for (Relationship rel : graph.incoming(entityId, RelationshipType.VALIDATES)) {
            graph.entity(rel.source())
                .filter(entity -> entity.type() == EntityType.CONTRACT)
                .ifPresent(entity -> contracts.add(entity.id()));
        }

        List<String> recovery = new ArrayList<>();
        if (!orphaned.isEmpty()) {
            recovery.add("Create alternative implementations for orphaned requirements");
        }
        if (!cascade.isEmpty()) {
            recovery.add("Establish alternative dependencies for cascade-affected entities");
        }
        if (!contracts.isEmpty()) {
            recovery.add("Update or remove affected contracts");
        }
        if (!broken.isEmpty()) {
            recovery.add("Re-establish critical relationships with alternative entities");
        }
        recovery.add("Update documentation and traceability matrix");
        recovery.add("Re-run indexing and coverage analysis after changes");

        log.info("Removal of {} breaks {} relationships, orphans {}, cascades to {}",
            entityId, broken.size(), orphaned.size(), cascade.size());

        return new RemovalSimulation(entityId, broken, List.copyOf(orphaned), List.copyOf(cascade),
            List.copyOf(contracts), recovery);
    }

    private List<ImpactItem> directImpacts(Entity source, ChangeType changeType) {
        Map<String, ImpactItem> byEntity = new LinkedHashMap<>();
        for (Relationship rel : graph.incident(source.id())) {
            String affectedId = rel.otherEnd(source.id());
            if (affectedId.equals(source.id())) {
                continue;
            }
            Entity affected = graph.entity(affectedId).orElse(null);
            if (affected == null) {
                continue;
            }
            Severity severity = Severity.fromScore(
                BASE_SEVERITY + relationshipWeight(rel.type()) + entityWeight(affected.type()) + changeType.weight());
            ImpactItem item = new ImpactItem(
                affectedId,
                affected.type(),
                impactType(rel.type()),
                severity,
                describe(rel.type(), affected),
                List.of(source.id(), affectedId),
                recommendations(rel.type())
            );
            byEntity.merge(affectedId, item,
                (kept, candidate) -> candidate.severity().compareTo(kept.severity()) > 0 ? candidate : kept);
        }
        return List.copyOf(byEntity.values());
    }

    private List<ImpactItem> indirectImpacts(Entity source, List<ImpactItem> direct) {
        Set<String> excluded = new HashSet<>();
        excluded.add(source.id());
        direct.forEach(item -> excluded.add(item.entityId()));

        Map<String, ImpactItem> byEntity = new LinkedHashMap<>();
        for (ImpactItem parent : direct) {
            for (Relationship rel : graph.incident(parent.entityId())) {
                if (rel.touches(source.id())) {
                    continue;
                }
                String affectedId = rel.otherEnd(parent.entityId());
                if (excluded.contains(affectedId) || byEntity.containsKey(affectedId)) {
                    continue;
                }
                graph.entity(affectedId).ifPresent(affected -> byEntity.put(affectedId, new ImpactItem(
                    affectedId,
                    affected.type(),
                    "indirect_" + impactType(rel.type()),
                    parent.severity().reduced(),
                    "Indirectly affected via " + parent.entityId(),
                    List.of(source.id(), parent.entityId(), affectedId),
                    List.of("Review for potential side effects")
                )));
            }
        }
        return List.copyOf(byEntity.values());
    }

    private List<ImpactItem> cascadeImpacts(Entity source, List<ImpactItem> existing) {
        Set<String> visited = new HashSet<>();
        visited.add(source.id());
        existing.forEach(item -> visited.add(item.entityId()));

        Deque<List<String>> queue = new ArrayDeque<>();
        existing.forEach(item -> queue.add(item.path()));

        List<ImpactItem> cascade = new ArrayList<>();
        while (!queue.isEmpty() && cascade.size() < MAX_CASCADE_ITEMS) {
            List<String> path = queue.poll();
            if (path.size() >= MAX_CASCADE_PATH) {
                continue;
            }
            String current = path.get(path.size() - 1);
            for (Relationship rel : graph.incident(current)) {
                String nextId = rel.otherEnd(current);
                if (!visited.add(nextId)) {
                    continue;
                }
                Entity next = graph.entity(nextId).orElse(null);
                if (next == null) {
                    continue;
                }
                List<String> nextPath = new ArrayList<>(path);
                nextPath.add(nextId);
                cascade.add(new ImpactItem(
                    nextId,
                    next.type(),
                    CASCADE,
                    path.size() <= 3 ? Severity.MEDIUM : Severity.LOW,
                    "Cascade impact via " + String.join(" -> ", path.subList(1, path.size())),
                    nextPath,
                    List.of("Monitor for unexpected effects")
                ));
                queue.add(List.copyOf(nextPath));
                if (cascade.size() >= MAX_CASCADE_ITEMS) {
                    break;
                }
            }
        }
        return cascade;
    }

    private List<String> affectedLayers(List<ImpactItem> direct, List<ImpactItem> indirect, List<ImpactItem> cascade) {
        Set<String> layers = new TreeSet<>();
        List<ImpactItem> all = new ArrayList<>(direct);
        all.addAll(indirect);
        all.addAll(cascade);
        for (ImpactItem item : all) {
            graph.entity(item.entityId())
                .map(Entity::layer)
                .filter(layer -> !layer.isBlank() && !"unknown".equals(layer))
                .ifPresent(layers::add);
        }
        return List.copyOf(layers);
    }

    private Entity require(String entityId, String operation) {
        if (entityId == null || entityId.isBlank()) {
            throw new EntityNotFoundException(String.valueOf(entityId), operation);
        }
        return graph.entity(entityId).orElseThrow(() -> new EntityNotFoundException(entityId, operation));
    }

    static int relationshipWeight(RelationshipType type) {
        return switch (type) {
            case IMPLEMENTS, VALIDATES -> 2;
            case DEPENDS_ON -> 1;
            default -> 0;
        };
    }

    static int entityWeight(EntityType type) {
        return switch (type) {
            case REQUIREMENT, CONTRACT -> 2;
            case UNIT_OF_WORK -> 1;
            default -> 0;
        };
    }

    static int criticalityScore(EntityType type, int incoming, int outgoing) {
        int base = switch (type) {
            case REQUIREMENT -> 40;
            case CONTRACT -> 30;
            case UNIT_OF_WORK -> 20;
            default -> 0;
        };
        return Math.min(base + Math.min(incoming * 10, 40) + Math.min(outgoing * 5, 20), 100);
    }

    private static List<String> criticalityFactors(EntityType type, int incoming, int outgoing) {
        List<String> factors = new ArrayList<>();
        if (incoming > 5) {
            factors.add("High number of dependent entities");
        }
        if (outgoing > 3) {
            factors.add("High complexity with multiple dependencies");
        }
        if (type == EntityType.REQUIREMENT || type == EntityType.CONTRACT) {
            factors.add("Critical entity type");
        }
        return factors;
    }

    private static String impactType(RelationshipType type) {
        return switch (type) {
            case IMPLEMENTS -> IMPLEMENTATION_CHANGE;
            case DEPENDS_ON -> DEPENDENCY_IMPACT;
            case VALIDATES -> CONTRACT_VALIDATION;
            case EXTENDS -> EXTENSION_IMPACT;
            default -> GENERAL_IMPACT;
        };
    }

    private static String describe(RelationshipType type, Entity affected) {
        String name = affected.displayName();
        return switch (type) {
            case IMPLEMENTS -> "Implementation relationship will be affected: " + name;
            case DEPENDS_ON -> "Dependency relationship will be affected: " + name;
            case VALIDATES -> "Contract validation will be affected: " + name;
            default -> "Related " + affected.type().code() + " will be affected: " + name;
        };
    }

    private static List<String> recommendations(RelationshipType type) {
        return switch (type) {
            case IMPLEMENTS -> List.of("Update implementation to match changes",
                "Verify acceptance criteria still satisfied");
            case DEPENDS_ON -> List.of("Check dependency compatibility", "Update dependent entity if needed");
            case VALIDATES -> List.of("Re-validate contract conditions", "Update contract if necessary");
            default -> List.of();
        };
    }
}
