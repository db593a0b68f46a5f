package com.reqgraph.core.graph;

import com.reqgraph.core.model.DanglingReference;
import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.EntityType;
import com.reqgraph.core.model.Relationship;
import com.reqgraph.core.model.RelationshipType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, indexed view over the persisted entities and relationships.
 *
 * <p>Adjacency lists keep relationship order, so every traversal is deterministic.
 * Safe to share between concurrent readers.
 */
public final class RequirementGraph {

    private final Map<String, Entity> entitiesById;
    private final Map<String, String> idsByLowerCase;
    private final List<Relationship> relationships;
    private final Map<String, List<Relationship>> outgoing;
    private final Map<String, List<Relationship>> incoming;
    private final Map<String, List<Relationship>> incident;
    private final List<DanglingReference> danglingReferences;

    public RequirementGraph(Collection<Entity> entities, Collection<Relationship> relationships) {
        Map<String, Entity> byId = new LinkedHashMap<>();
        Map<String, String> byLowerCase = new HashMap<>();
        for (Entity entity : entities) {
            byId.putIfAbsent(entity.id(), entity);
            byLowerCase.putIfAbsent(entity.id().toLowerCase(Locale.ROOT), entity.id());
        }
        this.entitiesById = Collections.unmodifiableMap(byId);
        this.idsByLowerCase = Collections.unmodifiableMap(byLowerCase);
        this.relationships = List.copyOf(relationships);

        Map<String, List<Relationship>> out = new HashMap<>();
        Map<String, List<Relationship>> in = new HashMap<>();
        Map<String, List<Relationship>> all = new HashMap<>();
        List<DanglingReference> dangling = new ArrayList<>();
        for (Relationship relationship : this.relationships) {
            out.computeIfAbsent(relationship.source(), key -> new ArrayList<>()).add(relationship);
            in.computeIfAbsent(relationship.target(), key -> new ArrayList<>()).add(relationship);
            all.computeIfAbsent(relationship.source(), key -> new ArrayList<>()).add(relationship);
            if (!relationship.source().equals(relationship.target())) {
                all.computeIfAbsent(relationship.target(), key -> new ArrayList<>()).add(relationship);
            }
            if (!byId.containsKey(relationship.target())) {
                dangling.add(new DanglingReference(relationship.source(), relationship.target(), relationship.type()));
            }
        }
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
        this.incident = freeze(all);
        this.danglingReferences = List.copyOf(dangling);
    }

    /**
     * Creates an empty graph.
     *
     * @return graph with no entities
     */
    public static RequirementGraph empty() {
        return new RequirementGraph(List.of(), List.of());
    }

    public Collection<Entity> entities() {
        return entitiesById.values();
    }

    public List<Relationship> relationships() {
        return relationships;
    }

    public List<DanglingReference> danglingReferences() {
        return danglingReferences;
    }

    public int size() {
        return entitiesById.size();
    }

    public boolean contains(String entityId) {
        return entitiesById.containsKey(entityId);
    }

    public Optional<Entity> entity(String entityId) {
        return Optional.ofNullable(entitiesById.get(entityId));
    }

    /**
     * Resolves an ID case-insensitively to the ID as stored.
     *
     * @param candidate ID as written by a user, e.g. {@code uow-001}
     * @return stored ID, if any entity matches
     */
    public Optional<String> resolveId(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        if (entitiesById.containsKey(candidate)) {
            return Optional.of(candidate);
        }
        return Optional.ofNullable(idsByLowerCase.get(candidate.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns entities of one type in index order.
     *
     * @param type entity type
     * @return matching entities
     */
    public List<Entity> entitiesOfType(EntityType type) {
        return entitiesById.values().stream()
            .filter(entity -> entity.type() == type)
            .toList();
    }

    public List<Relationship> outgoing(String entityId) {
        return outgoing.getOrDefault(entityId, List.of());
    }

    public List<Relationship> incoming(String entityId) {
        return incoming.getOrDefault(entityId, List.of());
    }

    /**
     * Returns relationships with {@code entityId} at either end, each once, in index order.
     *
     * @param entityId entity ID
     * @return incident relationships
     */
    public List<Relationship> incident(String entityId) {
        return incident.getOrDefault(entityId, List.of());
    }

    /**
     * Returns incoming relationships of one type.
     *
     * @param entityId target entity ID
     * @param type relationship type
     * @return matching relationships
     */
    public List<Relationship> incoming(String entityId, RelationshipType type) {
        return incoming(entityId).stream()
            .filter(relationship -> relationship.type() == type)
            .toList();
    }

    /**
     * Returns outgoing relationships of one type.
     *
     * @param entityId source entity ID
     * @param type relationship type
     * @return matching relationships
     */
    public List<Relationship> outgoing(String entityId, RelationshipType type) {
        return outgoing(entityId).stream()
            .filter(relationship -> relationship.type() == type)
            .toList();
    }

    /**
     * Returns the distinct known entities one edge away in either direction.
     *
     * @param entityId entity ID
     * @return neighbour IDs in relationship order
     */
    public List<String> neighbours(String entityId) {
        Set<String> neighbours = new LinkedHashSet<>();
        for (Relationship relationship : incident(entityId)) {
            String other = relationship.otherEnd(entityId);
            if (!other.equals(entityId) && entitiesById.containsKey(other)) {
                neighbours.add(other);
            }
        }
        return List.copyOf(neighbours);
    }

    /**
     * Computes the shortest undirected path length between two entities.
     *
     * @param from start entity ID
     * @param to end entity ID
     * @return number of edges, 0 when equal, -1 when unreachable
     */
    public int distance(String from, String to) {
        if (from.equals(to)) {
            return entitiesById.containsKey(from) ? 0 : -1;
        }
        if (!entitiesById.containsKey(from) || !entitiesById.containsKey(to)) {
            return -1;
        }
        Map<String, Integer> depth = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        depth.put(from, 0);
        queue.add(from);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = depth.get(current) + 1;
            for (String neighbour : neighbours(current)) {
                if (depth.containsKey(neighbour)) {
                    continue;
                }
                if (neighbour.equals(to)) {
                    return next;
                }
                depth.put(neighbour, next);
                queue.add(neighbour);
            }
        }
        return -1;
    }

    private static Map<String, List<Relationship>> freeze(Map<String, List<Relationship>> adjacency) {
        Map<String, List<Relationship>> frozen = new HashMap<>();
        adjacency.forEach((id, list) -> frozen.put(id, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }
}
