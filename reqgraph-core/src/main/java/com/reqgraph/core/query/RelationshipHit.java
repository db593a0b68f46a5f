package com.reqgraph.core.query;

import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.RelationshipType;

import java.util.Objects;

/**
 * Entity related to a queried entity.
 *
 * @param entity related entity
 * @param queriedId entity named in the query
 * @param relationship type of the connecting edge, or null for an indirect dependent
 * @param direct false when reached through a dependency of an implementing unit of work
 */
public record RelationshipHit(
    Entity entity,
    String queriedId,
    RelationshipType relationship,
    boolean direct
) implements QueryHit {
    /**
     * Compact constructor with validation.
     */
    public RelationshipHit {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(queriedId, "queriedId must not be null");
    }

    @Override
    public String summary() {
        String via = direct ? String.valueOf(relationship) : "indirect";
        return queriedId + " <-" + via + "-> " + entity.id() + " " + entity.displayName();
    }
}
