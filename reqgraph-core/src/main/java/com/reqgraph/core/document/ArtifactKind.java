package com.reqgraph.core.document;

import com.reqgraph.core.model.EntityType;

/**
 * Kinds of records held by the authoritative document store.
 */
public enum ArtifactKind {
    REQUIREMENT(EntityType.REQUIREMENT),
    QUALITY_ATTRIBUTE(EntityType.QUALITY_ATTRIBUTE),
    UNIT_OF_WORK(EntityType.UNIT_OF_WORK),
    CONTRACT(EntityType.CONTRACT),
    EXTENSION(EntityType.EXTENSION),
    PATTERN(EntityType.PATTERN),
    DECISION(EntityType.DECISION),
    LESSON(EntityType.LESSON);

    private final EntityType entityType;

    ArtifactKind(EntityType entityType) {
        this.entityType = entityType;
    }

    /**
     * Returns the entity type the indexer emits for records of this kind.
     *
     * @return entity type
     */
    public EntityType entityType() {
        return entityType;
    }
}
