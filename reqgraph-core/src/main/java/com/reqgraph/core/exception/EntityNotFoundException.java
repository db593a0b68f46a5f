package com.reqgraph.core.exception;

import java.util.Map;

/**
 * Thrown when an operation requires an entity that is absent from the graph.
 */
public class EntityNotFoundException extends ReqGraphException {

    private final String entityId;

    public EntityNotFoundException(String entityId, String operation) {
        super(ErrorCode.ENTITY_NOT_FOUND,
            "Entity " + entityId + " not found",
            Map.of("entityId", entityId, "operation", operation));
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
