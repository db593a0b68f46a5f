package com.reqgraph.core.model;

import java.util.Locale;

/**
 * Kinds of derived knowledge accumulated through usage.
 */
public enum KnowledgeKind {
    PATTERN("patterns.yaml", EntityType.PATTERN),
    DECISION("decisions.yaml", EntityType.DECISION),
    LESSON("lessons.yaml", EntityType.LESSON);

    private final String fileName;
    private final EntityType entityType;

    KnowledgeKind(String fileName, EntityType entityType) {
        this.fileName = fileName;
        this.entityType = entityType;
    }

    public String fileName() {
        return fileName;
    }

    public EntityType entityType() {
        return entityType;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the knowledge kind stored as entities of {@code type}, or null.
     *
     * @param type entity type
     * @return matching kind, or null for authoritative types
     */
    public static KnowledgeKind of(EntityType type) {
        for (KnowledgeKind kind : values()) {
            if (kind.entityType == type) {
                return kind;
            }
        }
        return null;
    }
}
