package com.reqgraph.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A pattern, decision or lesson held by the learning store.
 *
 * @param id record ID
 * @param kind knowledge kind
 * @param category category used by pattern queries (may be empty)
 * @param frequency observed frequency, 0 when not tracked
 * @param attributes full record content in document order
 */
public record KnowledgeRecord(
    String id,
    KnowledgeKind kind,
    String category,
    int frequency,
    Map<String, Object> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public KnowledgeRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (category == null) {
            category = "";
        }
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String name() {
        Object name = attributes.get("name");
        return name == null ? id : name.toString();
    }
}
