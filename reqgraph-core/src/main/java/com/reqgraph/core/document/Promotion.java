package com.reqgraph.core.document;

import com.reqgraph.core.model.KnowledgeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Derived knowledge to be written into the authoritative store.
 *
 * @param derivedId ID on the derived side
 * @param kind knowledge kind
 * @param attributes record content
 * @param derivedHash content hash on the derived side at promotion time
 */
public record Promotion(
    String derivedId,
    KnowledgeKind kind,
    Map<String, Object> attributes,
    String derivedHash
) {
    /**
     * Compact constructor with validation.
     */
    public Promotion {
        Objects.requireNonNull(derivedId, "derivedId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(derivedHash, "derivedHash must not be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
