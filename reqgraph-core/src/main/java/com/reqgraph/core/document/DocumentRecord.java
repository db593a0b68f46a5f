package com.reqgraph.core.document;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A single parsed record from the authoritative document store.
 *
 * <p>Content is kept as a raw tree; shape is validated by the indexer, not here.
 *
 * @param id record ID as keyed in the document
 * @param kind artifact kind
 * @param content parsed record content
 * @param source document path relative to the store root
 */
public record DocumentRecord(
    String id,
    ArtifactKind kind,
    JsonNode content,
    String source
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentRecord {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (id == null) {
            id = "";
        }
        if (source == null) {
            source = "";
        }
    }
}
