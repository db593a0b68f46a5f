package com.reqgraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed, uniquely identified node in the requirements graph.
 *
 * <p>Attributes are the full content of the source document record, kept in document
 * order. They are replaced wholesale on re-index, never merged field by field.
 *
 * @param id globally unique, immutable identifier (e.g. {@code FR-001})
 * @param type entity type
 * @param attributes document attributes in document order
 * @param contentHash deterministic digest of the attributes, used for change detection
 * @param source location of the record in the authoritative store
 */
public record Entity(
    @JsonProperty("id") String id,
    @JsonProperty("type") EntityType type,
    @JsonProperty("attributes") Map<String, Object> attributes,
    @JsonProperty("content_hash") String contentHash,
    @JsonProperty("source") String source
) {
    /**
     * Compact constructor with validation.
     */
    public Entity {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(contentHash, "contentHash must not be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        if (source == null) {
            source = "";
        }
    }

    /**
     * Returns a scalar attribute as text, or an empty string when absent or not scalar.
     *
     * @param key attribute name
     * @return attribute text
     */
    public String text(String key) {
        Object value = attributes.get(key);
        if (value == null || value instanceof Map || value instanceof List) {
            return "";
        }
        return value.toString();
    }

    /**
     * Returns a list attribute as text values. Scalars become a single-element list,
     * nested structures are skipped.
     *
     * @param key attribute name
     * @return text values, empty when absent
     */
    public List<String> texts(String key) {
        Object value = attributes.get(key);
        if (value == null || value instanceof Map) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            List<String> values = new ArrayList<>();
            for (Object item : list) {
                if (item != null && !(item instanceof Map) && !(item instanceof List)) {
                    values.add(item.toString());
                }
            }
            return values;
        }
        return List.of(value.toString());
    }

    /**
     * Returns the human-facing name: title, then name, then id.
     *
     * @return display name
     */
    public String displayName() {
        String title = text("title");
        if (!title.isBlank()) {
            return title;
        }
        String name = text("name");
        return name.isBlank() ? id : name;
    }

    /**
     * Returns the architectural layer, or an empty string when not declared.
     *
     * @return layer name
     */
    public String layer() {
        return text("layer");
    }
}
