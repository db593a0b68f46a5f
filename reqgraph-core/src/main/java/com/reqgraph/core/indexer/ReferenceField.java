package com.reqgraph.core.indexer;

import com.fasterxml.jackson.databind.JsonNode;
import com.reqgraph.core.exception.DataValidationException;
import com.reqgraph.core.model.RelationshipType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-reference fields recognised in document records and the relationship each produces.
 *
 * <p>A reference value may be a single ID or a list of IDs. {@code applies_to} may also be
 * a mapping naming its target in {@code entity_name}.
 */
public enum ReferenceField {
    IMPLEMENTS("implements", RelationshipType.IMPLEMENTS),
    DEPENDENCIES("dependencies", RelationshipType.DEPENDS_ON),
    APPLIES_TO("applies_to", RelationshipType.VALIDATES),
    EXTENDS("extends", RelationshipType.EXTENDS),
    COVERS("covers", RelationshipType.COVERS),
    CONFLICTS_WITH("conflicts_with", RelationshipType.CONFLICTS_WITH);

    private static final String ENTITY_NAME = "entity_name";

    private final String fieldName;
    private final RelationshipType relationshipType;

    ReferenceField(String fieldName, RelationshipType relationshipType) {
        this.fieldName = fieldName;
        this.relationshipType = relationshipType;
    }

    public String fieldName() {
        return fieldName;
    }

    public RelationshipType relationshipType() {
        return relationshipType;
    }

    /**
     * Extracts referenced IDs from a document record.
     *
     * @param content record content
     * @return referenced IDs in document order, empty when the field is absent
     * @throws DataValidationException if the field has an unsupported shape
     */
    public List<String> extract(JsonNode content) {
        JsonNode value = content.get(fieldName);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isTextual()) {
            return nonBlank(value.asText());
        }
        if (value.isArray()) {
            List<String> ids = new ArrayList<>();
            for (JsonNode item : value) {
                if (!item.isValueNode() || item.isNull()) {
                    throw invalid(value);
                }
                ids.addAll(nonBlank(item.asText()));
            }
            return ids;
        }
        if (this == APPLIES_TO && value.isObject()) {
            JsonNode name = value.get(ENTITY_NAME);
            if (name == null || name.isNull()) {
                return List.of();
            }
            if (!name.isValueNode()) {
                throw invalid(value);
            }
            return nonBlank(name.asText());
        }
        throw invalid(value);
    }

    /**
     * Returns true if {@code attribute} is a record field used as a cross-reference.
     *
     * @param attribute attribute name
     * @return true for reference fields
     */
    public static boolean isReference(String attribute) {
        for (ReferenceField field : values()) {
            if (field.fieldName.equals(attribute)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the attributes without any reference field.
     *
     * @param attributes entity attributes
     * @return copy without reference fields
     */
    public static Map<String, Object> withoutReferences(Map<String, Object> attributes) {
        Map<String, Object> content = new LinkedHashMap<>(attributes);
        content.keySet().removeIf(ReferenceField::isReference);
        return content;
    }

    private DataValidationException invalid(JsonNode value) {
        return new DataValidationException(
            "Field '" + fieldName + "' must be an ID or a list of IDs, found " + value.getNodeType(),
            Map.of("field", fieldName));
    }

    private static List<String> nonBlank(String id) {
        String trimmed = id.trim();
        return trimmed.isEmpty() ? List.of() : List.of(trimmed);
    }
}
