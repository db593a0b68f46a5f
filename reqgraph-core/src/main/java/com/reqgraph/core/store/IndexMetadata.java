package com.reqgraph.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.reqgraph.core.model.DanglingReference;

import java.util.List;
import java.util.Map;

/**
 * Summary artifact written next to the entity and relationship sets.
 *
 * @param indexedAt ISO-8601 instant of the indexing run
 * @param schemaVersion schema version of the index artifacts
 * @param totalEntities entity count
 * @param totalRelationships relationship count
 * @param entityTypes entity count by type code
 * @param relationshipTypes relationship count by type
 * @param danglingReferences unresolved relationship targets
 * @param warnings records skipped during indexing
 * @param artifactHashes content hash of each artifact written with this summary, by file name;
 *                       empty for indexes written before hashes were recorded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexMetadata(
    @JsonProperty("indexed_at") String indexedAt,
    @JsonProperty("schema_version") String schemaVersion,
    @JsonProperty("total_entities") int totalEntities,
    @JsonProperty("total_relationships") int totalRelationships,
    @JsonProperty("entity_types") Map<String, Integer> entityTypes,
    @JsonProperty("relationship_types") Map<String, Integer> relationshipTypes,
    @JsonProperty("dangling_references") List<DanglingReference> danglingReferences,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("artifact_hashes") Map<String, String> artifactHashes
) {
    /**
     * Compact constructor with validation.
     */
    public IndexMetadata {
        entityTypes = entityTypes == null ? Map.of() : Map.copyOf(entityTypes);
        relationshipTypes = relationshipTypes == null ? Map.of() : Map.copyOf(relationshipTypes);
        danglingReferences = danglingReferences == null ? List.of() : List.copyOf(danglingReferences);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        artifactHashes = artifactHashes == null ? Map.of() : Map.copyOf(artifactHashes);
        if (schemaVersion == null) {
            schemaVersion = "";
        }
    }
}
