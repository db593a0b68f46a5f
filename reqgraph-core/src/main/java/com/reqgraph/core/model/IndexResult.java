package com.reqgraph.core.model;

import java.util.List;

/**
 * Output of one indexing run.
 *
 * @param entities one entity per valid document record, in document order
 * @param relationships one relationship per declared reference, in document order
 * @param danglingReferences relationships whose target is not among {@code entities}
 * @param warnings records skipped as malformed and other non-fatal findings
 */
public record IndexResult(
    List<Entity> entities,
    List<Relationship> relationships,
    List<DanglingReference> danglingReferences,
    List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public IndexResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        danglingReferences = danglingReferences == null ? List.of() : List.copyOf(danglingReferences);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
