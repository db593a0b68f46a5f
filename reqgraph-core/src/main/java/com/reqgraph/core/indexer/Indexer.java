package com.reqgraph.core.indexer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.reqgraph.core.document.DocumentRecord;
import com.reqgraph.core.document.DocumentSet;
import com.reqgraph.core.exception.DataValidationException;
import com.reqgraph.core.model.DanglingReference;
import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.IndexResult;
import com.reqgraph.core.model.Relationship;
import com.reqgraph.core.store.IndexStore;
import com.reqgraph.core.util.ContentHasher;
import com.reqgraph.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts document records into the typed entity/relationship graph.
 *
 * <p>Indexing is deterministic: identical document content yields identical entities,
 * relationships and content hashes. Each valid record produces exactly one entity and one
 * relationship per declared reference, whether or not the target exists. Unresolved
 * targets are reported as dangling references.
 *
 * <p>A record is skipped with a warning when its content is not a mapping, its ID is blank,
 * its ID was already indexed, or one of its reference fields has an unsupported shape.
 */
public class Indexer {

    /** Relationship metadata key naming the document a reference was declared in. */
    public static final String SOURCE_FILE = "source_file";

    private static final Logger log = LoggerFactory.getLogger(Indexer.class);
    private static final TypeReference<LinkedHashMap<String, Object>> ATTRIBUTES = new TypeReference<>() {};

    private final IndexStore store;

    public Indexer(IndexStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Indexes a document set without touching the store.
     *
     * @param documents authoritative records
     * @return entities, relationships, dangling references and warnings
     */
    public IndexResult index(DocumentSet documents) {
        List<Entity> entities = new ArrayList<>();
        List<Relationship> relationships = new ArrayList<>();
        List<String> warnings = new ArrayList<>(documents.warnings());
        Set<String> seen = new HashSet<>();

        for (DocumentRecord record : documents.records()) {
            String problem = validate(record, seen);
            if (problem != null) {
                skip(record, problem, warnings);
                continue;
            }
            List<Relationship> references;
            try {
                references = references(record);
            } catch (DataValidationException e) {
                skip(record, e.getMessage(), warnings);
                continue;
            }
            seen.add(record.id());
            entities.add(toEntity(record));
            relationships.addAll(references);
        }

        List<DanglingReference> dangling = relationships.stream()
            .filter(relationship -> !seen.contains(relationship.target()))
            .map(relationship -> new DanglingReference(relationship.source(), relationship.target(), relationship.type()))
            .toList();
        dangling.forEach(reference -> log.warn("Dangling reference: {} -[{}]-> {}",
            reference.source(), reference.type(), reference.target()));

        log.info("Indexed {} entities and {} relationships ({} dangling, {} warnings)",
            entities.size(), relationships.size(), dangling.size(), warnings.size());
        return new IndexResult(entities, relationships, dangling, warnings);
    }

    /**
     * Indexes a document set and replaces the stored index with the result.
     *
     * @param documents authoritative records
     * @param indexedAt timestamp recorded in the index summary
     * @return indexing output
     */
    public IndexResult indexAndPersist(DocumentSet documents, Instant indexedAt) {
        IndexResult result = index(documents);
        store.write(result, indexedAt);
        return result;
    }

    /**
     * Builds the entity for a single record, without validation.
     *
     * @param record document record whose content is a mapping
     * @return entity with its content hash
     */
    public static Entity toEntity(DocumentRecord record) {
        Map<String, Object> attributes = JsonMappers.json().convertValue(record.content(), ATTRIBUTES);
        return new Entity(
            record.id(),
            record.kind().entityType(),
            attributes,
            ContentHasher.hash(attributes),
            record.source()
        );
    }

    private static String validate(DocumentRecord record, Set<String> seen) {
        if (!record.content().isObject()) {
            return "record is not a mapping";
        }
        if (record.id().isBlank()) {
            return "record has no ID";
        }
        if (seen.contains(record.id())) {
            return "duplicate ID";
        }
        return null;
    }

    private static List<Relationship> references(DocumentRecord record) {
        List<Relationship> relationships = new ArrayList<>();
        for (ReferenceField field : ReferenceField.values()) {
            for (String target : field.extract(record.content())) {
                relationships.add(new Relationship(
                    record.id(), target, field.relationshipType(), Map.of(SOURCE_FILE, record.source())));
            }
        }
        return relationships;
    }

    private static void skip(DocumentRecord record, String problem, List<String> warnings) {
        String warning = "Skipped " + record.kind().entityType().code() + " '" + record.id()
            + "' in " + record.source() + ": " + problem;
        log.warn(warning);
        warnings.add(warning);
    }
}
