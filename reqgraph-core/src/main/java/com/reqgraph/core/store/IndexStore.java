package com.reqgraph.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reqgraph.core.exception.IndexCorruptException;
import com.reqgraph.core.exception.StoreIoException;
import com.reqgraph.core.graph.RequirementGraph;
import com.reqgraph.core.model.Entity;
import com.reqgraph.core.model.IndexResult;
import com.reqgraph.core.model.Relationship;
import com.reqgraph.core.util.ContentHasher;
import com.reqgraph.core.util.FileUtils;
import com.reqgraph.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * File-backed derived index store.
 *
 * <p>Holds three independently loadable artifacts: {@value #ENTITIES_FILE},
 * {@value #RELATIONSHIPS_FILE} and {@value #METADATA_FILE}. Each is replaced atomically,
 * so readers see either the previous or the new content of each file. The metadata is
 * written last and records the hash of the other two; {@link #loadGraph()} only accepts
 * entity and relationship sets that match it. Missing artifacts load as empty; artifacts
 * that exist but cannot be parsed raise {@link IndexCorruptException}.
 *
 * <p>Writes are staged with {@link #stage(IndexResult, Instant)} and persisted by
 * {@link #flush()}; {@link #write(IndexResult, Instant)} does both.
 */
public class IndexStore implements GraphStore {

    public static final String ENTITIES_FILE = "entities.json";
    public static final String RELATIONSHIPS_FILE = "relationships.json";
    public static final String METADATA_FILE = "metadata.json";

    /** Schema version written into the metadata artifact. */
    public static final String SCHEMA_VERSION = "1.0";

    private static final Logger log = LoggerFactory.getLogger(IndexStore.class);
    private static final TypeReference<List<Entity>> ENTITY_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Relationship>> RELATIONSHIP_LIST = new TypeReference<>() {};
    private static final TypeReference<IndexMetadata> METADATA = new TypeReference<>() {};
    private static final int MAX_READ_ATTEMPTS = 5;
    private static final long READ_RETRY_MILLIS = 20;

    private final Path directory;
    private final ObjectMapper mapper = JsonMappers.json();

    private IndexResult pending;
    private Instant pendingAt;
    private RequirementGraph cachedGraph;

    public IndexStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void open() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreIoException("open index store", directory, e);
        }
        log.debug("Opened index store at {}", directory);
    }

    /**
     * Stages an index result to be written by the next {@link #flush()}.
     *
     * @param result indexing output
     * @param indexedAt indexing timestamp
     */
    public synchronized void stage(IndexResult result, Instant indexedAt) {
        this.pending = Objects.requireNonNull(result, "result must not be null");
        this.pendingAt = Objects.requireNonNull(indexedAt, "indexedAt must not be null");
    }

    /**
     * Replaces the index with {@code result}.
     *
     * @param result indexing output
     * @param indexedAt indexing timestamp
     */
    public synchronized void write(IndexResult result, Instant indexedAt) {
        stage(result, indexedAt);
        flush();
    }

    @Override
    public synchronized void flush() {
        if (pending == null) {
            return;
        }
        String entities = serialize(ENTITIES_FILE, pending.entities());
        String relationships = serialize(RELATIONSHIPS_FILE, pending.relationships());
        IndexMetadata metadata = summarize(pending, pendingAt, Map.of(
            ENTITIES_FILE, ContentHasher.hashText(entities),
            RELATIONSHIPS_FILE, ContentHasher.hashText(relationships)));
        writeRaw(ENTITIES_FILE, entities);
        writeRaw(RELATIONSHIPS_FILE, relationships);
        writeRaw(METADATA_FILE, serialize(METADATA_FILE, metadata));
        log.info("Wrote index: {} entities, {} relationships, {} dangling references",
            metadata.totalEntities(), metadata.totalRelationships(), metadata.danglingReferences().size());
        pending = null;
        pendingAt = null;
        cachedGraph = null;
    }

    @Override
    public synchronized void close() {
        flush();
        cachedGraph = null;
        log.debug("Closed index store at {}", directory);
    }

    /**
     * Loads the persisted entities.
     *
     * @return entities in index order, empty when the artifact does not exist
     * @throws IndexCorruptException if the artifact is malformed
     */
    public List<Entity> loadEntities() {
        return readArtifact(ENTITIES_FILE, ENTITY_LIST).orElse(List.of());
    }

    /**
     * Loads the persisted relationships.
     *
     * @return relationships in index order, empty when the artifact does not exist
     * @throws IndexCorruptException if the artifact is malformed
     */
    public List<Relationship> loadRelationships() {
        return readArtifact(RELATIONSHIPS_FILE, RELATIONSHIP_LIST).orElse(List.of());
    }

    /**
     * Loads the summary artifact.
     *
     * @return metadata, empty when the index was never written
     * @throws IndexCorruptException if the artifact is malformed
     */
    public Optional<IndexMetadata> loadMetadata() {
        return readArtifact(METADATA_FILE, METADATA);
    }

    /**
     * Loads the index as a graph. The graph is cached until the next write or restore.
     *
     * <p>Entity and relationship sets are checked against the hashes in the metadata. A
     * mismatch means another process is replacing the index, so the read is retried.
     *
     * @return graph, empty when no index exists
     * @throws IndexCorruptException if any artifact is malformed, or the artifacts still
     *         belong to different index generations after retrying
     */
    public synchronized RequirementGraph loadGraph() {
        if (cachedGraph == null) {
            cachedGraph = readConsistentGraph();
            log.debug("Loaded graph with {} entities from {}", cachedGraph.size(), directory);
        }
        return cachedGraph;
    }

    /**
     * Captures the raw artifacts for rollback.
     *
     * @return snapshot of the three artifacts
     */
    public synchronized IndexSnapshot snapshot() {
        return new IndexSnapshot(readRaw(ENTITIES_FILE), readRaw(RELATIONSHIPS_FILE), readRaw(METADATA_FILE));
    }

    /**
     * Restores artifacts captured by {@link #snapshot()}, discarding any staged write.
     *
     * @param snapshot snapshot to restore
     */
    public synchronized void restore(IndexSnapshot snapshot) {
        restoreRaw(ENTITIES_FILE, snapshot.entities());
        restoreRaw(RELATIONSHIPS_FILE, snapshot.relationships());
        restoreRaw(METADATA_FILE, snapshot.metadata());
        pending = null;
        pendingAt = null;
        cachedGraph = null;
        log.info("Restored index snapshot in {}", directory);
    }

    static IndexMetadata summarize(IndexResult result, Instant indexedAt, Map<String, String> artifactHashes) {
        Map<String, Integer> entityTypes = new TreeMap<>();
        result.entities().forEach(entity -> entityTypes.merge(entity.type().code(), 1, Integer::sum));
        Map<String, Integer> relationshipTypes = new TreeMap<>();
        result.relationships().forEach(rel -> relationshipTypes.merge(rel.type().name(), 1, Integer::sum));
        return new IndexMetadata(
            indexedAt.toString(),
            SCHEMA_VERSION,
            result.entities().size(),
            result.relationships().size(),
            entityTypes,
            relationshipTypes,
            result.danglingReferences(),
            result.warnings(),
            artifactHashes
        );
    }

    private RequirementGraph readConsistentGraph() {
        for (int attempt = 1; attempt <= MAX_READ_ATTEMPTS; attempt++) {
            String metadataText = readRaw(METADATA_FILE);
            String entities = readRaw(ENTITIES_FILE);
            String relationships = readRaw(RELATIONSHIPS_FILE);
            IndexMetadata metadata = metadataText == null ? null : parse(METADATA_FILE, metadataText, METADATA);
            if (metadata == null || sameGeneration(metadata, entities, relationships)) {
                return new RequirementGraph(
                    entities == null ? List.of() : parse(ENTITIES_FILE, entities, ENTITY_LIST),
                    relationships == null ? List.of() : parse(RELATIONSHIPS_FILE, relationships, RELATIONSHIP_LIST));
            }
            log.debug("Index artifacts in {} changed while reading (attempt {})", directory, attempt);
            pause();
        }
        throw new IndexCorruptException(directory.resolve(METADATA_FILE),
            "entities and relationships belong to different index generations");
    }

    static boolean sameGeneration(IndexMetadata metadata, String entities, String relationships) {
        return matchesHash(metadata.artifactHashes().get(ENTITIES_FILE), entities)
            && matchesHash(metadata.artifactHashes().get(RELATIONSHIPS_FILE), relationships);
    }

    private static boolean matchesHash(String expected, String content) {
        if (expected == null) {
            return true;
        }
        return content != null && expected.equals(ContentHasher.hashText(content));
    }

    private static void pause() {
        try {
            Thread.sleep(READ_RETRY_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading the index", e);
        }
    }

    private String serialize(String fileName, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + fileName, e);
        }
    }

    private void writeRaw(String fileName, String content) {
        Path file = directory.resolve(fileName);
        try {
            FileUtils.writeAtomically(file, content);
        } catch (IOException e) {
            throw new StoreIoException("write index artifact", file, e);
        }
    }

    private <T> Optional<T> readArtifact(String fileName, TypeReference<T> type) {
        String content = readRaw(fileName);
        return content == null ? Optional.empty() : Optional.of(parse(fileName, content, type));
    }

    private <T> T parse(String fileName, String content, TypeReference<T> type) {
        Path file = directory.resolve(fileName);
        try {
            T value = mapper.readValue(content, type);
            if (value == null) {
                throw new IndexCorruptException(file, "artifact is empty");
            }
            return value;
        } catch (IOException e) {
            throw new IndexCorruptException(file, e);
        }
    }

    private String readRaw(String fileName) {
        Path file = directory.resolve(fileName);
        try {
            return FileUtils.readIfExists(file);
        } catch (IOException e) {
            throw new StoreIoException("read index artifact", file, e);
        }
    }

    private void restoreRaw(String fileName, String content) {
        Path file = directory.resolve(fileName);
        try {
            if (content == null) {
                Files.deleteIfExists(file);
            } else {
                FileUtils.writeAtomically(file, content);
            }
        } catch (IOException e) {
            throw new StoreIoException("restore index artifact", file, e);
        }
    }
}
