package com.reqgraph.core.document;

import com.fasterxml.jackson.core.type.TypeReference;
import com.reqgraph.core.exception.StoreIoException;
import com.reqgraph.core.model.KnowledgeKind;
import com.reqgraph.core.util.FileUtils;
import com.reqgraph.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Handle on the authoritative document store.
 *
 * <p>Reads go through {@link YamlDocumentLoader}. The only write is promotion of derived
 * knowledge into {@value YamlDocumentLoader#PROMOTED_FILE}; every promoted record keeps
 * its derived-side origin in {@code origin}, {@code derived_id}, {@code derived_kind},
 * {@code derived_hash} and {@code promoted_at}.
 */
public class DocumentStore {

    public static final String ORIGIN = "origin";
    public static final String DERIVED_ID = "derived_id";
    public static final String DERIVED_KIND = "derived_kind";
    public static final String DERIVED_HASH = "derived_hash";
    public static final String PROMOTED_AT = "promoted_at";

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);
    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, Object>>> PROMOTED_TYPE =
        new TypeReference<>() {};

    private final Path root;
    private final DocumentLoader loader;

    public DocumentStore(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.loader = new YamlDocumentLoader(root);
    }

    public Path root() {
        return root;
    }

    /**
     * Loads every authoritative record.
     *
     * @return document set
     */
    public DocumentSet load() {
        return loader.load();
    }

    /**
     * Returns the derived hash each promoted record was created from, keyed by derived ID.
     *
     * @return derived ID to derived hash
     */
    public Map<String, String> promotedHashes() {
        Map<String, String> hashes = new LinkedHashMap<>();
        readPromoted().values().forEach(section -> section.values().forEach(value -> {
            if (value instanceof Map<?, ?> record) {
                Object derivedId = record.get(DERIVED_ID);
                Object derivedHash = record.get(DERIVED_HASH);
                if (derivedId != null && derivedHash != null) {
                    hashes.put(derivedId.toString(), derivedHash.toString());
                }
            }
        }));
        return hashes;
    }

    /**
     * Writes promotions into the promoted-knowledge document, replacing earlier
     * promotions of the same derived ID.
     *
     * @param promotions records to promote
     * @param promotedAt promotion timestamp
     * @return number of records written
     */
    public int promote(Collection<Promotion> promotions, Instant promotedAt) {
        if (promotions.isEmpty()) {
            return 0;
        }
        LinkedHashMap<String, LinkedHashMap<String, Object>> document = readPromoted();
        for (Promotion promotion : promotions) {
            Map<String, Object> record = new LinkedHashMap<>(promotion.attributes());
            record.put(ORIGIN, "derived");
            record.put(DERIVED_ID, promotion.derivedId());
            record.put(DERIVED_KIND, promotion.kind().label());
            record.put(DERIVED_HASH, promotion.derivedHash());
            record.put(PROMOTED_AT, promotedAt.toString());
            document.computeIfAbsent(section(promotion.kind()), key -> new LinkedHashMap<>())
                .put(promotion.derivedId(), record);
        }
        Path file = promotedFile();
        try {
            FileUtils.writeAtomically(file, JsonMappers.yaml().writeValueAsString(document));
        } catch (IOException e) {
            throw new StoreIoException("promote", file, e);
        }
        log.info("Promoted {} derived records into {}", promotions.size(), file);
        return promotions.size();
    }

    /**
     * Captures the promoted-knowledge document for rollback.
     *
     * @return raw content, or null if the document does not exist
     */
    public String snapshotPromoted() {
        Path file = promotedFile();
        try {
            return FileUtils.readIfExists(file);
        } catch (IOException e) {
            throw new StoreIoException("snapshot", file, e);
        }
    }

    /**
     * Restores a snapshot taken by {@link #snapshotPromoted()}.
     *
     * @param snapshot raw content, or null to remove the document
     */
    public void restorePromoted(String snapshot) {
        Path file = promotedFile();
        try {
            if (snapshot == null) {
                if (Files.isRegularFile(file)) {
                    Files.delete(file);
                }
            } else {
                FileUtils.writeAtomically(file, snapshot);
            }
        } catch (IOException e) {
            throw new StoreIoException("restore", file, e);
        }
    }

    private LinkedHashMap<String, LinkedHashMap<String, Object>> readPromoted() {
        Path file = promotedFile();
        if (!Files.isRegularFile(file)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, LinkedHashMap<String, Object>> document =
                JsonMappers.yaml().readValue(file.toFile(), PROMOTED_TYPE);
            return document == null ? new LinkedHashMap<>() : document;
        } catch (IOException e) {
            throw new StoreIoException("read-promoted", file, e);
        }
    }

    private Path promotedFile() {
        return root.resolve(YamlDocumentLoader.PROMOTED_FILE);
    }

    private static String section(KnowledgeKind kind) {
        return kind.label() + "s";
    }
}
