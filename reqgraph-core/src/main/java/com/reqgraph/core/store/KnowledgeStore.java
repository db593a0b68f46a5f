package com.reqgraph.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.reqgraph.core.exception.StoreIoException;
import com.reqgraph.core.model.KnowledgeKind;
import com.reqgraph.core.model.KnowledgeRecord;
import com.reqgraph.core.util.FileUtils;
import com.reqgraph.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * File-backed store of learned patterns, decisions and lessons.
 *
 * <p>Each kind lives in its own YAML file mapping record ID to record content.
 * A file that cannot be parsed is logged and treated as empty.
 */
public class KnowledgeStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeStore.class);
    private static final TypeReference<LinkedHashMap<String, Object>> RECORDS = new TypeReference<>() {};

    private final Path directory;
    private final Map<KnowledgeKind, List<KnowledgeRecord>> pending = new EnumMap<>(KnowledgeKind.class);

    public KnowledgeStore(Path directory) {
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
            throw new StoreIoException("open knowledge store", directory, e);
        }
    }

    /**
     * Loads every record, patterns first, then decisions, then lessons.
     *
     * @return knowledge records in file order
     */
    public List<KnowledgeRecord> loadAll() {
        List<KnowledgeRecord> records = new ArrayList<>();
        for (KnowledgeKind kind : KnowledgeKind.values()) {
            records.addAll(load(kind));
        }
        return records;
    }

    /**
     * Loads the records of one kind.
     *
     * @param kind knowledge kind
     * @return records in file order, empty when the file is absent or malformed
     */
    public List<KnowledgeRecord> load(KnowledgeKind kind) {
        Path file = directory.resolve(kind.fileName());
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        Map<String, Object> document;
        try {
            document = JsonMappers.yaml().readValue(file.toFile(), RECORDS);
        } catch (IOException e) {
            log.warn("Skipping malformed knowledge file {}: {}", file, e.getMessage());
            return List.of();
        }
        if (document == null) {
            return List.of();
        }
        List<KnowledgeRecord> records = new ArrayList<>();
        document.forEach((id, value) -> {
            if (value instanceof Map<?, ?> content) {
                records.add(toRecord(id, kind, content));
            } else {
                log.warn("Skipping {} '{}' in {}: not a mapping", kind.label(), id, file);
            }
        });
        return records;
    }

    /**
     * Stages records of one kind to replace that kind's file on the next {@link #flush()}.
     *
     * @param kind knowledge kind
     * @param records records to store
     */
    public synchronized void stage(KnowledgeKind kind, List<KnowledgeRecord> records) {
        pending.put(kind, List.copyOf(records));
    }

    /**
     * Replaces the records of one kind.
     *
     * @param kind knowledge kind
     * @param records records to store
     */
    public synchronized void save(KnowledgeKind kind, List<KnowledgeRecord> records) {
        stage(kind, records);
        flush();
    }

    @Override
    public synchronized void flush() {
        pending.forEach((kind, records) -> {
            Map<String, Object> document = new LinkedHashMap<>();
            records.forEach(record -> document.put(record.id(), record.attributes()));
            Path file = directory.resolve(kind.fileName());
            try {
                FileUtils.writeAtomically(file, JsonMappers.yaml().writeValueAsString(document));
            } catch (IOException e) {
                throw new StoreIoException("write knowledge file", file, e);
            }
            log.debug("Wrote {} {} records to {}", records.size(), kind.label(), file);
        });
        pending.clear();
    }

    @Override
    public synchronized void close() {
        flush();
    }

    private static KnowledgeRecord toRecord(String id, KnowledgeKind kind, Map<?, ?> content) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        content.forEach((key, value) -> attributes.put(String.valueOf(key), value));
        Object category = attributes.get("category");
        return new KnowledgeRecord(
            id,
            kind,
            category == null ? "" : category.toString(),
            frequency(attributes.get("frequency")),
            attributes
        );
    }

    private static int frequency(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric frequency '{}'", value);
            }
        }
        return 0;
    }
}
