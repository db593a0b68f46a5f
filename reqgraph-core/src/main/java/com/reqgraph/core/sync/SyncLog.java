package com.reqgraph.core.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.reqgraph.core.exception.StoreIoException;
import com.reqgraph.core.model.SyncConflict;
import com.reqgraph.core.util.FileUtils;
import com.reqgraph.core.util.JsonMappers;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only JSON-lines logs of sync events and conflict resolutions, kept in the index directory.
 */
public class SyncLog {

    public static final String EVENTS_FILE = "sync.log";
    public static final String CONFLICTS_FILE = "conflicts.json";

    private final Path directory;

    public SyncLog(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    /**
     * Appends a sync event.
     *
     * @param timestamp event time
     * @param eventType event type, e.g. {@code authoritative_to_derived}
     * @param data event details
     */
    public void event(Instant timestamp, String eventType, Map<String, ?> data) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", timestamp.toString());
        line.put("event_type", eventType);
        line.put("data", data);
        append(directory.resolve(EVENTS_FILE), line);
    }

    /**
     * Appends a resolved conflict, keeping both the authoritative and the derived value.
     *
     * @param timestamp resolution time
     * @param conflict classified conflict with its resolution
     */
    public void conflict(Instant timestamp, SyncConflict conflict) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", timestamp.toString());
        line.put("conflict", conflict);
        append(directory.resolve(CONFLICTS_FILE), line);
    }

    private static void append(Path file, Map<String, Object> line) {
        try {
            FileUtils.appendLine(file, JsonMappers.compactJson().writeValueAsString(line));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize sync log entry", e);
        } catch (IOException e) {
            throw new StoreIoException("append sync log", file, e);
        }
    }
}
