package com.reqgraph.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Shared Jackson mappers.
 *
 * <p>The JSON mapper sorts map keys so that serialized output is deterministic.
 */
public final class JsonMappers {

    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private static final ObjectMapper COMPACT_JSON = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private static final ObjectMapper YAML = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    private JsonMappers() {
        // Utility class
    }

    /**
     * Pretty-printing JSON mapper with sorted map keys.
     */
    public static ObjectMapper json() {
        return JSON;
    }

    /**
     * Single-line JSON mapper with sorted map keys, used for log lines and hashing.
     */
    public static ObjectMapper compactJson() {
        return COMPACT_JSON;
    }

    public static ObjectMapper yaml() {
        return YAML;
    }
}
