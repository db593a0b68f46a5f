package com.reqgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration for ReqGraph workspaces.
 *
 * <p>Loaded from {@code reqgraph.yaml}. Directories are resolved against the directory
 * holding the configuration file; missing sections fall back to defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * documents:
 *   directory: "./docs/ssot"
 *
 * index:
 *   directory: "./docs/ssot/.index"
 *
 * knowledge:
 *   directory: "./.knowledge"
 *
 * features:
 *   directory: "./features"
 *
 * query:
 *   patternCategories:
 *     error: error_handling
 *     retry: resilience
 * }</pre>
 *
 * @param documents authoritative document store settings
 * @param index derived index store settings
 * @param knowledge learning store settings
 * @param features BDD artifact settings
 * @param query query engine settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReqGraphConfig(
    @JsonProperty("documents") DirectoryConfig documents,
    @JsonProperty("index") DirectoryConfig index,
    @JsonProperty("knowledge") DirectoryConfig knowledge,
    @JsonProperty("features") DirectoryConfig features,
    @JsonProperty("query") QueryConfig query
) {
    public static final String DEFAULT_DOCUMENTS_DIRECTORY = "docs/ssot";
    public static final String DEFAULT_INDEX_DIRECTORY = "docs/ssot/.index";
    public static final String DEFAULT_KNOWLEDGE_DIRECTORY = ".knowledge";
    public static final String DEFAULT_FEATURES_DIRECTORY = "features";

    /**
     * Compact constructor filling absent sections with defaults.
     */
    public ReqGraphConfig {
        documents = orDefault(documents, DEFAULT_DOCUMENTS_DIRECTORY);
        index = orDefault(index, DEFAULT_INDEX_DIRECTORY);
        knowledge = orDefault(knowledge, DEFAULT_KNOWLEDGE_DIRECTORY);
        features = orDefault(features, DEFAULT_FEATURES_DIRECTORY);
        if (query == null) {
            query = new QueryConfig(null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ReqGraphConfig defaults() {
        return new ReqGraphConfig(null, null, null, null, null);
    }

    private static DirectoryConfig orDefault(DirectoryConfig config, String directory) {
        if (config == null || config.directory() == null || config.directory().isBlank()) {
            return new DirectoryConfig(directory);
        }
        return config;
    }

    /**
     * A store location.
     *
     * @param directory directory path, relative paths resolve against the workspace root
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DirectoryConfig(
        @JsonProperty("directory") String directory
    ) {}

    /**
     * Query engine settings.
     *
     * @param patternCategories keyword to pattern category table, evaluated in order;
     *                          empty means the built-in table
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QueryConfig(
        @JsonProperty("patternCategories") Map<String, String> patternCategories
    ) {
        /**
         * Compact constructor keeping the configured order.
         */
        public QueryConfig {
            patternCategories = patternCategories == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(patternCategories));
        }
    }
}
