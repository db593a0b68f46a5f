package com.reqgraph.core.config;

import com.reqgraph.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code reqgraph.yaml} into a {@link ReqGraphConfig}.
 *
 * <p>Configuration never blocks a command: an absent, unreadable, empty or unparseable
 * file yields {@link ReqGraphConfig#defaults()}, and sections left out of the file keep
 * their default directories.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ReqGraphConfig config = ConfigLoader.loadForWorkspace(workspaceRoot, null);
 * Path indexDir = workspaceRoot.resolve(config.index().directory());
 * }</pre>
 */
public final class ConfigLoader {

    /** Configuration file looked up in the workspace root. */
    public static final String CONFIG_FILE = "reqgraph.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads the workspace configuration.
     *
     * <p>Without an explicit file, {@code <root>/reqgraph.yaml} is optional and its absence
     * is not reported. An explicit file that does not exist is reported as a warning.
     *
     * @param root workspace root
     * @param explicitConfig file named on the command line, or null
     * @return workspace configuration
     */
    public static ReqGraphConfig loadForWorkspace(Path root, Path explicitConfig) {
        if (explicitConfig == null) {
            return load(root.resolve(CONFIG_FILE));
        }
        if (!Files.exists(explicitConfig)) {
            log.warn("Configuration file {} does not exist, falling back to default directories", explicitConfig);
            return ReqGraphConfig.defaults();
        }
        return load(explicitConfig);
    }

    /**
     * Loads one configuration file, falling back to defaults when it cannot be used.
     *
     * @param configPath path to the YAML file
     * @return parsed configuration, or defaults
     */
    public static ReqGraphConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("No {} at {}, using default directories", CONFIG_FILE, configPath);
            return ReqGraphConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Cannot read configuration {}, using default directories", configPath);
            return ReqGraphConfig.defaults();
        }

        ReqGraphConfig config;
        try {
            config = JsonMappers.yaml().readValue(configPath.toFile(), ReqGraphConfig.class);
        } catch (IOException e) {
            log.error("Ignoring malformed configuration {}: {}", configPath, e.getMessage());
            return ReqGraphConfig.defaults();
        }
        if (config == null) {
            log.warn("Configuration {} is empty, using default directories", configPath);
            return ReqGraphConfig.defaults();
        }
        log.info("Using configuration {} (documents: {}, index: {})",
            configPath, config.documents().directory(), config.index().directory());
        return config;
    }
}
