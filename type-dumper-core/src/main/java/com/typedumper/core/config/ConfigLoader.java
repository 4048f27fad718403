package com.typedumper.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading TypeDumper configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code typedumper.yaml} into {@link DumperConfig}
 * records. A missing, unreadable, empty or invalid file yields
 * {@link DumperConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DumperConfig config = ConfigLoader.load(Paths.get("typedumper.yaml"));
 * String layout = config.output().layout();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Configuration file name looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = "typedumper.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code typedumper.yaml}
     * @return loaded configuration, or defaults if unavailable
     */
    public static DumperConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return DumperConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return DumperConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            DumperConfig config = YAML_MAPPER.readValue(configPath.toFile(), DumperConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return DumperConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return DumperConfig.defaults();
        }
    }
}
