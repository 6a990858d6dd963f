package com.stackdoc.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading StackDoc configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code stackdoc.yaml} into {@link StackDocConfig}.
 * A missing or invalid file yields {@link StackDocConfig#defaults()}; a partial file
 * is completed field by field from the defaults.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StackDocConfig config = ConfigLoader.load(Paths.get("stackdoc.yaml"));
 * Path stackRoot = Paths.get(config.stack().directory());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code stackdoc.yaml}
     * @return loaded configuration with defaults filled in, or the defaults if unavailable
     */
    public static StackDocConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return StackDocConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return StackDocConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            StackDocConfig config = YAML_MAPPER.readValue(configPath.toFile(), StackDocConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return StackDocConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config.withDefaults();
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return StackDocConfig.defaults();
        }
    }
}
