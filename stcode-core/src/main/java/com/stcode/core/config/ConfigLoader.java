package com.stcode.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@code stcode.yaml} into {@link StcodeConfig}.
 *
 * <p>If the file is missing, unreadable or invalid, logs the problem and returns
 * {@link StcodeConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StcodeConfig config = ConfigLoader.load(Paths.get("stcode.yaml"));
 * RenderContext context = config.renderContext();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * @param configPath path to {@code stcode.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static StcodeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return StcodeConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return StcodeConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            StcodeConfig config = YAML_MAPPER.readValue(configPath.toFile(), StcodeConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return StcodeConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return StcodeConfig.defaults();
        }
    }
}
