package com.docformat.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading DocFormat configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code docformat.yaml} into {@link FormatterConfig} records.
 * If the config file is missing or invalid, returns {@link FormatterConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FormatterConfig config = ConfigLoader.load(Paths.get("docformat.yaml"));
 * HtmlTemplateService template = HtmlTemplateService.of(config.template());
 * }</pre>
 */
public class ConfigLoader {

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "docformat.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link FormatterConfig#defaults()}.
     *
     * @param configPath path to {@code docformat.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static FormatterConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return FormatterConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return FormatterConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            FormatterConfig config = YAML_MAPPER.readValue(configPath.toFile(), FormatterConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return FormatterConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return FormatterConfig.defaults();
        }
    }
}
