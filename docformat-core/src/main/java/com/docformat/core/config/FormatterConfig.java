package com.docformat.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for DocFormat.
 *
 * <p>Loaded from {@code docformat.yaml}. Every section is optional; missing sections and
 * values fall back to their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * template:
 *   title: "Parser API"
 *   stylesheet: "style.css"
 *
 * output:
 *   directory: "./build/docs"
 * }</pre>
 *
 * @param template page template settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FormatterConfig(
    @JsonProperty("template") TemplateConfig template,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor applying defaults to missing sections.
     */
    public FormatterConfig {
        if (template == null) {
            template = TemplateConfig.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static FormatterConfig defaults() {
        return new FormatterConfig(TemplateConfig.defaults(), OutputConfig.defaults());
    }

    /**
     * Page template settings.
     *
     * @param title page title, omitted when null
     * @param stylesheet stylesheet href, omitted when null
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TemplateConfig(
        @JsonProperty("title") String title,
        @JsonProperty("stylesheet") String stylesheet
    ) {
        public static TemplateConfig defaults() {
            return new TemplateConfig(null, null);
        }
    }

    /**
     * Output settings.
     *
     * @param directory directory pages are written to
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {
        public static final String DEFAULT_DIRECTORY = "./docs/api";

        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_DIRECTORY;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(DEFAULT_DIRECTORY);
        }
    }
}
