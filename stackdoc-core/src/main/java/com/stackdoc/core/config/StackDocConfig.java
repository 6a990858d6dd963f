package com.stackdoc.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for a StackDoc run.
 *
 * <p>Loaded from {@code stackdoc.yaml} in the working directory. Every field is
 * optional; missing values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * stack:
 *   directory: "stack"
 *   valuesFile: "values.yaml"
 *   manifestFile: "Chart.yaml"
 *
 * output:
 *   directory: "docs"
 *   indexFile: "README.md"
 * }</pre>
 *
 * @param stack where elements are discovered
 * @param output where documentation is written
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StackDocConfig(
    @JsonProperty("stack") StackSettings stack,
    @JsonProperty("output") OutputSettings output
) {
    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "stackdoc.yaml";

    public static StackDocConfig defaults() {
        return new StackDocConfig(StackSettings.defaults(), OutputSettings.defaults());
    }

    /**
     * Fills every missing value from {@link #defaults()}.
     *
     * @return configuration without null fields
     */
    public StackDocConfig withDefaults() {
        StackSettings s = stack == null ? StackSettings.defaults() : stack.withDefaults();
        OutputSettings o = output == null ? OutputSettings.defaults() : output.withDefaults();
        return new StackDocConfig(s, o);
    }

    /**
     * Element discovery settings.
     *
     * @param directory stack root holding one directory per element
     * @param valuesFile values document name inside each element
     * @param manifestFile manifest name inside each element
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StackSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("valuesFile") String valuesFile,
        @JsonProperty("manifestFile") String manifestFile
    ) {
        public static StackSettings defaults() {
            return new StackSettings("stack", "values.yaml", "Chart.yaml");
        }

        StackSettings withDefaults() {
            StackSettings d = defaults();
            return new StackSettings(
                directory != null ? directory : d.directory(),
                valuesFile != null ? valuesFile : d.valuesFile(),
                manifestFile != null ? manifestFile : d.manifestFile());
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory path
     * @param indexFile name of the index file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("indexFile") String indexFile
    ) {
        public static OutputSettings defaults() {
            return new OutputSettings("docs", "README.md");
        }

        OutputSettings withDefaults() {
            OutputSettings d = defaults();
            return new OutputSettings(
                directory != null ? directory : d.directory(),
                indexFile != null ? indexFile : d.indexFile());
        }
    }
}
