package com.stackdoc.core.pipeline;

import com.stackdoc.core.config.StackDocConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Inputs of one pipeline run.
 *
 * @param stackRoot directory holding one subdirectory per element
 * @param elementFilter single element to process, or {@code null} for all
 * @param valuesFile values document name inside each element
 * @param manifestFile manifest name inside each element
 * @param indexFile index file name, written only when no element filter is set
 */
public record PipelineRequest(
    Path stackRoot,
    String elementFilter,
    String valuesFile,
    String manifestFile,
    String indexFile
) {
    /**
     * Compact constructor with validation.
     */
    public PipelineRequest {
        Objects.requireNonNull(stackRoot, "stackRoot must not be null");
        Objects.requireNonNull(valuesFile, "valuesFile must not be null");
        Objects.requireNonNull(manifestFile, "manifestFile must not be null");
        Objects.requireNonNull(indexFile, "indexFile must not be null");
    }

    public static PipelineRequest from(StackDocConfig config, String elementFilter) {
        StackDocConfig c = config.withDefaults();
        return new PipelineRequest(
            Paths.get(c.stack().directory()),
            elementFilter,
            c.stack().valuesFile(),
            c.stack().manifestFile(),
            c.output().indexFile());
    }

    public boolean includesIndex() {
        return elementFilter == null;
    }
}
