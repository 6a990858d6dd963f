package com.stackdoc.core.generator;

import com.stackdoc.core.model.ElementSummary;

import java.util.Objects;

/**
 * Generated report of one element.
 *
 * @param identifier element identifier
 * @param relativePath path of the report relative to the output directory
 * @param content Markdown content
 * @param summary statistics and issues for the index
 */
public record ElementReport(
    String identifier,
    String relativePath,
    String content,
    ElementSummary summary
) {
    /**
     * Compact constructor with validation.
     */
    public ElementReport {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
    }
}
