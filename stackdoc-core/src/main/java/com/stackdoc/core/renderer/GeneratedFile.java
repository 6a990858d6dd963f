package com.stackdoc.core.renderer;

import java.util.Objects;

/**
 * One file produced by a documentation run.
 *
 * @param relativePath path relative to the output directory (e.g., "example-policy.md")
 * @param content file content
 * @param kind what the file documents
 */
public record GeneratedFile(
    String relativePath,
    String content,
    Kind kind
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    /**
     * Kind of generated file.
     */
    public enum Kind {
        ELEMENT_REPORT,
        INDEX
    }
}
