package com.stackdoc.core.pipeline;

import java.util.Objects;

/**
 * An element whose values document could not be loaded.
 *
 * @param identifier element identifier
 * @param sourceName values document path
 * @param lineNumber 1-based line of the error
 * @param problem parser message
 */
public record ElementFailure(
    String identifier,
    String sourceName,
    int lineNumber,
    String problem
) {
    /**
     * Compact constructor with validation.
     */
    public ElementFailure {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(problem, "problem must not be null");
    }

    public String message() {
        return identifier + ": " + sourceName + ": line " + lineNumber + ": " + problem;
    }
}
