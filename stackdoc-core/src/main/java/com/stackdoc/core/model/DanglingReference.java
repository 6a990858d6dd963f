package com.stackdoc.core.model;

import java.util.Objects;

/**
 * A reference naming an entity that is absent from its target collection.
 *
 * @param sourceLabel label of the referencing entity kind (e.g. "Policy", "PolicySet")
 * @param sourceName name of the referencing entity
 * @param targetKind kind of the collection searched
 * @param targetName name that could not be found
 */
public record DanglingReference(
    String sourceLabel,
    String sourceName,
    PolicyKind targetKind,
    String targetName
) {
    /**
     * Compact constructor with validation.
     */
    public DanglingReference {
        Objects.requireNonNull(sourceLabel, "sourceLabel must not be null");
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(targetKind, "targetKind must not be null");
        Objects.requireNonNull(targetName, "targetName must not be null");
    }
}
