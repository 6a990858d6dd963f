package com.stackdoc.core.model;

import java.util.Objects;

/**
 * A sub-policy defined in its collection but referenced by no Policy.
 *
 * @param kind collection kind
 * @param name entity name
 */
public record Orphan(PolicyKind kind, String name) {
    /**
     * Compact constructor with validation.
     */
    public Orphan {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }
}
