package com.stackdoc.core.model;

import java.util.Objects;

/**
 * Three-column record rendered for every documented field.
 *
 * @param label parameter label
 * @param value formatted literal value
 * @param description description text, empty when the document has none
 */
public record FieldRow(
    String label,
    String value,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public FieldRow {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (description == null) {
            description = "";
        }
    }
}
