package com.stackdoc.core.model;

import java.util.Objects;

/**
 * Identity and manifest metadata of one documented element.
 *
 * @param identifier element directory name, used for the output file name and index links
 * @param displayName display name from the manifest, or the identifier when absent
 * @param description description from the manifest, or an empty string when absent
 */
public record ElementMetadata(
    String identifier,
    String displayName,
    String description
) {
    /**
     * Compact constructor with validation and fallbacks.
     */
    public ElementMetadata {
        Objects.requireNonNull(identifier, "identifier must not be null");
        if (displayName == null || displayName.isBlank()) {
            displayName = identifier;
        }
        if (description == null) {
            description = "";
        }
    }

    /**
     * Metadata for an element without a usable manifest.
     *
     * @param identifier element directory name
     * @return metadata falling back to the identifier and an empty description
     */
    public static ElementMetadata fallback(String identifier) {
        return new ElementMetadata(identifier, identifier, "");
    }
}
