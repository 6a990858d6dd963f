package com.stackdoc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * What the cross-element index needs to know about one documented element.
 *
 * @param metadata element identity
 * @param relativePath path of the element report relative to the index
 * @param statistics resource counts
 * @param danglingReferences unresolved references found in the element
 * @param orphans sub-policies referenced by no Policy
 */
public record ElementSummary(
    ElementMetadata metadata,
    String relativePath,
    SummaryStatistics statistics,
    List<DanglingReference> danglingReferences,
    List<Orphan> orphans
) {
    /**
     * Compact constructor with validation.
     */
    public ElementSummary {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        danglingReferences = danglingReferences == null ? List.of() : List.copyOf(danglingReferences);
        orphans = orphans == null ? List.of() : List.copyOf(orphans);
    }

    public String identifier() {
        return metadata.identifier();
    }

    public boolean hasIssues() {
        return !danglingReferences.isEmpty() || !orphans.isEmpty();
    }
}
