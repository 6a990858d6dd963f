package com.stackdoc.core.loader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from {@link StructuralPath} to description text.
 *
 * <p>Built once per document load and kept apart from the decoded tree, so the
 * tree values are never touched by description extraction. Entries keep the
 * order in which their comments appeared in the document.
 *
 * <p>If the same path is assigned more than once (duplicate keys in malformed
 * input), the last assignment wins.
 */
public final class DescriptionIndex {

    private static final DescriptionIndex EMPTY = new DescriptionIndex(Map.of());

    private final Map<StructuralPath, String> descriptions;

    private DescriptionIndex(Map<StructuralPath, String> descriptions) {
        this.descriptions = descriptions;
    }

    public static DescriptionIndex empty() {
        return EMPTY;
    }

    /**
     * Creates an index holding a copy of the given entries.
     *
     * @param descriptions path to description entries
     * @return new index
     */
    public static DescriptionIndex of(Map<StructuralPath, String> descriptions) {
        Objects.requireNonNull(descriptions, "descriptions must not be null");
        return new DescriptionIndex(Collections.unmodifiableMap(new LinkedHashMap<>(descriptions)));
    }

    /**
     * Looks up the description attached to a path.
     *
     * @param path structural path of a node
     * @return description, or empty when none was written for the node
     */
    public Optional<String> find(StructuralPath path) {
        return Optional.ofNullable(descriptions.get(path));
    }

    public boolean contains(StructuralPath path) {
        return descriptions.containsKey(path);
    }

    public int size() {
        return descriptions.size();
    }

    public boolean isEmpty() {
        return descriptions.isEmpty();
    }

    /**
     * Returns all entries in document order.
     *
     * @return unmodifiable view of the entries
     */
    public Map<StructuralPath, String> asMap() {
        return descriptions;
    }

    @Override
    public String toString() {
        return "DescriptionIndex" + descriptions;
    }
}
