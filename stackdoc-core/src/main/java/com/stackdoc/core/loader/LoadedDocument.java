package com.stackdoc.core.loader;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one comment-aware load: the decoded tree plus its description side channel.
 *
 * @param sourceName name used in diagnostics (usually the file path)
 * @param root decoded tree root; mappings preserve document order
 * @param descriptions description index; every path in it is reachable in {@code root}
 * @param unboundDescriptions descriptions that could not be attached, ordered by line
 */
public record LoadedDocument(
    String sourceName,
    Object root,
    DescriptionIndex descriptions,
    List<UnboundDescription> unboundDescriptions
) {
    /**
     * Compact constructor with validation.
     */
    public LoadedDocument {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(descriptions, "descriptions must not be null");
        unboundDescriptions = unboundDescriptions == null ? List.of() : List.copyOf(unboundDescriptions);
    }

    /**
     * Returns the root as a mapping.
     *
     * @return root mapping, or an empty map if the document root is not a mapping
     */
    public Map<String, Object> rootMapping() {
        return TreeNavigator.asMapping(root);
    }

    public Object get(StructuralPath path) {
        return TreeNavigator.get(root, path);
    }
}
