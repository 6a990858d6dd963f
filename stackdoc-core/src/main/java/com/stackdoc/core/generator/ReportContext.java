package com.stackdoc.core.generator;

import com.stackdoc.core.loader.LoadedDocument;
import com.stackdoc.core.loader.StructuralPath;
import com.stackdoc.core.loader.TreeNavigator;
import com.stackdoc.core.model.ElementMetadata;

import java.util.Map;
import java.util.Objects;

/**
 * Everything a {@link ReportSection} may read while rendering one element.
 *
 * @param metadata element metadata from the manifest
 * @param document loaded values document
 * @param componentRoot located component mapping
 * @param graph resolved policy graph of the component
 * @param timestampLine timestamp line for this run
 */
public record ReportContext(
    ElementMetadata metadata,
    LoadedDocument document,
    ComponentLocator.ComponentRoot componentRoot,
    PolicyGraph graph,
    String timestampLine
) {
    private static final String DESCRIPTION_KEY = "description";

    /**
     * Compact constructor with validation.
     */
    public ReportContext {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(componentRoot, "componentRoot must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(timestampLine, "timestampLine must not be null");
    }

    public Map<String, Object> component() {
        return componentRoot.component();
    }

    public StructuralPath componentPath() {
        return componentRoot.path();
    }

    /**
     * Description bound at an exact structural path.
     *
     * @param path structural path
     * @return description text, or an empty string
     */
    public String description(StructuralPath path) {
        return document.descriptions().find(path).orElse("");
    }

    /**
     * Description of an entity: the comment bound to the entity itself, then its
     * {@code description} field.
     *
     * @param path structural path of the entity
     * @param fields decoded entity mapping
     * @return description text, or an empty string
     */
    public String entityDescription(StructuralPath path, Map<String, Object> fields) {
        String bound = description(path);
        if (!bound.isBlank()) {
            return bound;
        }
        Object field = fields.get(DESCRIPTION_KEY);
        return field != null && TreeNavigator.isScalar(field) ? String.valueOf(field) : "";
    }
}
