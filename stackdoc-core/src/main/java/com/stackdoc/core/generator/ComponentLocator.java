package com.stackdoc.core.generator;

import com.stackdoc.core.loader.LoadedDocument;
import com.stackdoc.core.loader.StructuralPath;
import com.stackdoc.core.loader.TreeNavigator;
import com.stackdoc.core.util.NamingConventions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Finds the component mapping of an element inside its values document.
 *
 * <p>Lookup order is {@code stack.<camelName>}, then a top-level {@code <camelName>},
 * then the document root itself.
 */
public final class ComponentLocator {

    private static final Logger log = LoggerFactory.getLogger(ComponentLocator.class);
    private static final String STACK_KEY = "stack";

    private ComponentLocator() {
        // Utility class
    }

    /**
     * Located component mapping.
     *
     * @param componentKey camel-case component key derived from the element identifier
     * @param path structural path of the component mapping
     * @param component decoded component mapping
     * @param located false when the lookup fell back to the document root
     */
    public record ComponentRoot(
        String componentKey,
        StructuralPath path,
        Map<String, Object> component,
        boolean located
    ) {
        public ComponentRoot {
            Objects.requireNonNull(componentKey, "componentKey must not be null");
            Objects.requireNonNull(path, "path must not be null");
            component = component == null ? Map.of() : component;
        }
    }

    public static ComponentRoot locate(String identifier, LoadedDocument document) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(document, "document must not be null");

        String key = NamingConventions.toCamelCase(identifier);
        StructuralPath stackPath = StructuralPath.of(STACK_KEY, key);
        if (document.get(stackPath) instanceof Map<?, ?>) {
            return new ComponentRoot(key, stackPath, TreeNavigator.asMapping(document.get(stackPath)), true);
        }
        StructuralPath topLevel = StructuralPath.of(key);
        if (document.get(topLevel) instanceof Map<?, ?>) {
            log.debug("Component '{}' found at top level of {}", key, document.sourceName());
            return new ComponentRoot(key, topLevel, TreeNavigator.asMapping(document.get(topLevel)), true);
        }
        log.warn("No component '{}' found under '{}' in {}, using the document root",
            key, STACK_KEY, document.sourceName());
        return new ComponentRoot(key, StructuralPath.root(), document.rootMapping(), false);
    }
}
