package com.stackdoc.core.pipeline;

import com.stackdoc.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Lists the element directories of a stack root.
 */
public final class ElementDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ElementDiscovery.class);

    private ElementDiscovery() {
        // Utility class
    }

    /**
     * Discovers element directories in lexicographic order, skipping hidden ones.
     *
     * @param stackRoot stack root directory
     * @param elementFilter single element to restrict to, or {@code null} for all
     * @return element directories
     * @throws IllegalArgumentException if the stack root or the filtered element does not exist
     */
    public static List<Path> discover(Path stackRoot, String elementFilter) {
        Objects.requireNonNull(stackRoot, "stackRoot must not be null");
        if (!FileUtils.isDirectory(stackRoot)) {
            throw new IllegalArgumentException("Stack directory '" + stackRoot + "' does not exist");
        }

        if (elementFilter != null) {
            Path element = stackRoot.resolve(elementFilter);
            if (elementFilter.isBlank() || elementFilter.startsWith(".") || !FileUtils.isDirectory(element)) {
                throw new IllegalArgumentException("Element '" + elementFilter + "' not found in " + stackRoot);
            }
            return List.of(element);
        }

        try {
            List<Path> elements = FileUtils.listSubdirectories(stackRoot);
            log.debug("Discovered {} elements in {}", elements.size(), stackRoot);
            return elements;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list stack directory " + stackRoot, e);
        }
    }
}
