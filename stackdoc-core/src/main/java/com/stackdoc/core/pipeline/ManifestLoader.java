package com.stackdoc.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.stackdoc.core.model.ElementMetadata;
import com.stackdoc.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads element metadata from the element manifest ({@code Chart.yaml} by default).
 *
 * <p>Never fails: a missing, unreadable or incomplete manifest falls back to the
 * directory name and an empty description.
 */
public final class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ManifestLoader() {
        // Utility class
    }

    public static ElementMetadata load(Path elementDir, String manifestFile) {
        String identifier = elementDir.getFileName().toString();
        Path manifestPath = elementDir.resolve(manifestFile);

        Optional<String> raw;
        try {
            raw = FileUtils.readIfPresent(manifestPath);
        } catch (IOException e) {
            log.warn("Cannot read manifest {}: {}. Using directory name.", manifestPath, e.getMessage());
            return ElementMetadata.fallback(identifier);
        }
        if (raw.isEmpty()) {
            log.warn("No manifest at {}. Using directory name.", manifestPath);
            return ElementMetadata.fallback(identifier);
        }

        try {
            JsonNode root = YAML_MAPPER.readTree(raw.get());
            String name = textOf(root, "name");
            String description = textOf(root, "description");
            if (name == null) {
                log.warn("Manifest {} has no name. Using directory name.", manifestPath);
            }
            return new ElementMetadata(identifier, name, description);
        } catch (IOException e) {
            log.warn("Invalid manifest {}: {}. Using directory name.", manifestPath, e.getMessage());
            return ElementMetadata.fallback(identifier);
        }
    }

    private static String textOf(JsonNode root, String field) {
        if (root == null || !root.isObject()) {
            return null;
        }
        JsonNode node = root.get(field);
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}
