package com.stackdoc.core.renderer;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Files of one documentation run, each relative path at most once.
 *
 * @param files generated files, element reports first and the index last
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
        Set<String> seen = new HashSet<>();
        for (GeneratedFile file : files) {
            if (!seen.add(file.relativePath())) {
                throw new IllegalArgumentException("Duplicate output file: " + file.relativePath());
            }
        }
    }

    public List<GeneratedFile> filesOf(GeneratedFile.Kind kind) {
        return files.stream().filter(f -> f.kind() == kind).toList();
    }

    public Optional<GeneratedFile> find(String relativePath) {
        return files.stream().filter(f -> f.relativePath().equals(relativePath)).findFirst();
    }
}
