package com.stackdoc.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Lists the visible subdirectories of a directory, sorted by name.
     *
     * <p>Entries whose name starts with a dot are skipped.
     *
     * @param rootPath directory to list
     * @return sorted subdirectories
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> listSubdirectories(Path rootPath) throws IOException {
        try (Stream<Path> paths = Files.list(rootPath)) {
            return paths
                .filter(Files::isDirectory)
                .filter(path -> !path.getFileName().toString().startsWith("."))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .toList();
        }
    }

    /**
     * Reads a file as a string if it exists and is a regular readable file.
     *
     * @param path path to file
     * @return file content, or empty if the file is missing
     * @throws IOException if the file exists but reading fails
     */
    public static Optional<String> readIfPresent(Path path) throws IOException {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(path));
    }

    /**
     * Checks if a path is a directory.
     *
     * @param path path to check
     * @return true if path is a directory
     */
    public static boolean isDirectory(Path path) {
        return Files.isDirectory(path);
    }
}
