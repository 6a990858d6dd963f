package com.stackdoc.core.pipeline;

import com.stackdoc.core.generator.GenerationTimestamp;
import com.stackdoc.core.renderer.GeneratedFile;
import com.stackdoc.core.renderer.GeneratedOutput;
import com.stackdoc.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares freshly generated files with those on disk, ignoring timestamp lines.
 */
public class DocumentationChecker {

    private static final Logger log = LoggerFactory.getLogger(DocumentationChecker.class);

    /**
     * State of one expected file.
     */
    public enum Status {
        MISSING,
        OUTDATED,
        CURRENT
    }

    /**
     * @param relativePath path relative to the output directory
     * @param kind what the file documents
     * @param status comparison result
     */
    public record FileStatus(String relativePath, GeneratedFile.Kind kind, Status status) {
        public FileStatus {
            Objects.requireNonNull(relativePath, "relativePath must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(status, "status must not be null");
        }

        public boolean isIndex() {
            return kind == GeneratedFile.Kind.INDEX;
        }
    }

    /**
     * @param files status of every expected file, in output order
     */
    public record CheckResult(List<FileStatus> files) {
        public CheckResult {
            files = List.copyOf(files);
        }

        public boolean isUpToDate() {
            return files.stream().allMatch(f -> f.status() == Status.CURRENT);
        }

        public List<FileStatus> stale() {
            return files.stream().filter(f -> f.status() != Status.CURRENT).toList();
        }
    }

    public CheckResult check(GeneratedOutput expected, Path outputDir) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(outputDir, "outputDir must not be null");

        List<FileStatus> statuses = new ArrayList<>();
        for (GeneratedFile file : expected.files()) {
            Status status = compare(file, outputDir.resolve(file.relativePath()));
            log.debug("{}: {}", file.relativePath(), status);
            statuses.add(new FileStatus(file.relativePath(), file.kind(), status));
        }
        return new CheckResult(statuses);
    }

    private Status compare(GeneratedFile file, Path target) {
        Optional<String> existing;
        try {
            existing = FileUtils.readIfPresent(target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + target, e);
        }
        if (existing.isEmpty()) {
            return Status.MISSING;
        }
        String current = GenerationTimestamp.normalize(existing.get().replace("\r\n", "\n"));
        String fresh = GenerationTimestamp.normalize(file.content());
        return current.equals(fresh) ? Status.CURRENT : Status.OUTDATED;
    }
}
