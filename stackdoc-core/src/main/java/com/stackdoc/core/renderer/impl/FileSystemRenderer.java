package com.stackdoc.core.renderer.impl;

import com.stackdoc.core.renderer.GeneratedFile;
import com.stackdoc.core.renderer.GeneratedOutput;
import com.stackdoc.core.renderer.OutputRenderer;
import com.stackdoc.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes generated files under the output directory.
 *
 * <p>Creates missing directories and overwrites existing files. Paths that would
 * resolve outside the output directory are rejected.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        log.info("Writing {} files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("Refusing to write outside the output directory: " + file.relativePath());
        }

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
