package com.stackdoc.cli;

import com.stackdoc.core.config.StackDocConfig;
import com.stackdoc.core.model.ElementMetadata;
import com.stackdoc.core.pipeline.ElementDiscovery;
import com.stackdoc.core.pipeline.ManifestLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the elements of a stack.
 */
@Command(
    name = "list",
    description = "List discovered stack elements",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Mixin
    private StackOptions stackOptions;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        StackDocConfig config = stackOptions.resolve(null);

        List<Path> elements;
        try {
            elements = ElementDiscovery.discover(Paths.get(config.stack().directory()), null);
        } catch (IllegalArgumentException | UncheckedIOException e) {
            log.error("Listing failed: {}", e.getMessage());
            spec.commandLine().getErr().println("✗ " + e.getMessage());
            return 1;
        }

        out.println("Elements in " + config.stack().directory() + ":");
        out.println();
        if (elements.isEmpty()) {
            out.println("  No elements found.");
            return 0;
        }
        for (Path element : elements) {
            ElementMetadata metadata = ManifestLoader.load(element, config.stack().manifestFile());
            boolean hasValues = Files.isRegularFile(element.resolve(config.stack().valuesFile()));
            out.printf("  • %s (%s)%s%n", metadata.identifier(), metadata.displayName(),
                hasValues ? "" : " [no " + config.stack().valuesFile() + "]");
            if (!metadata.description().isBlank()) {
                out.printf("    %s%n", metadata.description());
            }
        }
        return 0;
    }
}
