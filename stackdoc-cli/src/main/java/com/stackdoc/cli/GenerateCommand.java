package com.stackdoc.cli;

import com.stackdoc.core.config.StackDocConfig;
import com.stackdoc.core.generator.ElementReport;
import com.stackdoc.core.pipeline.DocumentationPipeline;
import com.stackdoc.core.pipeline.ElementFailure;
import com.stackdoc.core.pipeline.PipelineRequest;
import com.stackdoc.core.pipeline.PipelineResult;
import com.stackdoc.core.renderer.GeneratedFile;
import com.stackdoc.core.renderer.OutputRenderer;
import com.stackdoc.core.renderer.RenderContext;
import com.stackdoc.core.renderer.impl.ConsoleRenderer;
import com.stackdoc.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to generate element reports and the index.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Generate all elements into docs/
 * stackdoc generate
 *
 * # Generate one element and print it instead of writing
 * stackdoc generate --element example-policy --stdout
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate documentation for all stack elements",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private StackOptions stackOptions;

    @Option(names = {"-o", "--output-dir"}, description = "Output directory (default: docs)")
    private Path outputDir;

    @Option(names = {"-e", "--element"}, description = "Generate documentation for a single element only")
    private String element;

    @Option(names = "--stdout", description = "Print the generated files instead of writing them")
    private boolean stdout;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter progress = stdout ? spec.commandLine().getErr() : out;
        PrintWriter err = spec.commandLine().getErr();

        StackDocConfig config = stackOptions.resolve(outputDir);
        PipelineResult result;
        try {
            result = new DocumentationPipeline().run(PipelineRequest.from(config, element));
        } catch (IllegalArgumentException | UncheckedIOException e) {
            log.error("Generation failed: {}", e.getMessage());
            err.println("✗ " + e.getMessage());
            return 1;
        }

        for (ElementReport report : result.reports()) {
            progress.println("✓ " + report.identifier());
        }
        for (String skipped : result.skipped()) {
            progress.println("⚠ " + skipped + ": no " + config.stack().valuesFile() + " found, skipped");
        }
        for (ElementFailure failure : result.failures()) {
            err.println("✗ " + failure.message());
        }

        if (result.discovered() == 0) {
            err.println("✗ No elements found in " + config.stack().directory());
            return 1;
        }

        OutputRenderer renderer = stdout ? new ConsoleRenderer(out) : new FileSystemRenderer();
        log.debug("Rendering {} files with the {} renderer", result.output().files().size(), renderer.getId());
        try {
            renderer.render(result.output(), new RenderContext(config.output().directory(), Map.of()));
        } catch (IllegalStateException e) {
            log.error("Renderer {} failed", renderer.getId(), e);
            err.println("✗ " + renderer.getId() + ": " + e.getMessage());
            return 1;
        }

        if (!stdout) {
            int reports = result.output().filesOf(GeneratedFile.Kind.ELEMENT_REPORT).size();
            boolean index = !result.output().filesOf(GeneratedFile.Kind.INDEX).isEmpty();
            progress.printf("Generated %d element report(s)%s in '%s'%n",
                reports, index ? " and the index" : "", config.output().directory());
        }
        return result.exitCode();
    }
}
