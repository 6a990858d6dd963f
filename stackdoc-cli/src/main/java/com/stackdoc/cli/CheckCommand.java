package com.stackdoc.cli;

import com.stackdoc.core.config.StackDocConfig;
import com.stackdoc.core.pipeline.DocumentationChecker;
import com.stackdoc.core.pipeline.DocumentationChecker.CheckResult;
import com.stackdoc.core.pipeline.DocumentationChecker.FileStatus;
import com.stackdoc.core.pipeline.DocumentationPipeline;
import com.stackdoc.core.pipeline.ElementFailure;
import com.stackdoc.core.pipeline.PipelineRequest;
import com.stackdoc.core.pipeline.PipelineResult;
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
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to verify that generated documentation matches the sources.
 *
 * <p>Regenerates everything in memory and compares it with the output directory,
 * ignoring timestamp lines. Intended for CI.
 */
@Command(
    name = "check",
    description = "Check whether generated documentation is up to date",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Mixin
    private StackOptions stackOptions;

    @Option(names = {"-o", "--output-dir"}, description = "Output directory to check (default: docs)")
    private Path outputDir;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        StackDocConfig config = stackOptions.resolve(outputDir);
        PipelineResult result;
        CheckResult check;
        try {
            result = new DocumentationPipeline().run(PipelineRequest.from(config, null));
            check = new DocumentationChecker().check(result.output(), Paths.get(config.output().directory()));
        } catch (IllegalArgumentException | UncheckedIOException e) {
            log.error("Check failed: {}", e.getMessage());
            err.println("✗ " + e.getMessage());
            return 1;
        }

        for (ElementFailure failure : result.failures()) {
            err.println("✗ " + failure.message());
        }
        for (FileStatus file : check.files()) {
            String name = file.relativePath() + (file.isIndex() ? " (index)" : "");
            switch (file.status()) {
                case CURRENT -> out.println("✓ Current: " + name);
                case MISSING -> out.println("✗ Missing: " + name);
                case OUTDATED -> out.println("✗ Outdated: " + name);
            }
        }

        out.println();
        if (check.isUpToDate() && result.exitCode() == 0) {
            out.println("📚 Documentation Status: UP TO DATE");
            return 0;
        }
        out.println("📚 Documentation Status: OUTDATED");
        out.println("Run 'stackdoc generate' to update documentation");
        return 1;
    }
}
