package com.stackdoc.cli;

import com.stackdoc.core.config.StackDocConfig;
import com.stackdoc.core.loader.UnboundDescription;
import com.stackdoc.core.pipeline.DocumentationPipeline;
import com.stackdoc.core.pipeline.ElementValidation;
import com.stackdoc.core.pipeline.PipelineRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to load every values document and report problems without generating.
 *
 * <p>Parse errors fail the command. Unbound descriptions are reported as warnings.
 */
@Command(
    name = "validate",
    description = "Validate values documents and their description comments",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Mixin
    private StackOptions stackOptions;

    @Option(names = {"-e", "--element"}, description = "Validate a single element only")
    private String element;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        StackDocConfig config = stackOptions.resolve(null);

        List<ElementValidation> validations;
        try {
            validations = new DocumentationPipeline().validate(PipelineRequest.from(config, element));
        } catch (IllegalArgumentException | UncheckedIOException e) {
            log.error("Validation failed: {}", e.getMessage());
            err.println("✗ " + e.getMessage());
            return 1;
        }

        int failed = 0;
        for (ElementValidation validation : validations) {
            if (!validation.isValid()) {
                failed++;
                err.println("✗ " + validation.failure().message());
                continue;
            }
            out.printf("✓ %s (%d descriptions)%n", validation.identifier(), validation.boundDescriptions());
            for (UnboundDescription unbound : validation.unboundDescriptions()) {
                out.printf("  ⚠ line %d: %s (%s)%n",
                    unbound.lineNumber(), unbound.text(), unbound.reason().message());
            }
        }

        out.printf("%nValidated %d elements, %d failed%n", validations.size(), failed);
        return failed > 0 ? 1 : 0;
    }
}
