package com.stackdoc;

import ch.qos.logback.classic.Level;
import com.stackdoc.cli.CheckCommand;
import com.stackdoc.cli.GenerateCommand;
import com.stackdoc.cli.ListCommand;
import com.stackdoc.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for StackDoc.
 *
 * <p>StackDoc generates Markdown documentation for policy-library stacks from their
 * values documents and the {@code @description} comments written in them.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate element reports and the index</li>
 *   <li>{@code check} - Verify generated documentation is up to date</li>
 *   <li>{@code list} - List discovered elements</li>
 *   <li>{@code validate} - Report parse errors and unbound descriptions</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * stackdoc generate --stack-dir stack --output-dir docs
 * stackdoc check
 * stackdoc -v generate --element example-policy
 * }</pre>
 */
@Command(
    name = "stackdoc",
    mixinStandardHelpOptions = true,
    version = "StackDoc 1.0.0-SNAPSHOT",
    description = "Documentation generator for policy library stacks",
    subcommands = {
        GenerateCommand.class,
        CheckCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class StackDocCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("StackDoc - Policy Library Documentation Generator");
        System.out.println();
        System.out.println("Use 'stackdoc --help' to see available commands");
        System.out.println("Use 'stackdoc <command> --help' for command-specific help");
    }

    /**
     * Applies the global verbosity options to the Logback root logger.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        StackDocCLI cli = new StackDocCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
