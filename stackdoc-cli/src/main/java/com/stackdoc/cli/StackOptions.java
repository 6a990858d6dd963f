package com.stackdoc.cli;

import com.stackdoc.core.config.ConfigLoader;
import com.stackdoc.core.config.StackDocConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options shared by every subcommand. Values given on the command line override the
 * configuration file.
 */
public class StackOptions {

    @Option(names = {"-s", "--stack-dir"}, description = "Directory containing stack elements (default: stack)")
    Path stackDir;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: stackdoc.yaml)")
    Path configFile;

    /**
     * Loads the configuration and applies command-line overrides.
     *
     * @param outputDir output directory override, or {@code null}
     * @return effective configuration
     */
    StackDocConfig resolve(Path outputDir) {
        Path path = configFile != null ? configFile : Paths.get(StackDocConfig.DEFAULT_FILE_NAME);
        StackDocConfig config = ConfigLoader.load(path).withDefaults();

        StackDocConfig.StackSettings stack = config.stack();
        if (stackDir != null) {
            stack = new StackDocConfig.StackSettings(stackDir.toString(), stack.valuesFile(), stack.manifestFile());
        }
        StackDocConfig.OutputSettings output = config.output();
        if (outputDir != null) {
            output = new StackDocConfig.OutputSettings(outputDir.toString(), output.indexFile());
        }
        return new StackDocConfig(stack, output);
    }
}
