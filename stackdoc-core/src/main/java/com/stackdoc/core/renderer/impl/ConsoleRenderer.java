package com.stackdoc.core.renderer.impl;

import com.stackdoc.core.renderer.GeneratedFile;
import com.stackdoc.core.renderer.GeneratedOutput;
import com.stackdoc.core.renderer.OutputRenderer;
import com.stackdoc.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Objects;

/**
 * Renderer that prints generated files instead of writing them.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colours for file headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - Print a header line before each file (default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    public static final String COLORS_SETTING = "console.colors";
    public static final String HEADERS_SETTING = "console.showHeaders";

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";
    private static final String SEPARATOR = "=".repeat(80);

    private final PrintWriter out;

    public ConsoleRenderer() {
        this(new PrintWriter(System.out, true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.isEnabled(COLORS_SETTING, false);
        boolean showHeaders = context.isEnabled(HEADERS_SETTING, true);
        log.debug("Printing {} files (colors: {}, headers: {})", output.files().size(), useColors, showHeaders);

        for (GeneratedFile file : output.files()) {
            if (showHeaders) {
                String header = "==> " + file.relativePath() + " <==";
                out.println(useColors ? ANSI_BOLD_CYAN + header + ANSI_RESET : header);
            }
            out.print(file.content());
            if (showHeaders) {
                out.println(SEPARATOR);
            }
        }
        out.flush();
    }
}
