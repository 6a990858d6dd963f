package com.stackdoc.core.generator;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The single timestamp line written into every generated file.
 *
 * <p>The timestamp always occupies a line of its own, so reproducibility checks can
 * ignore exactly that line.
 */
public final class GenerationTimestamp {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern LINE = Pattern.compile(
        "^\\*Generated: \\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\*$", Pattern.MULTILINE);
    private static final String PLACEHOLDER = "*Generated: TIMESTAMP*";

    private GenerationTimestamp() {
        // Utility class
    }

    /**
     * Renders the timestamp line for the current time of a clock.
     *
     * @param clock clock to read
     * @return line such as {@code *Generated: 2024-05-01 09:30:00*}
     */
    public static String line(Clock clock) {
        return "*Generated: " + LocalDateTime.now(clock).format(FORMAT) + "*";
    }

    /**
     * Replaces every timestamp line with a fixed placeholder.
     *
     * @param content generated file content
     * @return content with timestamps normalized
     */
    public static String normalize(String content) {
        return LINE.matcher(content).replaceAll(Matcher.quoteReplacement(PLACEHOLDER));
    }
}
