package com.stackdoc.core.generator;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats decoded values for Markdown table cells.
 */
public final class ValueFormatter {

    /** Placeholder for absent and null values. */
    public static final String NOT_SET = "_not set_";

    private static final String EMPTY = "_empty_";
    private static final String CODE = "`";

    private ValueFormatter() {
        // Utility class
    }

    /**
     * Formats a value as a table cell.
     *
     * <ul>
     *   <li>{@code null} renders as {@value #NOT_SET}</li>
     *   <li>Booleans and other scalars render as code literals</li>
     *   <li>Lists of scalars render as a comma-separated list of literals</li>
     * </ul>
     *
     * @param value decoded value
     * @return Markdown cell text
     */
    public static String format(Object value) {
        if (value == null) {
            return NOT_SET;
        }
        if (value instanceof List<?> list) {
            if (list.isEmpty()) {
                return EMPTY;
            }
            return list.stream().map(ValueFormatter::format).collect(Collectors.joining(", "));
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty() ? EMPTY : "_" + map.size() + " entries_";
        }
        return CODE + escapeCell(literal(value)) + CODE;
    }

    /**
     * Returns the canonical literal text of a scalar.
     *
     * @param value decoded scalar
     * @return literal text ({@code true}/{@code false} for booleans)
     */
    public static String literal(Object value) {
        if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        return String.valueOf(value);
    }

    /**
     * Escapes text so it stays inside one table cell.
     *
     * @param text raw text
     * @return text with pipes escaped and line breaks flattened
     */
    public static String escapeCell(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\r", "").replace("\n", " ");
    }

    /**
     * Checks whether a value counts as set. Empty strings and empty collections do not.
     *
     * @param value decoded value
     * @return true if the value carries content
     */
    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String s) {
            return !s.isBlank();
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }
}
