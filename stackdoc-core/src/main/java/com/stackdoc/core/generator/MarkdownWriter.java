package com.stackdoc.core.generator;

import com.stackdoc.core.model.FieldRow;

import java.util.List;

/**
 * Append-only Markdown builder used by report sections.
 */
public final class MarkdownWriter {

    private static final String PIPE = "|";
    private static final String SPACE = " ";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String DIVIDER_CELL = "--------|";

    /** Column headers of the three-column field table. */
    public static final List<String> FIELD_HEADERS = List.of("Parameter", "Value", "Description");

    private final StringBuilder sb = new StringBuilder();

    public MarkdownWriter heading(int level, String title) {
        int clamped = Math.max(1, Math.min(6, level));
        sb.append("#".repeat(clamped)).append(SPACE).append(title).append(DOUBLE_NEWLINE);
        return this;
    }

    public MarkdownWriter paragraph(String text) {
        sb.append(text).append(DOUBLE_NEWLINE);
        return this;
    }

    public MarkdownWriter quote(String text) {
        sb.append("> ").append(ValueFormatter.escapeCell(text)).append(DOUBLE_NEWLINE);
        return this;
    }

    public MarkdownWriter line(String text) {
        sb.append(text).append(NEWLINE);
        return this;
    }

    public MarkdownWriter bullet(String text) {
        sb.append("- ").append(text).append(NEWLINE);
        return this;
    }

    public MarkdownWriter nestedBullet(String text) {
        sb.append("  - ").append(text).append(NEWLINE);
        return this;
    }

    public MarkdownWriter blankLine() {
        sb.append(NEWLINE);
        return this;
    }

    public MarkdownWriter rule() {
        sb.append("---").append(DOUBLE_NEWLINE);
        return this;
    }

    /**
     * Writes a three-column field table followed by a blank line.
     *
     * @param rows rows to write
     * @return this writer
     */
    public MarkdownWriter fieldTable(List<FieldRow> rows) {
        tableHeader(FIELD_HEADERS.toArray(String[]::new));
        for (FieldRow row : rows) {
            tableRow(row.label(), row.value(), ValueFormatter.escapeCell(row.description()));
        }
        sb.append(NEWLINE);
        return this;
    }

    public MarkdownWriter tableHeader(String... columns) {
        tableRow(columns);
        sb.append(PIPE);
        for (int i = 0; i < columns.length; i++) {
            sb.append(DIVIDER_CELL);
        }
        sb.append(NEWLINE);
        return this;
    }

    public MarkdownWriter tableRow(String... columns) {
        sb.append(PIPE);
        for (String col : columns) {
            sb.append(SPACE).append(col).append(SPACE).append(PIPE);
        }
        sb.append(NEWLINE);
        return this;
    }

    /**
     * Returns the document with trailing blank lines collapsed into one final newline.
     *
     * @return Markdown text
     */
    @Override
    public String toString() {
        return sb.toString().stripTrailing() + NEWLINE;
    }
}
