package com.stackdoc.core.generator;

/**
 * One fixed part of an element report.
 *
 * <p>The engine walks its sections in order and renders those that apply.
 */
public interface ReportSection {

    /**
     * Short name used in log output.
     *
     * @return section key
     */
    String key();

    /**
     * Checks whether the element carries the data this section documents.
     *
     * @param context report context
     * @return true to render the section
     */
    default boolean appliesTo(ReportContext context) {
        return true;
    }

    void render(ReportContext context, MarkdownWriter out);
}
