package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.MarkdownWriter;
import com.stackdoc.core.generator.ReportContext;
import com.stackdoc.core.generator.ReportSection;

/**
 * Title, element description and timestamp line.
 */
public class HeaderSection implements ReportSection {

    @Override
    public String key() {
        return "header";
    }

    @Override
    public void render(ReportContext context, MarkdownWriter out) {
        out.heading(1, context.metadata().displayName() + " - Policy Library Documentation");
        String description = context.metadata().description();
        if (!description.isBlank()) {
            out.quote(description);
        }
        out.paragraph(context.timestampLine());
    }
}
