package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.MarkdownWriter;
import com.stackdoc.core.generator.ReportContext;
import com.stackdoc.core.generator.ReportSection;
import com.stackdoc.core.model.PolicyKind;
import com.stackdoc.core.model.SummaryStatistics;

/**
 * Resource counts. Always rendered, with zero rows for absent collections.
 */
public class SummarySection implements ReportSection {

    @Override
    public String key() {
        return "summary";
    }

    @Override
    public void render(ReportContext context, MarkdownWriter out) {
        SummaryStatistics stats = context.graph().statistics();
        out.heading(2, "📊 Summary");
        out.tableHeader("Resource Type", "Count", "Enabled");
        for (PolicyKind kind : PolicyKind.values()) {
            out.tableRow(kind.pluralLabel(), String.valueOf(stats.count(kind)), String.valueOf(stats.enabledCount(kind)));
        }
        out.tableRow("PolicySets", String.valueOf(stats.policySets()), String.valueOf(stats.enabledPolicySets()));
        out.tableRow("**Total Resources**", "**" + stats.total() + "**", "**" + stats.enabledTotal() + "**");
        out.blankLine();
    }
}
