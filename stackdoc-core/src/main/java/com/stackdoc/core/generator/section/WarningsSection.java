package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.MarkdownWriter;
import com.stackdoc.core.generator.ReportContext;
import com.stackdoc.core.generator.ReportSection;
import com.stackdoc.core.generator.ValueFormatter;
import com.stackdoc.core.model.DanglingReference;
import com.stackdoc.core.model.Orphan;
import com.stackdoc.core.model.PolicyKind;

import java.util.List;

/**
 * Collected reference problems. Rendered only when there is at least one.
 */
public class WarningsSection implements ReportSection {

    @Override
    public String key() {
        return "warnings";
    }

    @Override
    public boolean appliesTo(ReportContext context) {
        return !context.graph().danglingReferences().isEmpty() || !context.graph().orphans().isEmpty();
    }

    @Override
    public void render(ReportContext context, MarkdownWriter out) {
        out.heading(2, "⚠️ Warnings");

        List<DanglingReference> dangling = context.graph().danglingReferences();
        if (!dangling.isEmpty()) {
            out.heading(3, "Dangling References");
            for (DanglingReference reference : dangling) {
                out.bullet(Warnings.describe(reference));
            }
            out.blankLine();
        }

        List<Orphan> orphans = context.graph().orphans();
        for (PolicyKind kind : PolicyKind.subPolicyKinds()) {
            List<Orphan> ofKind = orphans.stream().filter(o -> o.kind() == kind).toList();
            if (ofKind.isEmpty()) {
                continue;
            }
            out.heading(3, "Orphaned " + kind.pluralLabel());
            out.paragraph("Not referenced by any Policy:");
            for (Orphan orphan : ofKind) {
                out.bullet("`" + ValueFormatter.escapeCell(orphan.name()) + "`");
            }
            out.blankLine();
        }
    }
}
