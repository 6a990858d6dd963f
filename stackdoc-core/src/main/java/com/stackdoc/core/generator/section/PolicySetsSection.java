package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.MarkdownWriter;
import com.stackdoc.core.generator.PolicyGraph;
import com.stackdoc.core.generator.ReportContext;
import com.stackdoc.core.generator.ReportSection;
import com.stackdoc.core.generator.ValueFormatter;
import com.stackdoc.core.model.FieldRow;
import com.stackdoc.core.model.PolicyKind;
import com.stackdoc.core.model.PolicySet;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Policy sets and the Policies they group.
 */
public class PolicySetsSection implements ReportSection {

    private static final String POLICIES_KEY = "policies";

    @Override
    public String key() {
        return PolicyGraph.POLICY_SETS_KEY;
    }

    @Override
    public boolean appliesTo(ReportContext context) {
        return context.component().containsKey(PolicyGraph.POLICY_SETS_KEY);
    }

    @Override
    public void render(ReportContext context, MarkdownWriter out) {
        out.heading(2, "PolicySets");
        List<PolicySet> sets = context.graph().policySets();
        if (sets.isEmpty()) {
            out.paragraph("_No policy sets defined._");
            return;
        }
        for (PolicySet set : sets) {
            renderSet(context, out, set);
        }
    }

    private void renderSet(ReportContext context, MarkdownWriter out, PolicySet set) {
        out.heading(3, "📦 PolicySet: " + set.displayName());
        boolean descriptionUsed = FieldTables.renderEntityDescription(context, out, set.path(), set.fields());

        Set<String> excluded = new HashSet<>(Set.of(POLICIES_KEY));
        if (descriptionUsed) {
            excluded.add(FieldTables.descriptionKey());
        }
        List<FieldRow> rows = FieldTables.inlineRows(context, set.fields(), set.path(), excluded);
        if (!rows.isEmpty()) {
            out.fieldTable(rows);
        }

        List<String> names = set.policyNames();
        if (!names.isEmpty()) {
            out.paragraph("**Included Policies:**");
            String listDescription = context.description(set.path().key(POLICIES_KEY));
            if (!listDescription.isBlank()) {
                out.paragraph("_" + ValueFormatter.escapeCell(listDescription) + "_");
            }
            for (String name : names) {
                String item = "`" + ValueFormatter.escapeCell(name) + "`";
                if (context.graph().find(PolicyKind.POLICY, name).isEmpty()) {
                    item += " " + Warnings.danglingMarker() + " not defined in `" + PolicyKind.POLICY.collectionKey() + "`";
                }
                out.bullet(item);
            }
            out.blankLine();
        }

        FieldTables.renderNestedFields(context, out, set.fields(), set.path(), excluded, null);
    }
}
