package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.MarkdownWriter;
import com.stackdoc.core.generator.PolicyGraph;
import com.stackdoc.core.generator.ReportContext;
import com.stackdoc.core.generator.ReportSection;
import com.stackdoc.core.generator.ValueFormatter;
import com.stackdoc.core.model.FieldRow;
import com.stackdoc.core.model.PolicyKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Component row plus every top-level setting of the component mapping.
 *
 * <p>Collections documented by later sections are left out.
 */
public class ComponentConfigurationSection implements ReportSection {

    static final String DEFAULT_POLICY_KEY = "defaultPolicy";

    private static final Set<String> DOCUMENTED_ELSEWHERE;

    static {
        Set<String> keys = new HashSet<>();
        for (PolicyKind kind : PolicyKind.values()) {
            keys.add(kind.collectionKey());
        }
        keys.add(PolicyGraph.POLICY_SETS_KEY);
        keys.add(DEFAULT_POLICY_KEY);
        DOCUMENTED_ELSEWHERE = Set.copyOf(keys);
    }

    @Override
    public String key() {
        return "component-configuration";
    }

    @Override
    public void render(ReportContext context, MarkdownWriter out) {
        out.heading(2, "Component Configuration");

        List<FieldRow> rows = new ArrayList<>();
        String component = context.componentRoot().located()
            ? ValueFormatter.format(context.componentRoot().componentKey())
            : "_document root_";
        rows.add(new FieldRow("Component", component, context.description(context.componentPath())));
        rows.addAll(FieldTables.inlineRows(context, context.component(), context.componentPath(), DOCUMENTED_ELSEWHERE));
        out.fieldTable(rows);

        FieldTables.renderNestedFields(context, out, context.component(), context.componentPath(),
            DOCUMENTED_ELSEWHERE, null);
    }
}
