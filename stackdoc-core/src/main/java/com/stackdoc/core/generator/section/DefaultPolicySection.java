package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.MarkdownWriter;
import com.stackdoc.core.generator.ReportContext;
import com.stackdoc.core.generator.ReportSection;
import com.stackdoc.core.loader.StructuralPath;
import com.stackdoc.core.loader.TreeNavigator;
import com.stackdoc.core.model.FieldRow;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compliance defaults that Policies inherit.
 */
public class DefaultPolicySection implements ReportSection {

    @Override
    public String key() {
        return "default-policy";
    }

    @Override
    public boolean appliesTo(ReportContext context) {
        return context.component().get(ComponentConfigurationSection.DEFAULT_POLICY_KEY) instanceof Map<?, ?>;
    }

    @Override
    public void render(ReportContext context, MarkdownWriter out) {
        StructuralPath path = context.componentPath().key(ComponentConfigurationSection.DEFAULT_POLICY_KEY);
        Map<String, Object> defaults = TreeNavigator.asMapping(
            context.component().get(ComponentConfigurationSection.DEFAULT_POLICY_KEY));

        out.heading(2, "Default Policy Values");
        String description = context.description(path);
        if (!description.isBlank()) {
            out.paragraph(description);
        }
        List<FieldRow> rows = FieldTables.inlineRows(context, defaults, path, Set.of());
        if (!rows.isEmpty()) {
            out.fieldTable(rows);
        }
        FieldTables.renderNestedFields(context, out, defaults, path, Set.of(), null);
    }
}
