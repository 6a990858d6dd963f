package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.MarkdownWriter;
import com.stackdoc.core.generator.ReportContext;
import com.stackdoc.core.generator.ReportSection;
import com.stackdoc.core.generator.ValueFormatter;
import com.stackdoc.core.loader.StructuralPath;
import com.stackdoc.core.loader.TreeNavigator;
import com.stackdoc.core.model.DanglingReference;
import com.stackdoc.core.model.FieldRow;
import com.stackdoc.core.model.PolicyEntity;
import com.stackdoc.core.model.PolicyKind;
import com.stackdoc.core.model.PolicyReference;
import com.stackdoc.core.util.NamingConventions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One subsection per Policy with its compliance metadata and associated sub-policies.
 */
public class PoliciesSection implements ReportSection {

    static final List<String> COMPLIANCE_KEYS = List.of("categories", "controls", "standards");

    private static final String DEFAULT_MARKER = " (default)";

    @Override
    public String key() {
        return "policies";
    }

    @Override
    public boolean appliesTo(ReportContext context) {
        return context.component().containsKey(PolicyKind.POLICY.collectionKey());
    }

    @Override
    public void render(ReportContext context, MarkdownWriter out) {
        out.heading(2, PolicyKind.POLICY.pluralLabel());
        List<PolicyEntity> policies = context.graph().entities(PolicyKind.POLICY);
        if (policies.isEmpty()) {
            out.paragraph("_No policies defined._");
            return;
        }
        for (PolicyEntity policy : policies) {
            renderPolicy(context, out, policy);
        }
    }

    private void renderPolicy(ReportContext context, MarkdownWriter out, PolicyEntity policy) {
        PolicyKind kind = PolicyKind.POLICY;
        out.heading(3, kind.icon() + " " + kind.singularLabel() + ": " + policy.displayName());
        boolean descriptionUsed = FieldTables.renderEntityDescription(context, out, policy.path(), policy.fields());

        Set<String> excluded = new HashSet<>(COMPLIANCE_KEYS);
        for (PolicyKind subKind : PolicyKind.subPolicyKinds()) {
            excluded.add(subKind.collectionKey());
        }
        if (descriptionUsed) {
            excluded.add(FieldTables.descriptionKey());
        }
        List<FieldRow> rows = FieldTables.inlineRows(context, policy.fields(), policy.path(), excluded);
        if (!rows.isEmpty()) {
            out.fieldTable(rows);
        }

        List<FieldRow> compliance = complianceRows(context, policy);
        if (!compliance.isEmpty()) {
            out.heading(4, "Compliance Metadata");
            out.fieldTable(compliance);
        }

        FieldTables.renderNestedFields(context, out, policy.fields(), policy.path(), excluded, null);

        if (!policy.isAnonymous()) {
            renderAssociations(context, out, policy);
        }
    }

    private List<FieldRow> complianceRows(ReportContext context, PolicyEntity policy) {
        StructuralPath defaultsPath = context.componentPath().key(ComponentConfigurationSection.DEFAULT_POLICY_KEY);
        Map<String, Object> defaults = TreeNavigator.asMapping(
            context.component().get(ComponentConfigurationSection.DEFAULT_POLICY_KEY));

        List<FieldRow> rows = new ArrayList<>();
        for (String key : COMPLIANCE_KEYS) {
            Object own = policy.fields().get(key);
            String label = NamingConventions.humanize(key);
            if (ValueFormatter.isPresent(own)) {
                rows.add(new FieldRow(label, ValueFormatter.format(own), context.description(policy.path().key(key))));
            } else if (ValueFormatter.isPresent(defaults.get(key))) {
                rows.add(new FieldRow(label, ValueFormatter.format(defaults.get(key)) + DEFAULT_MARKER,
                    context.description(defaultsPath.key(key))));
            }
        }
        return rows;
    }

    private void renderAssociations(ReportContext context, MarkdownWriter out, PolicyEntity policy) {
        List<PolicyReference> references = context.graph().referencesFrom(policy);
        List<DanglingReference> dangling = context.graph().danglingFrom(policy.path());
        if (references.isEmpty() && dangling.isEmpty()) {
            return;
        }
        out.heading(4, "Associated Sub-Policies");
        for (PolicyReference reference : references) {
            context.graph().find(reference.targetKind(), reference.targetName())
                .ifPresent(target -> renderAssociation(context, out, reference, target));
        }
        for (DanglingReference reference : dangling) {
            out.bullet(Warnings.danglingMarker() + " " + Warnings.kindLabel(reference.targetKind())
                + " `" + ValueFormatter.escapeCell(reference.targetName()) + "` is not defined in `"
                + reference.targetKind().collectionKey() + "`");
        }
        if (!dangling.isEmpty()) {
            out.blankLine();
        }
    }

    private void renderAssociation(ReportContext context, MarkdownWriter out, PolicyReference reference,
                                   PolicyEntity target) {
        PolicyKind kind = target.kind();
        out.heading(5, kind.icon() + " " + kind.singularLabel() + ": " + target.displayName());
        String description = context.entityDescription(target.path(), target.fields());
        if (!description.isBlank()) {
            out.quote(description);
        }
        String linkedVia = reference.origin() == PolicyReference.Origin.DECLARED
            ? "`" + kind.collectionKey() + "`"
            : "`policyRef`";
        out.fieldTable(List.of(
            new FieldRow("Enabled", ValueFormatter.format(target.fields().get("enabled")), ""),
            new FieldRow("Linked Via", linkedVia, "")));
    }
}
