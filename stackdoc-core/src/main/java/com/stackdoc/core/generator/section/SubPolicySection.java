package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.MarkdownWriter;
import com.stackdoc.core.generator.PolicyGraph;
import com.stackdoc.core.generator.ReportContext;
import com.stackdoc.core.generator.ReportSection;
import com.stackdoc.core.generator.ValueFormatter;
import com.stackdoc.core.model.DanglingReference;
import com.stackdoc.core.model.FieldRow;
import com.stackdoc.core.model.PolicyEntity;
import com.stackdoc.core.model.PolicyKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One subsection per configuration, operator or certificate policy.
 */
public class SubPolicySection implements ReportSection {

    private final PolicyKind kind;

    public SubPolicySection(PolicyKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (kind == PolicyKind.POLICY) {
            throw new IllegalArgumentException("Policies are rendered by PoliciesSection");
        }
    }

    @Override
    public String key() {
        return kind.collectionKey();
    }

    @Override
    public boolean appliesTo(ReportContext context) {
        return context.component().containsKey(kind.collectionKey());
    }

    @Override
    public void render(ReportContext context, MarkdownWriter out) {
        out.heading(2, kind.pluralLabel());
        List<PolicyEntity> entities = context.graph().entities(kind);
        if (entities.isEmpty()) {
            out.paragraph("_No " + kind.pluralLabel().toLowerCase(Locale.ROOT) + " defined._");
            return;
        }
        for (PolicyEntity entity : entities) {
            renderEntity(context, out, entity);
        }
    }

    private void renderEntity(ReportContext context, MarkdownWriter out, PolicyEntity entity) {
        out.heading(3, kind.icon() + " " + kind.singularLabel() + ": " + entity.displayName());
        boolean descriptionUsed = FieldTables.renderEntityDescription(context, out, entity.path(), entity.fields());

        if (!entity.isAnonymous()) {
            if (context.graph().isOrphan(kind, entity.name())) {
                out.paragraph(Warnings.orphanMarker() + " not referenced by any Policy.");
            }
            for (DanglingReference dangling : context.graph().danglingFrom(entity.path())) {
                out.paragraph(Warnings.danglingMarker() + " `" + PolicyGraph.POLICY_REF_KEY + "` names Policy `"
                    + ValueFormatter.escapeCell(dangling.targetName()) + "`, which is not defined in `"
                    + PolicyKind.POLICY.collectionKey() + "`");
            }
        }

        Set<String> excluded = new HashSet<>();
        if (descriptionUsed) {
            excluded.add(FieldTables.descriptionKey());
        }
        List<FieldRow> rows = new ArrayList<>(
            FieldTables.inlineRows(context, entity.fields(), entity.path(), excluded));
        if (!entity.isAnonymous()) {
            rows.add(new FieldRow("Referenced By", referencedBy(context, entity), ""));
        }
        out.fieldTable(rows);

        FieldTables.renderNestedFields(context, out, entity.fields(), entity.path(), excluded, null);
    }

    private String referencedBy(ReportContext context, PolicyEntity entity) {
        List<String> policies = context.graph().referencedBy(kind, entity.name());
        if (policies.isEmpty()) {
            return "_none_";
        }
        return policies.stream()
            .map(name -> "`" + ValueFormatter.escapeCell(name) + "`")
            .collect(Collectors.joining(", "));
    }
}
