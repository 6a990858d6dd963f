package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.MarkdownWriter;
import com.stackdoc.core.generator.ReportContext;
import com.stackdoc.core.generator.ValueFormatter;
import com.stackdoc.core.loader.StructuralPath;
import com.stackdoc.core.loader.TreeNavigator;
import com.stackdoc.core.model.FieldRow;
import com.stackdoc.core.util.NamingConventions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field table and nested value rendering shared by the entity sections.
 *
 * <p>A field is rendered inline (one table row) when it is a scalar, or a list of
 * scalars none of whose items carries its own description. Everything else is
 * rendered as a labelled block below the table.
 */
final class FieldTables {

    private static final String NAME_KEY = "name";
    private static final String DESCRIPTION_KEY = "description";
    private static final String PATH_SEPARATOR = " › ";

    private FieldTables() {
        // Utility class
    }

    static boolean isInline(ReportContext context, Object value, StructuralPath path) {
        if (TreeNavigator.isScalar(value)) {
            return true;
        }
        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                if (!TreeNavigator.isScalar(list.get(i)) || !context.description(path.index(i)).isBlank()) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * Builds one row per inline field, in document order.
     *
     * @param context report context
     * @param fields decoded mapping
     * @param path structural path of the mapping
     * @param excluded keys rendered elsewhere
     * @return rows
     */
    static List<FieldRow> inlineRows(ReportContext context, Map<String, Object> fields,
                                     StructuralPath path, Set<String> excluded) {
        List<FieldRow> rows = new ArrayList<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            String key = entry.getKey();
            StructuralPath fieldPath = path.key(key);
            if (excluded.contains(key) || !isInline(context, entry.getValue(), fieldPath)) {
                continue;
            }
            rows.add(row(context, key, entry.getValue(), fieldPath));
        }
        return rows;
    }

    static FieldRow row(ReportContext context, String key, Object value, StructuralPath fieldPath) {
        return new FieldRow(NamingConventions.humanize(key), ValueFormatter.format(value), context.description(fieldPath));
    }

    /**
     * Renders every non-inline field as a labelled block.
     */
    static void renderNestedFields(ReportContext context, MarkdownWriter out, Map<String, Object> fields,
                                   StructuralPath path, Set<String> excluded, String labelPrefix) {
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            String key = entry.getKey();
            StructuralPath fieldPath = path.key(key);
            if (excluded.contains(key) || isInline(context, entry.getValue(), fieldPath)) {
                continue;
            }
            String label = labelPrefix == null
                ? NamingConventions.humanize(key)
                : labelPrefix + PATH_SEPARATOR + NamingConventions.humanize(key);
            renderNested(context, out, label, entry.getValue(), fieldPath);
        }
    }

    static void renderNested(ReportContext context, MarkdownWriter out, String label, Object value,
                             StructuralPath path) {
        out.paragraph("**" + label + ":**");
        String description = context.description(path);
        if (!description.isBlank()) {
            out.paragraph("_" + ValueFormatter.escapeCell(description) + "_");
        }
        if (value instanceof Map<?, ?>) {
            Map<String, Object> map = TreeNavigator.asMapping(value);
            List<FieldRow> rows = inlineRows(context, map, path, Set.of());
            if (!rows.isEmpty()) {
                out.fieldTable(rows);
            } else if (map.isEmpty()) {
                out.paragraph(ValueFormatter.format(map));
            }
            renderNestedFields(context, out, map, path, Set.of(), label);
        } else {
            renderList(context, out, TreeNavigator.asSequence(value), path);
        }
    }

    private static void renderList(ReportContext context, MarkdownWriter out, List<Object> items,
                                   StructuralPath path) {
        if (items.isEmpty()) {
            out.paragraph(ValueFormatter.format(items));
            return;
        }
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            StructuralPath itemPath = path.index(i);
            String description = context.description(itemPath);
            if (item instanceof Map<?, ?>) {
                Map<String, Object> map = TreeNavigator.asMapping(item);
                out.bullet(withDescription("**" + itemLabel(map, i) + "**", description));
                for (Map.Entry<String, Object> entry : map.entrySet()) {
                    if (NAME_KEY.equals(entry.getKey())) {
                        continue;
                    }
                    String fieldDescription = context.description(itemPath.key(entry.getKey()));
                    out.nestedBullet(withDescription(
                        NamingConventions.humanize(entry.getKey()) + ": " + ValueFormatter.format(entry.getValue()),
                        fieldDescription));
                }
            } else {
                out.bullet(withDescription(ValueFormatter.format(item), description));
            }
        }
        out.blankLine();
    }

    private static String itemLabel(Map<String, Object> map, int index) {
        Object name = map.get(NAME_KEY);
        return name != null && TreeNavigator.isScalar(name)
            ? ValueFormatter.escapeCell(String.valueOf(name))
            : "Item " + (index + 1);
    }

    private static String withDescription(String text, String description) {
        return description.isBlank() ? text : text + " - " + ValueFormatter.escapeCell(description);
    }

    /**
     * Writes the entity blurb and reports whether the {@code description} field was used for it.
     *
     * @return true if the blurb came from the entity's {@code description} field
     */
    static boolean renderEntityDescription(ReportContext context, MarkdownWriter out,
                                           StructuralPath path, Map<String, Object> fields) {
        String description = context.entityDescription(path, fields);
        if (!description.isBlank()) {
            out.quote(description);
        }
        return context.description(path).isBlank() && fields.get(DESCRIPTION_KEY) != null
            && TreeNavigator.isScalar(fields.get(DESCRIPTION_KEY));
    }

    static String descriptionKey() {
        return DESCRIPTION_KEY;
    }
}
