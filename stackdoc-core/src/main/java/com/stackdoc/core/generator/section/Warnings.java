package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.ValueFormatter;
import com.stackdoc.core.model.DanglingReference;
import com.stackdoc.core.model.PolicyKind;

import java.util.Locale;

/**
 * Inline warning markers.
 */
final class Warnings {

    private static final String DANGLING = "⚠️ Dangling reference:";
    private static final String ORPHANED = "⚠️ **Orphaned:**";

    private Warnings() {
        // Utility class
    }

    static String danglingMarker() {
        return DANGLING;
    }

    static String orphanMarker() {
        return ORPHANED;
    }

    static String kindLabel(PolicyKind kind) {
        return kind == PolicyKind.POLICY
            ? "policy"
            : kind.singularLabel().toLowerCase(Locale.ROOT) + " policy";
    }

    static String describe(DanglingReference reference) {
        return reference.sourceLabel() + " `" + ValueFormatter.escapeCell(reference.sourceName()) + "` references "
            + kindLabel(reference.targetKind()) + " `"
            + ValueFormatter.escapeCell(reference.targetName()) + "`, which is not defined in `"
            + reference.targetKind().collectionKey() + "`";
    }
}
