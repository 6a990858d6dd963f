package com.stackdoc.core.generator.section;

import com.stackdoc.core.generator.ReportSection;
import com.stackdoc.core.model.PolicyKind;

import java.util.List;

/**
 * The fixed section order of an element report.
 */
public final class ReportSections {

    private ReportSections() {
        // Utility class
    }

    public static List<ReportSection> defaults() {
        return List.of(
            new HeaderSection(),
            new ComponentConfigurationSection(),
            new DefaultPolicySection(),
            new PoliciesSection(),
            new SubPolicySection(PolicyKind.CONFIG_POLICY),
            new SubPolicySection(PolicyKind.OPERATOR_POLICY),
            new SubPolicySection(PolicyKind.CERTIFICATE_POLICY),
            new PolicySetsSection(),
            new WarningsSection(),
            new SummarySection()
        );
    }
}
