package com.stackdoc.core.generator;

import com.stackdoc.core.TestFixtures;
import com.stackdoc.core.loader.CommentAwareLoader;
import com.stackdoc.core.loader.StructuralParseException;
import com.stackdoc.core.model.ElementMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocumentationEngine}.
 */
class DocumentationEngineTest {

    private static final ElementMetadata METADATA =
        new ElementMetadata("example-policy", "Example Policy", "Example policy library element");

    private CommentAwareLoader loader;
    private DocumentationEngine engine;

    @BeforeEach
    void setUp() {
        loader = new CommentAwareLoader();
        engine = new DocumentationEngine(TestFixtures.FIXED_CLOCK);
    }

    private ElementReport generate(String yaml) throws StructuralParseException {
        return engine.generate(METADATA, loader.load("values.yaml", yaml));
    }

    @Test
    void generate_headerHasTitleDescriptionAndTimestamp() throws StructuralParseException {
        ElementReport report = generate(TestFixtures.EXAMPLE_VALUES);

        assertThat(report.relativePath()).isEqualTo("example-policy.md");
        assertThat(report.content()).startsWith("""
            # Example Policy - Policy Library Documentation

            > Example policy library element

            *Generated: 2024-05-01 09:30:00*
            """);
    }

    @Test
    @DisplayName("Component row carries the description bound to the component key")
    void generate_componentConfiguration() throws StructuralParseException {
        String content = generate("""
            stack:
              # @description: Example policy
              examplePolicy:
                enable: true
            """).content();

        assertThat(content)
            .contains("## Component Configuration")
            .contains("| Component | `examplePolicy` | Example policy |")
            .contains("| Enable | `true` |  |");
    }

    @Test
    void generate_sectionsAppearInFixedOrder() throws StructuralParseException {
        String content = generate(TestFixtures.EXAMPLE_VALUES).content();

        assertThat(content).containsSubsequence(
            "## Component Configuration",
            "## Default Policy Values",
            "## Policies",
            "## Configuration Policies",
            "## Operator Policies",
            "## Certificate Policies",
            "## PolicySets",
            "## ⚠️ Warnings",
            "## 📊 Summary");
    }

    @Test
    void generate_policyInheritsDefaultComplianceMetadata() throws StructuralParseException {
        String content = generate(TestFixtures.EXAMPLE_VALUES).content();

        assertThat(content)
            .contains("### 📋 Policy: etcd-encryption")
            .contains("> Keeps etcd encrypted")
            .contains("| Remediation Action | `enforce` | What the controller does on violation |")
            .contains("| Categories | `CM Configuration Management` (default) | "
                + "Compliance categories applied when a policy sets none |")
            .contains("| Categories | `AU Audit` |  |");
    }

    @Test
    void generate_policyListsAssociatedSubPoliciesAndDanglingReferences() throws StructuralParseException {
        String content = generate(TestFixtures.EXAMPLE_VALUES).content();

        assertThat(content)
            .contains("##### ⚙️ Config: tmpl-a")
            .contains("| Linked Via | `configPolicies` |  |")
            .contains("##### 🔧 Operator: openshift-gitops")
            .contains("| Linked Via | `policyRef` |  |")
            .contains("- ⚠️ Dangling reference: config policy `missing-tmpl` is not defined in `configPolicies`");
    }

    @Test
    void generate_subPolicyShowsReferencedByNestedTablesAndOrphanMarker() throws StructuralParseException {
        String content = generate(TestFixtures.EXAMPLE_VALUES).content();

        assertThat(content)
            .contains("| Referenced By | `etcd-encryption` |  |")
            .contains("**Template Parameters:**")
            .contains("_Template parameters_")
            .contains("| Target Namespace | `production` | Target namespace |")
            .containsSubsequence("### ⚙️ Config: tmpl-orphan", "⚠️ **Orphaned:** not referenced by any Policy.",
                "| Referenced By | _none_ |  |");
    }

    @Test
    void generate_listItemsCarryTheirOwnDescriptions() throws StructuralParseException {
        String content = generate(TestFixtures.EXAMPLE_VALUES).content();

        assertThat(content)
            .contains("**Versions:**")
            .contains("_Approved versions_")
            .contains("- `gitops-operator.v1.5.0` - Initial stable release")
            .contains("- `gitops-operator.v1.5.1`\n");
    }

    @Test
    void generate_policySetMarksMissingPolicies() throws StructuralParseException {
        String content = generate(TestFixtures.EXAMPLE_VALUES).content();

        assertThat(content)
            .contains("### 📦 PolicySet: baseline")
            .contains("> Baseline set")
            .contains("- `etcd-encryption`\n")
            .contains("- `not-a-policy` ⚠️ Dangling reference: not defined in `policies`");
    }

    @Test
    void generate_warningsListEveryIssue() throws StructuralParseException {
        String content = generate(TestFixtures.EXAMPLE_VALUES).content();

        assertThat(content)
            .contains("- Policy `etcd-encryption` references config policy `missing-tmpl`, "
                + "which is not defined in `configPolicies`")
            .contains("- Certificate `cert-expiry` references policy `ghost-policy`, which is not defined in `policies`")
            .contains("### Orphaned Configuration Policies")
            .contains("- `tmpl-orphan`");
    }

    @Test
    void generate_summaryCountsEveryCollection() throws StructuralParseException {
        ElementReport report = generate(TestFixtures.EXAMPLE_VALUES);

        assertThat(report.content())
            .contains("| Resource Type | Count | Enabled |")
            .contains("| Policies | 2 | 1 |")
            .contains("| PolicySets | 1 | 1 |")
            .contains("| **Total Resources** | **7** | **6** |");
        assertThat(report.summary().statistics().total()).isEqualTo(7);
        assertThat(report.summary().danglingReferences()).hasSize(3);
        assertThat(report.summary().orphans()).hasSize(2);
    }

    @Test
    void generate_cleanComponent_hasNoWarningsSection() throws StructuralParseException {
        String content = generate("""
            stack:
              examplePolicy:
                enable: true
                policies:
                  - name: p1
                    enabled: true
                    configPolicies:
                      - c1
                configPolicies:
                  - name: c1
                    enabled: true
            """).content();

        assertThat(content)
            .doesNotContain("## ⚠️ Warnings")
            .doesNotContain("## Operator Policies")
            .contains("## 📊 Summary");
    }

    @Test
    void generate_missingDescriptionsLeaveColumnBlank() throws StructuralParseException {
        String content = generate("""
            stack:
              examplePolicy:
                enable: true
                usePolicySetsPlacements: false
            """).content();

        assertThat(content)
            .contains("| Component | `examplePolicy` |  |")
            .contains("| Use Policy Sets Placements | `false` |  |");
    }

    @Test
    void generate_isDeterministicForSameInput() throws StructuralParseException {
        assertThat(generate(TestFixtures.EXAMPLE_VALUES).content())
            .isEqualTo(generate(TestFixtures.EXAMPLE_VALUES).content());
    }

    @Test
    void generate_withoutComponent_usesDocumentRoot() throws StructuralParseException {
        ElementReport report = generate("unrelated: 1\n");

        assertThat(report.content())
            .contains("| Component | _document root_ |  |")
            .contains("| **Total Resources** | **0** | **0** |");
    }
}
