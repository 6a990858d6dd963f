package com.stackdoc.core.generator;

import com.stackdoc.core.TestFixtures;
import com.stackdoc.core.loader.CommentAwareLoader;
import com.stackdoc.core.loader.LoadedDocument;
import com.stackdoc.core.loader.StructuralParseException;
import com.stackdoc.core.loader.StructuralPath;
import com.stackdoc.core.loader.TreeNavigator;
import com.stackdoc.core.model.DanglingReference;
import com.stackdoc.core.model.Orphan;
import com.stackdoc.core.model.PolicyEntity;
import com.stackdoc.core.model.PolicyKind;
import com.stackdoc.core.model.PolicyReference;
import com.stackdoc.core.model.SummaryStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PolicyGraph}.
 */
class PolicyGraphTest {

    private PolicyGraph graph;

    @BeforeEach
    void setUp() throws StructuralParseException {
        LoadedDocument document = new CommentAwareLoader().load(TestFixtures.EXAMPLE_VALUES);
        StructuralPath path = StructuralPath.of("stack", "examplePolicy");
        graph = PolicyGraph.build(TreeNavigator.asMapping(document.get(path)), path);
    }

    private static PolicyGraph graphOf(String yaml) throws StructuralParseException {
        return PolicyGraph.build(new CommentAwareLoader().load(yaml).rootMapping(), StructuralPath.root());
    }

    @Test
    void build_indexesEntitiesInSourceOrder() {
        assertThat(graph.entities(PolicyKind.POLICY))
            .extracting(e -> e.name())
            .containsExactly("etcd-encryption", "audit-only");
        assertThat(graph.entities(PolicyKind.CONFIG_POLICY).get(1).path())
            .isEqualTo(StructuralPath.of("stack", "examplePolicy", "configPolicies", 1));
    }

    @Test
    void build_resolvesDeclaredAndPolicyRefReferences() {
        assertThat(graph.referencesFrom("etcd-encryption")).containsExactly(
            new PolicyReference("etcd-encryption", PolicyKind.CONFIG_POLICY, "tmpl-a", PolicyReference.Origin.DECLARED));
        assertThat(graph.referencesFrom("audit-only")).containsExactly(
            new PolicyReference("audit-only", PolicyKind.OPERATOR_POLICY, "openshift-gitops",
                PolicyReference.Origin.POLICY_REF));
        assertThat(graph.referencedBy(PolicyKind.CONFIG_POLICY, "tmpl-a")).containsExactly("etcd-encryption");
    }

    @Test
    void build_reportsEveryUnresolvedName() {
        assertThat(graph.danglingReferences()).containsExactly(
            new DanglingReference("Policy", "etcd-encryption", PolicyKind.CONFIG_POLICY, "missing-tmpl"),
            new DanglingReference("Certificate", "cert-expiry", PolicyKind.POLICY, "ghost-policy"),
            new DanglingReference("PolicySet", "baseline", PolicyKind.POLICY, "not-a-policy"));
    }

    @Test
    void build_orphansAreDefinedMinusReferenced() {
        assertThat(graph.orphans()).containsExactly(
            new Orphan(PolicyKind.CONFIG_POLICY, "tmpl-orphan"),
            new Orphan(PolicyKind.CERTIFICATE_POLICY, "cert-expiry"));
        assertThat(graph.isOrphan(PolicyKind.OPERATOR_POLICY, "openshift-gitops")).isFalse();
    }

    @Test
    void statistics_countDefinedAndEnabled() {
        SummaryStatistics stats = graph.statistics();

        assertThat(stats.count(PolicyKind.POLICY)).isEqualTo(2);
        assertThat(stats.enabledCount(PolicyKind.POLICY)).isEqualTo(1);
        assertThat(stats.count(PolicyKind.CONFIG_POLICY)).isEqualTo(2);
        assertThat(stats.policySets()).isEqualTo(1);
        assertThat(stats.total()).isEqualTo(7);
        assertThat(stats.enabledTotal()).isEqualTo(6);
    }

    @Test
    void statistics_absentCollectionsCountZero() throws StructuralParseException {
        SummaryStatistics stats = graphOf("enable: true\n").statistics();

        assertThat(stats.total()).isZero();
        assertThat(stats.count(PolicyKind.CERTIFICATE_POLICY)).isZero();
    }

    @Test
    void build_duplicateName_firstDefinitionWins() throws StructuralParseException {
        PolicyGraph duplicates = graphOf("""
            configPolicies:
              - name: dup
                complianceType: musthave
              - name: dup
                complianceType: mustnothave
            """);

        assertThat(duplicates.find(PolicyKind.CONFIG_POLICY, "dup"))
            .hasValueSatisfying(e -> assertThat(e.index()).isZero());
        assertThat(duplicates.entities(PolicyKind.CONFIG_POLICY)).hasSize(2);
        assertThat(duplicates.orphans()).containsExactly(new Orphan(PolicyKind.CONFIG_POLICY, "dup"));
    }

    @Test
    void build_mappingReferencesAndAnonymousEntities() throws StructuralParseException {
        PolicyGraph mixed = graphOf("""
            policies:
              - name: p1
                certificatePolicies:
                  - name: c1
              - enabled: true
            certificatePolicies:
              - name: c1
              - enabled: true
            """);

        assertThat(mixed.referencedBy(PolicyKind.CERTIFICATE_POLICY, "c1")).containsExactly("p1");
        assertThat(mixed.entities(PolicyKind.CERTIFICATE_POLICY).get(1).isAnonymous()).isTrue();
        assertThat(mixed.orphans()).isEmpty();
        assertThat(mixed.danglingReferences()).isEmpty();
    }

    @Test
    void build_declaredAndPolicyRefToSameTarget_countsOnce() throws StructuralParseException {
        PolicyGraph both = graphOf("""
            policies:
              - name: p1
                configPolicies: [c1]
            configPolicies:
              - name: c1
                policyRef: p1
            """);

        assertThat(both.referencesFrom("p1")).hasSize(1);
        assertThat(both.referencedBy(PolicyKind.CONFIG_POLICY, "c1")).containsExactly("p1");
    }

    @Test
    void build_duplicatePolicyName_stillResolvesItsReferences() throws StructuralParseException {
        PolicyGraph duplicates = graphOf("""
            policies:
              - name: p
                configPolicies: [tmpl-a]
              - name: p
                configPolicies: [tmpl-b, ghost]
            configPolicies:
              - name: tmpl-a
              - name: tmpl-b
            """);

        assertThat(duplicates.orphans()).isEmpty();
        assertThat(duplicates.danglingReferences()).containsExactly(
            new DanglingReference("Policy", "p", PolicyKind.CONFIG_POLICY, "ghost"));
        assertThat(duplicates.referencedBy(PolicyKind.CONFIG_POLICY, "tmpl-b")).containsExactly("p");

        PolicyEntity first = duplicates.entities(PolicyKind.POLICY).get(0);
        PolicyEntity second = duplicates.entities(PolicyKind.POLICY).get(1);
        assertThat(duplicates.referencesFrom(first)).extracting(PolicyReference::targetName).containsExactly("tmpl-a");
        assertThat(duplicates.referencesFrom(second)).extracting(PolicyReference::targetName).containsExactly("tmpl-b");
        assertThat(duplicates.danglingFrom(first.path())).isEmpty();
        assertThat(duplicates.danglingFrom(second.path())).extracting(DanglingReference::targetName)
            .containsExactly("ghost");
    }

    @Test
    void build_removingOnlyReferencingPolicy_makesTargetOrphan() throws StructuralParseException {
        String subPolicies = """
            configPolicies:
              - name: tmpl-a
            operatorPolicies:
              - name: gitops
                policyRef: keeper
            """;
        PolicyGraph referenced = graphOf("""
            policies:
              - name: keeper
              - name: user
                configPolicies: [tmpl-a]
            """ + subPolicies);
        PolicyGraph withoutUser = graphOf("""
            policies:
              - name: keeper
            """ + subPolicies);

        assertThat(referenced.isOrphan(PolicyKind.CONFIG_POLICY, "tmpl-a")).isFalse();
        assertThat(withoutUser.isOrphan(PolicyKind.CONFIG_POLICY, "tmpl-a")).isTrue();
        assertThat(withoutUser.orphans()).containsExactly(new Orphan(PolicyKind.CONFIG_POLICY, "tmpl-a"));
    }

    @Test
    void build_nonSequenceCollection_isIgnored() {
        PolicyGraph odd = PolicyGraph.build(Map.of("policies", "not-a-list"), StructuralPath.root());

        assertThat(odd.entities(PolicyKind.POLICY)).isEmpty();
    }
}
