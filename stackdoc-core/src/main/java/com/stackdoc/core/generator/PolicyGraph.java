package com.stackdoc.core.generator;

import com.stackdoc.core.loader.StructuralPath;
import com.stackdoc.core.loader.TreeNavigator;
import com.stackdoc.core.model.DanglingReference;
import com.stackdoc.core.model.Orphan;
import com.stackdoc.core.model.PolicyEntity;
import com.stackdoc.core.model.PolicyKind;
import com.stackdoc.core.model.PolicyReference;
import com.stackdoc.core.model.PolicySet;
import com.stackdoc.core.model.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name maps and resolved references of one component.
 *
 * <p>Built in a single pass before any section renders, so sections can look up any
 * entity regardless of the order collections appear in the document.
 */
public final class PolicyGraph {

    private static final Logger log = LoggerFactory.getLogger(PolicyGraph.class);

    public static final String POLICY_REF_KEY = "policyRef";
    public static final String POLICY_SETS_KEY = "policySets";
    public static final String POLICY_SET_LABEL = "PolicySet";
    private static final String NAME_KEY = "name";

    private final Map<PolicyKind, List<PolicyEntity>> entities = new EnumMap<>(PolicyKind.class);
    private final Map<PolicyKind, Map<String, PolicyEntity>> byName = new EnumMap<>(PolicyKind.class);
    private final List<PolicySet> policySets = new ArrayList<>();
    private final Map<StructuralPath, List<PolicyReference>> referencesByPolicy = new LinkedHashMap<>();
    private final Map<PolicyKind, Map<String, List<String>>> referencedBy = new EnumMap<>(PolicyKind.class);
    private final List<DanglingReference> danglingReferences = new ArrayList<>();
    private final Map<StructuralPath, List<DanglingReference>> danglingBySource = new LinkedHashMap<>();
    private final List<Orphan> orphans = new ArrayList<>();

    private PolicyGraph() {
        for (PolicyKind kind : PolicyKind.values()) {
            entities.put(kind, new ArrayList<>());
            byName.put(kind, new LinkedHashMap<>());
            referencedBy.put(kind, new LinkedHashMap<>());
        }
    }

    /**
     * Indexes a component mapping and resolves every reference in it.
     *
     * @param component decoded component mapping
     * @param componentPath structural path of the component mapping
     * @return resolved graph
     */
    public static PolicyGraph build(Map<String, Object> component, StructuralPath componentPath) {
        Objects.requireNonNull(component, "component must not be null");
        Objects.requireNonNull(componentPath, "componentPath must not be null");

        PolicyGraph graph = new PolicyGraph();
        for (PolicyKind kind : PolicyKind.values()) {
            graph.indexCollection(kind, component, componentPath);
        }
        graph.indexPolicySets(component, componentPath);
        graph.resolveDeclaredReferences();
        graph.resolvePolicyRefs();
        graph.resolvePolicySets();
        graph.collectOrphans();
        return graph;
    }

    private void indexCollection(PolicyKind kind, Map<String, Object> component, StructuralPath componentPath) {
        StructuralPath collectionPath = componentPath.key(kind.collectionKey());
        List<Object> items = TreeNavigator.asSequence(component.get(kind.collectionKey()));
        for (int i = 0; i < items.size(); i++) {
            Map<String, Object> fields = TreeNavigator.asMapping(items.get(i));
            String name = nameOf(fields);
            PolicyEntity entity = new PolicyEntity(kind, name, i, collectionPath.index(i), fields);
            entities.get(kind).add(entity);
            if (name == null) {
                log.debug("Anonymous entry #{} in '{}' takes no part in reference resolution", i, kind.collectionKey());
            } else if (byName.get(kind).putIfAbsent(name, entity) != null) {
                log.warn("Duplicate name '{}' in '{}', keeping the first definition", name, kind.collectionKey());
            }
        }
    }

    private void indexPolicySets(Map<String, Object> component, StructuralPath componentPath) {
        StructuralPath collectionPath = componentPath.key(POLICY_SETS_KEY);
        List<Object> items = TreeNavigator.asSequence(component.get(POLICY_SETS_KEY));
        for (int i = 0; i < items.size(); i++) {
            Map<String, Object> fields = TreeNavigator.asMapping(items.get(i));
            policySets.add(new PolicySet(nameOf(fields), i, collectionPath.index(i), fields));
        }
    }

    private void resolveDeclaredReferences() {
        for (PolicyEntity policy : entities.get(PolicyKind.POLICY)) {
            if (policy.isAnonymous()) {
                continue;
            }
            for (PolicyKind target : PolicyKind.subPolicyKinds()) {
                for (Object entry : TreeNavigator.asSequence(policy.fields().get(target.collectionKey()))) {
                    String targetName = referenceName(entry);
                    if (targetName == null) {
                        continue;
                    }
                    if (byName.get(target).containsKey(targetName)) {
                        addReference(policy,
                            new PolicyReference(policy.name(), target, targetName, PolicyReference.Origin.DECLARED));
                    } else {
                        addDangling(policy.path(), new DanglingReference(
                            PolicyKind.POLICY.singularLabel(), policy.name(), target, targetName));
                    }
                }
            }
        }
    }

    private void resolvePolicyRefs() {
        Map<String, PolicyEntity> policies = byName.get(PolicyKind.POLICY);
        for (PolicyKind kind : PolicyKind.subPolicyKinds()) {
            for (PolicyEntity entity : entities.get(kind)) {
                Object ref = entity.fields().get(POLICY_REF_KEY);
                if (entity.isAnonymous() || ref == null || !TreeNavigator.isScalar(ref)) {
                    continue;
                }
                String policyName = String.valueOf(ref);
                if (policies.containsKey(policyName)) {
                    addReference(policies.get(policyName),
                        new PolicyReference(policyName, kind, entity.name(), PolicyReference.Origin.POLICY_REF));
                } else {
                    addDangling(entity.path(), new DanglingReference(
                        kind.singularLabel(), entity.name(), PolicyKind.POLICY, policyName));
                }
            }
        }
    }

    private void resolvePolicySets() {
        Map<String, PolicyEntity> policies = byName.get(PolicyKind.POLICY);
        for (PolicySet set : policySets) {
            for (String policyName : set.policyNames()) {
                if (!policies.containsKey(policyName)) {
                    addDangling(set.path(), new DanglingReference(
                        POLICY_SET_LABEL, set.displayName(), PolicyKind.POLICY, policyName));
                }
            }
        }
    }

    private void collectOrphans() {
        for (PolicyKind kind : PolicyKind.subPolicyKinds()) {
            for (String name : byName.get(kind).keySet()) {
                if (!referencedBy.get(kind).containsKey(name)) {
                    orphans.add(new Orphan(kind, name));
                }
            }
        }
    }

    private void addReference(PolicyEntity policy, PolicyReference reference) {
        List<PolicyReference> existing = referencesByPolicy.computeIfAbsent(policy.path(), k -> new ArrayList<>());
        boolean duplicate = existing.stream().anyMatch(r ->
            r.targetKind() == reference.targetKind() && r.targetName().equals(reference.targetName()));
        if (duplicate) {
            return;
        }
        existing.add(reference);
        List<String> sources = referencedBy.get(reference.targetKind())
            .computeIfAbsent(reference.targetName(), k -> new ArrayList<>());
        if (!sources.contains(reference.policyName())) {
            sources.add(reference.policyName());
        }
    }

    private void addDangling(StructuralPath sourcePath, DanglingReference reference) {
        danglingReferences.add(reference);
        danglingBySource.computeIfAbsent(sourcePath, k -> new ArrayList<>()).add(reference);
    }

    private static String nameOf(Map<String, Object> fields) {
        Object name = fields.get(NAME_KEY);
        return name != null && TreeNavigator.isScalar(name) ? String.valueOf(name) : null;
    }

    private static String referenceName(Object entry) {
        if (entry instanceof Map<?, ?> map) {
            Object name = map.get(NAME_KEY);
            return name != null && TreeNavigator.isScalar(name) ? String.valueOf(name) : null;
        }
        return entry != null && TreeNavigator.isScalar(entry) ? String.valueOf(entry) : null;
    }

    public List<PolicyEntity> entities(PolicyKind kind) {
        return List.copyOf(entities.get(kind));
    }

    public Optional<PolicyEntity> find(PolicyKind kind, String name) {
        return Optional.ofNullable(byName.get(kind).get(name));
    }

    public List<PolicySet> policySets() {
        return List.copyOf(policySets);
    }

    /**
     * Resolved references of one Policy entry, declared references first.
     *
     * <p>{@code policyRef} back-references attach to the first Policy of the named
     * kind; later duplicates only carry their own declared references.
     *
     * @param policy Policy entity
     * @return references, empty if none
     */
    public List<PolicyReference> referencesFrom(PolicyEntity policy) {
        return List.copyOf(referencesByPolicy.getOrDefault(policy.path(), List.of()));
    }

    /**
     * Resolved references of the first Policy with the given name.
     *
     * @param policyName Policy name
     * @return references, empty if none
     */
    public List<PolicyReference> referencesFrom(String policyName) {
        return find(PolicyKind.POLICY, policyName).map(this::referencesFrom).orElse(List.of());
    }

    /**
     * Names of the Policies referencing a sub-policy.
     *
     * @param kind sub-policy kind
     * @param name sub-policy name
     * @return Policy names in resolution order
     */
    public List<String> referencedBy(PolicyKind kind, String name) {
        return List.copyOf(referencedBy.get(kind).getOrDefault(name, List.of()));
    }

    public boolean isOrphan(PolicyKind kind, String name) {
        return orphans.contains(new Orphan(kind, name));
    }

    public List<DanglingReference> danglingReferences() {
        return List.copyOf(danglingReferences);
    }

    /**
     * Dangling references raised by the entry at one structural path.
     *
     * @param sourcePath path of the Policy, sub-policy or policy set entry
     * @return dangling references in resolution order
     */
    public List<DanglingReference> danglingFrom(StructuralPath sourcePath) {
        return List.copyOf(danglingBySource.getOrDefault(sourcePath, List.of()));
    }

    public List<Orphan> orphans() {
        return List.copyOf(orphans);
    }

    public SummaryStatistics statistics() {
        Map<PolicyKind, Integer> defined = new EnumMap<>(PolicyKind.class);
        Map<PolicyKind, Integer> enabled = new EnumMap<>(PolicyKind.class);
        for (PolicyKind kind : PolicyKind.values()) {
            List<PolicyEntity> list = entities.get(kind);
            defined.put(kind, list.size());
            enabled.put(kind, (int) list.stream().filter(PolicyEntity::isEnabled).count());
        }
        int enabledSets = (int) policySets.stream().filter(PolicySet::isEnabled).count();
        return new SummaryStatistics(defined, enabled, policySets.size(), enabledSets);
    }
}
