package com.stackdoc.core.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-element resource counts, computed once after traversal.
 *
 * <p>A collection missing from the document counts as zero.
 *
 * @param defined number of entities defined per kind
 * @param enabled number of entities with {@code enabled: true} per kind
 * @param policySets number of policy sets defined
 * @param enabledPolicySets number of enabled policy sets
 */
public record SummaryStatistics(
    Map<PolicyKind, Integer> defined,
    Map<PolicyKind, Integer> enabled,
    int policySets,
    int enabledPolicySets
) {
    /**
     * Compact constructor filling every kind.
     */
    public SummaryStatistics {
        Objects.requireNonNull(defined, "defined must not be null");
        Objects.requireNonNull(enabled, "enabled must not be null");
        defined = complete(defined);
        enabled = complete(enabled);
    }

    public static SummaryStatistics empty() {
        return new SummaryStatistics(Map.of(), Map.of(), 0, 0);
    }

    public int count(PolicyKind kind) {
        return defined.get(kind);
    }

    public int enabledCount(PolicyKind kind) {
        return enabled.get(kind);
    }

    /**
     * Total of every counted resource: all policy entities plus policy sets.
     *
     * @return total resources
     */
    public int total() {
        return defined.values().stream().mapToInt(Integer::intValue).sum() + policySets;
    }

    public int enabledTotal() {
        return enabled.values().stream().mapToInt(Integer::intValue).sum() + enabledPolicySets;
    }

    private static Map<PolicyKind, Integer> complete(Map<PolicyKind, Integer> counts) {
        Map<PolicyKind, Integer> result = new EnumMap<>(PolicyKind.class);
        for (PolicyKind kind : PolicyKind.values()) {
            result.put(kind, counts.getOrDefault(kind, 0));
        }
        return Map.copyOf(result);
    }
}
