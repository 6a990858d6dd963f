package com.stackdoc.core.model;

import java.util.Objects;

/**
 * A resolved association between a Policy and one of its sub-policies.
 *
 * @param policyName name of the referencing Policy
 * @param targetKind kind of the referenced sub-policy
 * @param targetName name of the referenced sub-policy
 * @param origin where the association was declared
 */
public record PolicyReference(
    String policyName,
    PolicyKind targetKind,
    String targetName,
    Origin origin
) {
    /**
     * Compact constructor with validation.
     */
    public PolicyReference {
        Objects.requireNonNull(policyName, "policyName must not be null");
        Objects.requireNonNull(targetKind, "targetKind must not be null");
        Objects.requireNonNull(targetName, "targetName must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
    }

    /**
     * Declaration site of a reference.
     */
    public enum Origin {
        /** Listed in one of the Policy's reference lists. */
        DECLARED,
        /** The sub-policy names the Policy in its {@code policyRef} field. */
        POLICY_REF
    }
}
