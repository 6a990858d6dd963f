package com.stackdoc.core.model;

import java.util.List;

/**
 * Kinds of policy entity recognized in a policy-library document.
 */
public enum PolicyKind {
    POLICY("policies", "Policy", "Policies", "📋"),
    CONFIG_POLICY("configPolicies", "Config", "Configuration Policies", "⚙️"),
    OPERATOR_POLICY("operatorPolicies", "Operator", "Operator Policies", "🔧"),
    CERTIFICATE_POLICY("certificatePolicies", "Certificate", "Certificate Policies", "🔐");

    private final String collectionKey;
    private final String singularLabel;
    private final String pluralLabel;
    private final String icon;

    PolicyKind(String collectionKey, String singularLabel, String pluralLabel, String icon) {
        this.collectionKey = collectionKey;
        this.singularLabel = singularLabel;
        this.pluralLabel = pluralLabel;
        this.icon = icon;
    }

    /**
     * Key of the collection holding entities of this kind, both at component level
     * and as a reference list inside a Policy.
     *
     * @return collection key
     */
    public String collectionKey() {
        return collectionKey;
    }

    public String singularLabel() {
        return singularLabel;
    }

    public String pluralLabel() {
        return pluralLabel;
    }

    public String icon() {
        return icon;
    }

    /**
     * Returns the kinds a Policy can reference.
     *
     * @return sub-policy kinds in rendering order
     */
    public static List<PolicyKind> subPolicyKinds() {
        return List.of(CONFIG_POLICY, OPERATOR_POLICY, CERTIFICATE_POLICY);
    }
}
