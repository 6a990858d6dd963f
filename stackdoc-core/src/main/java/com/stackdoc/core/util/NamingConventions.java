package com.stackdoc.core.util;

import java.util.Locale;
import java.util.Objects;

/**
 * Naming conversions between element identifiers, component keys and labels.
 */
public final class NamingConventions {

    private NamingConventions() {
        // Utility class
    }

    /**
     * Converts a hyphen-separated identifier into its compound form.
     *
     * <p>The first segment is lowercased. Every following segment gets an upper-case
     * first letter and a lower-case remainder. Hyphens are removed, and empty
     * segments produced by repeated hyphens are dropped.
     *
     * <pre>{@code
     * NamingConventions.toCamelCase("security-baseline"); // "securityBaseline"
     * NamingConventions.toCamelCase("ETCD-Encryption");   // "etcdEncryption"
     * }</pre>
     *
     * @param name hyphen-separated identifier
     * @return compound identifier
     */
    public static String toCamelCase(String name) {
        Objects.requireNonNull(name, "name must not be null");
        StringBuilder sb = new StringBuilder(name.length());
        for (String segment : name.split("-")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (sb.length() == 0) {
                sb.append(segment.toLowerCase(Locale.ROOT));
            } else {
                sb.append(Character.toUpperCase(segment.charAt(0)))
                    .append(segment.substring(1).toLowerCase(Locale.ROOT));
            }
        }
        return sb.toString();
    }

    /**
     * Turns a camelCase key into a Title Case label.
     *
     * <pre>{@code
     * NamingConventions.humanize("remediationAction"); // "Remediation Action"
     * NamingConventions.humanize("startingCSV");       // "Starting CSV"
     * }</pre>
     *
     * @param key mapping key
     * @return human readable label
     */
    public static String humanize(String key) {
        Objects.requireNonNull(key, "key must not be null");
        StringBuilder sb = new StringBuilder(key.length() + 8);
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '-' || c == '_') {
                sb.append(' ');
                continue;
            }
            if (i > 0 && Character.isUpperCase(c)) {
                char previous = key.charAt(i - 1);
                boolean nextIsLower = i + 1 < key.length() && Character.isLowerCase(key.charAt(i + 1));
                if (Character.isLowerCase(previous) || Character.isDigit(previous)
                        || (Character.isUpperCase(previous) && nextIsLower)) {
                    sb.append(' ');
                }
            }
            sb.append(sb.length() == 0 ? Character.toUpperCase(c) : c);
        }
        String label = sb.toString().replaceAll(" +", " ").strip();
        if (label.isEmpty()) {
            return label;
        }
        StringBuilder titled = new StringBuilder(label.length());
        for (String word : label.split(" ")) {
            if (titled.length() > 0) {
                titled.append(' ');
            }
            titled.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return titled.toString();
    }
}
