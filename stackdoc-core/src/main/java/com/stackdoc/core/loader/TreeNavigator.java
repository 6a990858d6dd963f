package com.stackdoc.core.loader;

import java.util.List;
import java.util.Map;

/**
 * Read-only navigation over a decoded tree of maps, lists and scalars.
 */
public final class TreeNavigator {

    private TreeNavigator() {
        // Utility class
    }

    /**
     * Checks whether a path addresses a node of the tree. A key that is present
     * with a {@code null} value counts as reachable.
     *
     * @param root decoded tree root
     * @param path path to test
     * @return true if every step of the path exists
     */
    public static boolean exists(Object root, StructuralPath path) {
        Object current = root;
        for (Object step : path.steps()) {
            if (step instanceof String key) {
                if (!(current instanceof Map<?, ?> map) || !map.containsKey(key)) {
                    return false;
                }
                current = map.get(key);
            } else {
                int index = (Integer) step;
                if (!(current instanceof List<?> list) || index >= list.size()) {
                    return false;
                }
                current = list.get(index);
            }
        }
        return true;
    }

    /**
     * Returns the node at a path.
     *
     * @param root decoded tree root
     * @param path path to resolve
     * @return the node, or {@code null} when the path is absent or holds null
     */
    public static Object get(Object root, StructuralPath path) {
        Object current = root;
        for (Object step : path.steps()) {
            if (step instanceof String key && current instanceof Map<?, ?> map) {
                current = map.get(key);
            } else if (step instanceof Integer index && current instanceof List<?> list && index < list.size()) {
                current = list.get(index);
            } else {
                return null;
            }
        }
        return current;
    }

    /**
     * Views a node as a mapping.
     *
     * @param node decoded node
     * @return the mapping, or an empty map when the node is not one
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMapping(Object node) {
        return node instanceof Map<?, ?> ? (Map<String, Object>) node : Map.of();
    }

    /**
     * Views a node as a sequence.
     *
     * @param node decoded node
     * @return the list, or an empty list when the node is not one
     */
    @SuppressWarnings("unchecked")
    public static List<Object> asSequence(Object node) {
        return node instanceof List<?> ? (List<Object>) node : List.of();
    }

    public static boolean isScalar(Object node) {
        return !(node instanceof Map<?, ?>) && !(node instanceof List<?>);
    }
}
