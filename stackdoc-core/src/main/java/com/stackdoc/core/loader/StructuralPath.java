package com.stackdoc.core.loader;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Location of a node inside a decoded YAML tree.
 *
 * <p>A path is an ordered list of steps where each step is either a mapping key
 * ({@link String}) or a sequence index ({@link Integer}). Two paths are equal when
 * their step lists are equal element-wise, which makes paths usable as map keys
 * joining the decoded tree with the {@link DescriptionIndex}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * StructuralPath path = StructuralPath.root()
 *     .key("stack")
 *     .key("policies")
 *     .index(0);
 *
 * path.toString(); // "stack.policies[0]"
 * }</pre>
 *
 * @param steps ordered path steps, each a {@code String} or an {@code Integer}
 */
public record StructuralPath(List<Object> steps) {

    private static final StructuralPath ROOT = new StructuralPath(List.of());

    /**
     * Compact constructor with validation.
     */
    public StructuralPath {
        Objects.requireNonNull(steps, "steps must not be null");
        for (Object step : steps) {
            if (!(step instanceof String) && !(step instanceof Integer)) {
                throw new IllegalArgumentException("Path step must be a String key or an Integer index: " + step);
            }
        }
        steps = List.copyOf(steps);
    }

    /**
     * Returns the empty path addressing the document root.
     *
     * @return root path
     */
    public static StructuralPath root() {
        return ROOT;
    }

    /**
     * Creates a path from the given steps.
     *
     * @param steps keys and indexes in order
     * @return new path
     */
    public static StructuralPath of(Object... steps) {
        return new StructuralPath(List.of(steps));
    }

    /**
     * Returns the path formed by descending into a mapping key.
     *
     * @param key mapping key
     * @return child path
     */
    public StructuralPath key(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return append(key);
    }

    /**
     * Returns the path formed by descending into a sequence item.
     *
     * @param index zero-based item index
     * @return child path
     */
    public StructuralPath index(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        return append(index);
    }

    /**
     * Returns the enclosing path, or the root path when this path is the root.
     *
     * @return parent path
     */
    public StructuralPath parent() {
        if (steps.isEmpty()) {
            return this;
        }
        return new StructuralPath(steps.subList(0, steps.size() - 1));
    }

    public boolean isRoot() {
        return steps.isEmpty();
    }

    public int depth() {
        return steps.size();
    }

    /**
     * Returns the last step, or {@code null} for the root path.
     *
     * @return last key or index
     */
    public Object lastStep() {
        return steps.isEmpty() ? null : steps.get(steps.size() - 1);
    }

    private StructuralPath append(Object step) {
        List<Object> next = new ArrayList<>(steps.size() + 1);
        next.addAll(steps);
        next.add(step);
        return new StructuralPath(next);
    }

    @Override
    public String toString() {
        if (steps.isEmpty()) {
            return "<root>";
        }
        StringBuilder sb = new StringBuilder();
        for (Object step : steps) {
            if (step instanceof Integer index) {
                sb.append('[').append(index).append(']');
            } else {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(step);
            }
        }
        return sb.toString();
    }
}
