package com.stackdoc.core.model;

import com.stackdoc.core.loader.StructuralPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the {@code policySets} collection.
 *
 * @param name value of the {@code name} field, or {@code null} when missing
 * @param index position in the source collection
 * @param path structural path of the entry
 * @param fields decoded entry mapping
 */
public record PolicySet(
    String name,
    int index,
    StructuralPath path,
    Map<String, Object> fields
) {
    /**
     * Compact constructor with validation.
     */
    public PolicySet {
        Objects.requireNonNull(path, "path must not be null");
        fields = fields == null ? Map.of() : fields;
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(fields.get("enabled"));
    }

    public String displayName() {
        return name != null ? name : "(unnamed #" + index + ")";
    }

    /**
     * Names listed under the set's {@code policies} key.
     *
     * @return policy names in document order
     */
    public List<String> policyNames() {
        List<String> names = new ArrayList<>();
        if (fields.get("policies") instanceof List<?> entries) {
            for (Object entry : entries) {
                if (entry != null && !(entry instanceof Map<?, ?>) && !(entry instanceof List<?>)) {
                    names.add(String.valueOf(entry));
                } else if (entry instanceof Map<?, ?> map && map.get("name") != null) {
                    names.add(String.valueOf(map.get("name")));
                }
            }
        }
        return names;
    }
}
