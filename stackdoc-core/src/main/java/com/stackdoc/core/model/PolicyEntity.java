package com.stackdoc.core.model;

import com.stackdoc.core.loader.StructuralPath;

import java.util.Map;
import java.util.Objects;

/**
 * One entry of a policy collection.
 *
 * @param kind entity kind
 * @param name value of the {@code name} field, or {@code null} for an anonymous entity
 * @param index position in the source collection
 * @param path structural path of the entry in the decoded tree
 * @param fields decoded entry mapping
 */
public record PolicyEntity(
    PolicyKind kind,
    String name,
    int index,
    StructuralPath path,
    Map<String, Object> fields
) {
    /**
     * Compact constructor with validation.
     */
    public PolicyEntity {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(path, "path must not be null");
        fields = fields == null ? Map.of() : fields;
    }

    public boolean isAnonymous() {
        return name == null;
    }

    /**
     * Reads the entity's {@code enabled} flag. Absent means disabled.
     *
     * @return true if {@code enabled: true}
     */
    public boolean isEnabled() {
        return Boolean.TRUE.equals(fields.get("enabled"));
    }

    /**
     * Returns a display name that is stable for anonymous entities.
     *
     * @return name, or {@code (unnamed #index)}
     */
    public String displayName() {
        return name != null ? name : "(unnamed #" + index + ")";
    }
}
