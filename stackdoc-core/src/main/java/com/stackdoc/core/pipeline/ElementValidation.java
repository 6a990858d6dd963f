package com.stackdoc.core.pipeline;

import com.stackdoc.core.loader.UnboundDescription;

import java.util.List;
import java.util.Objects;

/**
 * Load result of one element for {@code validate}.
 *
 * @param identifier element identifier
 * @param failure parse failure, or {@code null} if the document loaded
 * @param boundDescriptions number of descriptions bound to nodes
 * @param unboundDescriptions descriptions that bound to nothing
 */
public record ElementValidation(
    String identifier,
    ElementFailure failure,
    int boundDescriptions,
    List<UnboundDescription> unboundDescriptions
) {
    /**
     * Compact constructor with validation.
     */
    public ElementValidation {
        Objects.requireNonNull(identifier, "identifier must not be null");
        unboundDescriptions = unboundDescriptions == null ? List.of() : List.copyOf(unboundDescriptions);
    }

    public boolean isValid() {
        return failure == null;
    }
}
