package com.flowbridge.core.model;

import java.util.Objects;

/**
 * Guard attached to a source transition.
 *
 * @param kind evaluation kind
 * @param description natural-language (or expression) text of the condition
 */
public record EdgeCondition(
    ConditionKind kind,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public EdgeCondition {
        Objects.requireNonNull(kind, "kind must not be null");
        if (description == null) {
            description = "";
        }
    }

    /**
     * Returns whether the condition carries usable text.
     *
     * @return true if the description is not blank
     */
    public boolean hasDescription() {
        return !description.isBlank();
    }
}
