package com.flowbridge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A single value a conversational node must extract as structured output.
 *
 * @param fieldName key of the field in the extracted JSON object
 * @param kind value kind
 * @param enumValues allowed values (empty unless {@code kind} is {@link FieldKind#ENUM})
 * @param description human-readable description of the value
 */
public record ExtractionField(
    String fieldName,
    FieldKind kind,
    List<String> enumValues,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public ExtractionField {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
        if (description == null) {
            description = "";
        }
    }

    /**
     * Returns whether this field restricts its value to a fixed set.
     *
     * @return true if allowed values are listed
     */
    public boolean hasEnumValues() {
        return !enumValues.isEmpty();
    }
}
