package com.flowbridge.core.model;

import java.util.Locale;

/**
 * Value kinds a conversational node may extract from the dialogue.
 */
public enum FieldKind {
    /** Free-form text */
    STRING,

    /** One of a fixed set of allowed values */
    ENUM,

    /** Numeric value */
    NUMBER,

    /** True/false flag */
    BOOLEAN;

    /**
     * Resolves the kind declared in a source extraction schema.
     *
     * <p>A field that lists allowed values is an {@link #ENUM} regardless of its declared type.
     * Unknown or missing types fall back to {@link #STRING}.
     *
     * @param schemaType declared type (e.g. "string", "number", "integer", "boolean")
     * @param hasEnumValues whether the field lists allowed values
     * @return resolved kind
     */
    public static FieldKind fromSchemaType(String schemaType, boolean hasEnumValues) {
        if (hasEnumValues) {
            return ENUM;
        }
        if (schemaType == null) {
            return STRING;
        }
        return switch (schemaType.toLowerCase(Locale.ROOT)) {
            case "number", "integer", "float", "double" -> NUMBER;
            case "boolean", "bool" -> BOOLEAN;
            case "enum" -> ENUM;
            default -> STRING;
        };
    }

    /**
     * Returns the lowercase name used in prompt text and JSON placeholders.
     *
     * @return schema type name
     */
    public String schemaName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
