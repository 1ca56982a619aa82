package com.flowbridge.core.model;

/**
 * The fixed set of configuration fields the compiler rewrites on clones.
 *
 * <p>Palettes bind each of these to their own field name; every other field is
 * treated as opaque payload and copied verbatim.
 */
public enum OverridableField {
    /** Instruction / system prompt text of an agent */
    INSTRUCTION("instruction"),

    /** Text a gate compares its input against */
    MATCH_TEXT("matchText"),

    /** Comparison operator of a gate */
    OPERATOR("operator");

    private final String bindingKey;

    OverridableField(String bindingKey) {
        this.bindingKey = bindingKey;
    }

    /**
     * Returns the key used under {@code fieldBindings} in palette documents.
     *
     * @return binding key
     */
    public String bindingKey() {
        return bindingKey;
    }
}
