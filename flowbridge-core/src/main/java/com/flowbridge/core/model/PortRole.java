package com.flowbridge.core.model;

import java.util.Locale;

/**
 * Role a port plays in the wiring the compiler generates.
 */
public enum PortRole {
    /** Default input or output used for ordinary message flow */
    PRIMARY,

    /** Gate output fired when the comparison matches */
    MATCH,

    /** Gate output fired when the comparison does not match */
    NO_MATCH,

    /** Any other port; never wired by the compiler */
    AUXILIARY;

    /**
     * Parses a role name from a palette document.
     *
     * @param value role text ("primary", "match", "no_match", "noMatch", ...), null for auxiliary
     * @return resolved role
     */
    public static PortRole parse(String value) {
        if (value == null || value.isBlank()) {
            return AUXILIARY;
        }
        String normalized = value.trim().replace("-", "_").toUpperCase(Locale.ROOT);
        if ("NOMATCH".equals(normalized)) {
            return NO_MATCH;
        }
        return PortRole.valueOf(normalized);
    }
}
