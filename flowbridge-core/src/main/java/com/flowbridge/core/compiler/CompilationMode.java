package com.flowbridge.core.compiler;

import java.util.Locale;

/**
 * How a workflow is mapped onto components.
 */
public enum CompilationMode {
    /** One agent per conversational node, with classifier and gates at near branch points. */
    ROUTED,

    /** A single agent whose instruction text carries the whole workflow. */
    UNIFIED;

    /**
     * Parses a mode name, case-insensitively.
     *
     * @param value mode name
     * @return the mode
     * @throws IllegalArgumentException if the name is unknown
     */
    public static CompilationMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
