package com.flowbridge.core.model;

import java.util.Objects;

/**
 * A non-fatal finding reported to the operator.
 *
 * @param kind warning kind
 * @param subject node, edge or instance the warning is about
 * @param message human-readable explanation
 */
public record CompilationWarning(
    WarningKind kind,
    String subject,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public CompilationWarning {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return kind + " [" + subject + "]: " + message;
    }
}
