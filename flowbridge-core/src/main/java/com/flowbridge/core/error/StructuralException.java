package com.flowbridge.core.error;

/**
 * Thrown when the source workflow document is malformed: missing or ambiguous entry node,
 * transitions naming unknown nodes, duplicate ids, or an unreadable document.
 */
public class StructuralException extends CompilationException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
