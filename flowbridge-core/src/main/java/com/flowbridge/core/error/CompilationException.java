package com.flowbridge.core.error;

/**
 * Base class for fatal compilation failures.
 *
 * <p>Messages always name the offending node, edge, component type or port so the
 * operator can locate the problem in the source document or palette.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
