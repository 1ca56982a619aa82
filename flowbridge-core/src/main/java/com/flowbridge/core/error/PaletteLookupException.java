package com.flowbridge.core.error;

/**
 * Thrown when the component palette cannot satisfy a request: unknown component type,
 * undeclared port, incompatible port data kinds, or a blueprint whose required fields
 * are empty.
 *
 * <p>Never downgraded to a warning. Falling back to a generic port name produces
 * connections the target runtime silently drops.
 */
public class PaletteLookupException extends CompilationException {

    public PaletteLookupException(String message) {
        super(message);
    }

    public PaletteLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
