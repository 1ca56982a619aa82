package com.flowbridge.core.emit;

import java.util.Objects;

/**
 * A document produced by a {@link TargetEmitter}.
 *
 * @param name document name, used as file name suffix
 * @param content document text
 * @param fileExtension file extension without leading dot
 */
public record EmittedDocument(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public EmittedDocument {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }
}
