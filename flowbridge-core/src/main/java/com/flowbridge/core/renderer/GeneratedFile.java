package com.flowbridge.core.renderer;

import com.flowbridge.core.emit.EmittedDocument;

import java.util.Objects;

/**
 * A file ready to be written by a renderer.
 *
 * @param relativePath path relative to the render context's output directory (e.g., "booking_pipeline.json")
 * @param content file content
 * @param contentType MIME type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Names an emitted document after a source stem: {@code <stem>_<name>.<extension>}.
     *
     * @param stem file name stem, usually the source file name without extension
     * @param document emitted document
     * @return file for the document
     */
    public static GeneratedFile of(String stem, EmittedDocument document) {
        return named(stem + "_" + document.name() + "." + document.fileExtension(), document);
    }

    /**
     * Wraps an emitted document under an explicit file name.
     *
     * @param relativePath file path
     * @param document emitted document
     * @return file for the document
     */
    public static GeneratedFile named(String relativePath, EmittedDocument document) {
        return new GeneratedFile(relativePath, document.content(), contentTypeOf(document.fileExtension()));
    }

    private static String contentTypeOf(String extension) {
        return switch (extension) {
            case "json" -> "application/json";
            case "md" -> "text/markdown";
            default -> "text/plain";
        };
    }
}
