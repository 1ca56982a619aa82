package com.flowbridge.core.emit;

import com.flowbridge.core.compiler.CompilationResult;

/**
 * Turns a compilation result into an output document.
 *
 * <p>Emitters are discovered through the Java Service Provider Interface. Register
 * implementations in {@code META-INF/services/com.flowbridge.core.emit.TargetEmitter}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class MermaidPreviewEmitter implements TargetEmitter {
 *     public String getId() { return "mermaid"; }
 *     public String getDisplayName() { return "Mermaid Flow Preview"; }
 *     public String getFileExtension() { return "md"; }
 *
 *     public EmittedDocument emit(CompilationResult result, EmitterConfig config) {
 *         return new EmittedDocument("preview", render(result.graph()), "md");
 *     }
 * }
 * }</pre>
 */
public interface TargetEmitter {

    /**
     * Returns the unique, lowercase identifier used on the command line (e.g. "langflow-json").
     *
     * @return emitter id
     */
    String getId();

    /**
     * Returns a human-readable name for listings and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the file extension of emitted documents, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Emits a document for a compilation result.
     *
     * @param result compilation result
     * @param config emitter settings
     * @return emitted document
     * @throws IllegalStateException if the document cannot be serialized
     */
    EmittedDocument emit(CompilationResult result, EmitterConfig config);
}
