package com.flowbridge.core.renderer;

/**
 * Writes generated files to a destination.
 *
 * <p>Renderers are discovered via the Java Service Provider Interface. Register
 * implementations in {@code META-INF/services/com.flowbridge.core.renderer.OutputRenderer}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the unique, lowercase identifier of this renderer (e.g., "filesystem", "console").
     *
     * @return renderer id
     */
    String getId();

    /**
     * Renders the generated files.
     *
     * @param output files to render
     * @param context output directory and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
