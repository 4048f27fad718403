package com.typedumper.core.renderer;

/**
 * Writes generated artifacts to a destination.
 *
 * <p>Source and script renderers build a {@link GeneratedOutput} in memory and hand it
 * to an output renderer, which owns all I/O. Implementations are discovered via
 * {@code META-INF/services/com.typedumper.core.renderer.OutputRenderer}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g. "filesystem").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Writes every file of the output below the context's output directory, creating
     * directories as needed and replacing existing files.
     *
     * @param output artifacts to write
     * @param context write target
     * @throws java.io.UncheckedIOException if an artifact cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
