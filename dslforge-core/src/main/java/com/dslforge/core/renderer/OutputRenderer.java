package com.dslforge.core.renderer;

/**
 * Interface for renderers that deliver generated programs.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.dslforge.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer ({@code filesystem}, {@code console}).
     *
     * @return lowercase renderer identifier
     */
    String getId();

    /**
     * Renders the generated files.
     *
     * @param output files to render
     * @param context output directory and settings
     * @throws IllegalStateException if the output cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
