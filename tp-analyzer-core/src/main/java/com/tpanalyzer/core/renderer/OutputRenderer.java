package com.tpanalyzer.core.renderer;

/**
 * Writes generated output to a destination.
 *
 * <p>Implementations are discovered via SPI
 * ({@code META-INF/services/com.tpanalyzer.core.renderer.OutputRenderer}).
 * I/O failures are reported as {@link IllegalStateException} wrapping the cause.
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer ("filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders the output.
     *
     * @param output files to render
     * @param context destination and renderer settings
     * @throws IllegalStateException if the output cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
