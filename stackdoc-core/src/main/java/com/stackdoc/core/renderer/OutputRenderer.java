package com.stackdoc.core.renderer;

/**
 * Writes the files of a documentation run to a destination.
 *
 * <p>Implementations report I/O failures as {@link IllegalStateException}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the renderer identifier, lowercase (e.g., "filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    void render(GeneratedOutput output, RenderContext context);
}
