package com.formula.conversion.render;

import java.nio.file.Path;

/**
 * Turns one typesetting document into an image file.
 * Implementations must fail rather than hang when the underlying tool stops responding.
 */
public interface Renderer {

    /**
     * Renders the document.
     *
     * @param documentSource complete source document as produced by a {@link DocumentBuilder}
     * @param outputBasePath output path without file extension; the renderer appends its own
     * @return layout metrics and the produced file
     * @throws RenderException with the tool's diagnostic output if rendering fails
     */
    RenderResult render(String documentSource, Path outputBasePath) throws RenderException;
}
