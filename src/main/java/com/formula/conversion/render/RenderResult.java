package com.formula.conversion.render;

import com.formula.conversion.core.model.ImagePosition;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of a successful render.
 *
 * @param position     layout metrics of the image
 * @param producedFile the image file written by the renderer
 */
public record RenderResult(ImagePosition position, Path producedFile) {

    public RenderResult {
        Objects.requireNonNull(position, "position is required");
        Objects.requireNonNull(producedFile, "producedFile is required");
    }
}
