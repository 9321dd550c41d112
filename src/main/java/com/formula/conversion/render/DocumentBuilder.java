package com.formula.conversion.render;

import com.formula.conversion.api.ConversionOptions;

/**
 * Wraps a bare formula into the source document a {@link Renderer} expects.
 */
@FunctionalInterface
public interface DocumentBuilder {

    /**
     * Builds the document for one formula.
     *
     * @param formula     the formula text
     * @param displayMath whether to typeset as display maths
     * @param options     typesetting options such as font size, colours and preamble
     * @return the complete source document
     * @throws IllegalArgumentException if the formula cannot be typeset with these options
     */
    String build(String formula, boolean displayMath, ConversionOptions options);
}
