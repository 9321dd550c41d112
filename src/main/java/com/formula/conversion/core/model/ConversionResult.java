package com.formula.conversion.core.model;

/**
 * Everything a formatter needs to embed one converted formula.
 *
 * @param outputPath  image path relative to the output base directory
 * @param position    layout metrics of the image
 * @param formula     the formula text as requested by the caller
 * @param displayMath whether the formula was typeset as display maths
 */
public record ConversionResult(String outputPath, ImagePosition position, String formula, boolean displayMath) {

    public static ConversionResult of(CacheEntry entry, String formula, boolean displayMath) {
        return new ConversionResult(entry.outputPath(), entry.position(), formula, displayMath);
    }

    public double height() {
        return position.height();
    }

    public double width() {
        return position.width();
    }

    public double depth() {
        return position.depth();
    }
}
