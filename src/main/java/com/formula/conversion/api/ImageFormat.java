package com.formula.conversion.api;

/**
 * Output format of formula images.
 */
public enum ImageFormat {
    SVG("svg"),
    PNG("png");

    private final String extension;

    ImageFormat(String extension) {
        this.extension = extension;
    }

    /**
     * File extension without the leading dot.
     */
    public String extension() {
        return extension;
    }
}
