package com.formula.conversion.core.model;

/**
 * Layout metrics of a rendered formula image, in pixels.
 * The depth is the distance from the baseline to the bottom of the image and is
 * used as a negative vertical offset when the image is embedded inline.
 *
 * @param height image height
 * @param width  image width
 * @param depth  baseline offset, may be negative
 */
public record ImagePosition(double height, double width, double depth) {

    public ImagePosition {
        if (height < 0 || width < 0) {
            throw new IllegalArgumentException("height and width must be >= 0");
        }
    }

    public static ImagePosition of(double height, double width, double depth) {
        return new ImagePosition(height, width, depth);
    }
}
