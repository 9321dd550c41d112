package com.formula.conversion.render;

import com.formula.conversion.core.model.ImagePosition;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads image dimensions reported by the TeX toolchain.
 */
public final class DimensionParser {

    private static final Pattern DVIPNG_REPORT = Pattern.compile(
            "^ depth=(-?\\d+) height=(\\d+) width=(\\d+)", Pattern.MULTILINE);
    private static final Pattern PREVIEW_SNIPPET = Pattern.compile(
            "Preview: Snippet \\d+ ended\\.\\((\\d+)\\+(-?\\d+)x(\\d+)\\)");

    /** Scaled points per TeX point. */
    static final double SCALED_POINTS_PER_POINT = 65536.0;
    /** CSS pixels per TeX point (96 px per inch, 72.27 pt per inch). */
    static final double PIXELS_PER_POINT = 96.0 / 72.27;

    private DimensionParser() {
    }

    /**
     * Parses the report printed by {@code dvipng --depth* --height* --width*}, in pixels.
     */
    public static Optional<ImagePosition> fromDvipngOutput(String output) {
        if (output == null) {
            return Optional.empty();
        }
        Matcher matcher = DVIPNG_REPORT.matcher(output);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(ImagePosition.of(
                Double.parseDouble(matcher.group(2)),
                Double.parseDouble(matcher.group(3)),
                Double.parseDouble(matcher.group(1))));
    }

    /**
     * Parses the snippet dimensions the {@code preview} package writes to the LaTeX log.
     * The log gives height above the baseline plus depth, and width, in scaled points;
     * the returned position is in CSS pixels with the height covering the whole image.
     */
    public static Optional<ImagePosition> fromPreviewLog(String log) {
        if (log == null) {
            return Optional.empty();
        }
        Matcher matcher = PREVIEW_SNIPPET.matcher(log);
        if (!matcher.find()) {
            return Optional.empty();
        }
        double height = toPixels(Long.parseLong(matcher.group(1)));
        double depth = toPixels(Long.parseLong(matcher.group(2)));
        double width = toPixels(Long.parseLong(matcher.group(3)));
        return Optional.of(ImagePosition.of(round(height + depth), round(width), round(depth)));
    }

    private static double toPixels(long scaledPoints) {
        return scaledPoints / SCALED_POINTS_PER_POINT * PIXELS_PER_POINT;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
