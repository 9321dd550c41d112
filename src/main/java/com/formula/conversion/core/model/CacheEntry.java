package com.formula.conversion.core.model;

/**
 * A cached conversion: where the image lives and how to place it.
 *
 * @param outputPath image path relative to the cache's base directory, always with '/' separators
 * @param position   layout metrics reported by the renderer
 */
public record CacheEntry(String outputPath, ImagePosition position) {
}
