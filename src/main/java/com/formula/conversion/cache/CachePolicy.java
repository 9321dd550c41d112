package com.formula.conversion.cache;

/**
 * What to do when an existing cache file cannot be used.
 */
public enum CachePolicy {
    /** Report the problem as a {@link CacheFormatException}. */
    FAIL,
    /** Delete the cache file and all generated images next to it, then start empty. */
    DISCARD_AND_REBUILD
}
