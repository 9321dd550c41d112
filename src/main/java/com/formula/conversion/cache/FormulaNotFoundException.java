package com.formula.conversion.cache;

/**
 * Thrown when removing a formula that is not in the cache.
 */
public class FormulaNotFoundException extends RuntimeException {

    private final CacheKey key;

    public FormulaNotFoundException(CacheKey key) {
        super("formula '" + key.normalizedFormula() + "' (" + (key.displayMath() ? "display" : "inline")
                + ") not in cache");
        this.key = key;
    }

    public CacheKey getKey() {
        return key;
    }
}
