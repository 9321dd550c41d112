package com.formula.conversion.cache;

import com.formula.conversion.core.model.FormulaRecord;
import com.formula.conversion.rules.FormulaNormalizer;

/**
 * Identity of a cached formula: its normalized text plus the maths style.
 * The same text typeset inline and as display maths yields two different images.
 */
public record CacheKey(String normalizedFormula, boolean displayMath) {

    public static CacheKey of(String formula, boolean displayMath) {
        return new CacheKey(FormulaNormalizer.normalize(formula), displayMath);
    }

    public static CacheKey of(FormulaRecord record) {
        return of(record.rawText(), record.displayMath());
    }
}
