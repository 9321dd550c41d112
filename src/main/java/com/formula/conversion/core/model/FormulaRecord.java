package com.formula.conversion.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One occurrence of a formula in a source document.
 *
 * @param position    where the formula starts, or {@code null} for inputs without textual positions
 * @param displayMath true for block-level maths, false for inline maths
 * @param rawText     the formula exactly as written
 */
public record FormulaRecord(SourcePosition position, boolean displayMath, String rawText) {

    public FormulaRecord {
        Objects.requireNonNull(rawText, "rawText is required");
    }

    public static FormulaRecord inline(String rawText) {
        return new FormulaRecord(null, false, rawText);
    }

    public static FormulaRecord display(String rawText) {
        return new FormulaRecord(null, true, rawText);
    }

    public Optional<SourcePosition> sourcePosition() {
        return Optional.ofNullable(position);
    }
}
