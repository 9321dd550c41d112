package com.formula.conversion.scheduler;

import com.formula.conversion.core.model.SourcePosition;

import java.util.Optional;

/**
 * A formula of a batch could not be converted.
 * Carries everything a user needs to find the formula: its ordinal among all
 * formulas of the document, its source position when known, its text and the
 * renderer's diagnostic.
 */
public class ConversionException extends Exception {

    private final String diagnostic;
    private final String formula;
    private final int ordinal;
    private final SourcePosition position;

    public ConversionException(String diagnostic, String formula, int ordinal, SourcePosition position) {
        this(diagnostic, formula, ordinal, position, null);
    }

    public ConversionException(String diagnostic, String formula, int ordinal, SourcePosition position,
                               Throwable cause) {
        super(formatMessage(diagnostic, ordinal, position), cause);
        this.diagnostic = diagnostic;
        this.formula = formula;
        this.ordinal = ordinal;
        this.position = position;
    }

    /**
     * The renderer's diagnostic, unchanged.
     */
    public String getDiagnostic() {
        return diagnostic;
    }

    public String getFormula() {
        return formula;
    }

    /**
     * 1-based position of the formula among all formulas of the batch.
     */
    public int getOrdinal() {
        return ordinal;
    }

    public Optional<SourcePosition> getPosition() {
        return Optional.ofNullable(position);
    }

    private static String formatMessage(String diagnostic, int ordinal, SourcePosition position) {
        if (position == null) {
            return "Conversion failed for formula no. " + ordinal + ": " + diagnostic;
        }
        return "Conversion failed for formula no. " + ordinal + " at " + position + ": " + diagnostic;
    }
}
