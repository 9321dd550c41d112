package com.formula.conversion.parser;

import com.formula.conversion.core.model.SourcePosition;

import java.util.Optional;

/**
 * Thrown when a document cannot be split into literal text and formulas:
 * unclosed or nested formula tags, unterminated comments, or a missing
 * encoding declaration.
 */
public class ParseException extends Exception {

    private final SourcePosition position;

    public ParseException(String message, SourcePosition position) {
        super(position != null ? message + " (" + position + ")" : message);
        this.position = position;
    }

    public ParseException(String message) {
        this(message, null);
    }

    /**
     * Position of the offending marker, if the failure can be tied to one.
     */
    public Optional<SourcePosition> getPosition() {
        return Optional.ofNullable(position);
    }
}
