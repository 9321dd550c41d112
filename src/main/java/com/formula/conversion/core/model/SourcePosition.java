package com.formula.conversion.core.model;

/**
 * Location of a formula in its source document.
 * Both coordinates count from 0; use {@link #displayLine()} and {@link #displayColumn()}
 * for messages shown to users.
 *
 * @param line   0-based line number
 * @param column 0-based column on that line
 */
public record SourcePosition(int line, int column) {

    public SourcePosition {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line and column must be >= 0");
        }
    }

    public static SourcePosition of(int line, int column) {
        return new SourcePosition(line, column);
    }

    public int displayLine() {
        return line + 1;
    }

    public int displayColumn() {
        return column + 1;
    }

    @Override
    public String toString() {
        return "line " + displayLine() + ", column " + displayColumn();
    }
}
