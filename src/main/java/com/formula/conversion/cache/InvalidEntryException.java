package com.formula.conversion.cache;

/**
 * Thrown when a caller tries to store an entry that can never be valid:
 * an empty formula, a missing position, or an empty or absolute image path.
 */
public class InvalidEntryException extends IllegalArgumentException {

    public InvalidEntryException(String message) {
        super(message);
    }
}
