package com.formula.conversion.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelValidationTest {

    @Test
    @DisplayName("Source positions are shown 1-based")
    void sourcePositionDisplay() {
        SourcePosition position = SourcePosition.of(0, 4);

        assertEquals(1, position.displayLine());
        assertEquals(5, position.displayColumn());
        assertEquals("line 1, column 5", position.toString());
        assertThrows(IllegalArgumentException.class, () -> SourcePosition.of(-1, 0));
    }

    @Test
    @DisplayName("Image size must not be negative, depth may be")
    void imagePositionValidation() {
        assertEquals(-2.5, ImagePosition.of(10, 10, -2.5).depth());
        assertThrows(IllegalArgumentException.class, () -> ImagePosition.of(-1, 10, 0));
        assertThrows(IllegalArgumentException.class, () -> ImagePosition.of(10, -1, 0));
    }

    @Test
    @DisplayName("Formula records without position")
    void formulaRecord() {
        FormulaRecord record = FormulaRecord.display("x");

        assertTrue(record.displayMath());
        assertTrue(record.sourcePosition().isEmpty());
        assertThrows(NullPointerException.class, () -> FormulaRecord.inline(null));
    }

    @Test
    @DisplayName("Conversion result exposes the entry metrics")
    void conversionResult() {
        CacheEntry entry = new CacheEntry("img/eqn000.svg", ImagePosition.of(12, 30, 3));

        ConversionResult result = ConversionResult.of(entry, "x^2", false);

        assertEquals("img/eqn000.svg", result.outputPath());
        assertEquals(12, result.height());
        assertEquals(30, result.width());
        assertEquals(3, result.depth());
        assertFalse(result.displayMath());
    }
}
