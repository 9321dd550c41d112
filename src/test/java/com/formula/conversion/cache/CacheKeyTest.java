package com.formula.conversion.cache;

import com.formula.conversion.core.model.FormulaRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyTest {

    @Test
    @DisplayName("Formulas differing only in spacing share a key")
    void spacingInsensitive() {
        assertEquals(CacheKey.of("a  +{}b", false), CacheKey.of(" a + b\t", false));
    }

    @Test
    @DisplayName("Style is part of the key")
    void styleSensitive() {
        assertNotEquals(CacheKey.of("x", false), CacheKey.of("x", true));
    }

    @Test
    @DisplayName("Key of a record uses its text and style")
    void fromRecord() {
        assertEquals(new CacheKey("x^2", true), CacheKey.of(FormulaRecord.display(" x^2 ")));
    }
}
