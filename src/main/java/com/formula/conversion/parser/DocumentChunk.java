package com.formula.conversion.parser;

import com.formula.conversion.core.model.FormulaRecord;

import java.util.Objects;

/**
 * A piece of a parsed document: either literal text to be copied verbatim,
 * or a formula to be replaced by its image.
 */
public sealed interface DocumentChunk permits DocumentChunk.Literal, DocumentChunk.Formula {

    static Literal literal(String text) {
        return new Literal(text);
    }

    static Formula formula(FormulaRecord record) {
        return new Formula(record);
    }

    /**
     * Text outside of any formula, including comments and the markup around formulas.
     */
    record Literal(String text) implements DocumentChunk {
        public Literal {
            Objects.requireNonNull(text, "text is required");
        }
    }

    /**
     * A formula span; the surrounding formula tags are not part of the document anymore.
     */
    record Formula(FormulaRecord record) implements DocumentChunk {
        public Formula {
            Objects.requireNonNull(record, "record is required");
        }
    }
}
