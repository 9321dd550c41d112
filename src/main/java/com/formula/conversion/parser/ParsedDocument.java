package com.formula.conversion.parser;

import com.formula.conversion.core.model.FormulaRecord;

import java.nio.charset.Charset;
import java.util.List;

/**
 * Result of parsing a document.
 *
 * @param encoding the character encoding the document was decoded with
 * @param chunks   literal and formula chunks in document order
 */
public record ParsedDocument(Charset encoding, List<DocumentChunk> chunks) {

    public ParsedDocument {
        chunks = List.copyOf(chunks);
    }

    /**
     * Returns all formulas in document order.
     */
    public List<FormulaRecord> formulas() {
        return chunks.stream()
                .filter(DocumentChunk.Formula.class::isInstance)
                .map(chunk -> ((DocumentChunk.Formula) chunk).record())
                .toList();
    }
}
