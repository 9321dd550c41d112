package com.formula.conversion.output;

import com.formula.conversion.core.model.ConversionResult;
import com.formula.conversion.core.model.FormulaRecord;
import com.formula.conversion.parser.DocumentChunk;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Reassembles a parsed document, replacing every formula with its image.
 */
public class HtmlDocumentWriter {

    private final HtmlImageFormatter formatter;

    public HtmlDocumentWriter(HtmlImageFormatter formatter) {
        this.formatter = Objects.requireNonNull(formatter, "formatter is required");
    }

    /**
     * Writes the document.
     *
     * @param chunks  literal and formula chunks in document order
     * @param results looks up the conversion result of a formula by text and style,
     *                e.g. {@code scheduler::getResult}
     * @throws IllegalStateException if a formula has no conversion result
     */
    public String write(List<DocumentChunk> chunks,
                        BiFunction<String, Boolean, Optional<ConversionResult>> results) {
        StringBuilder html = new StringBuilder();
        for (DocumentChunk chunk : chunks) {
            if (chunk instanceof DocumentChunk.Literal literal) {
                html.append(literal.text());
            } else if (chunk instanceof DocumentChunk.Formula formula) {
                FormulaRecord record = formula.record();
                ConversionResult result = results.apply(record.rawText(), record.displayMath())
                        .orElseThrow(() -> new IllegalStateException("no image for formula '"
                                + record.rawText() + "'" + record.sourcePosition().map(p -> " at " + p).orElse("")
                                + "; it was not converted"));
                html.append(formatter.format(result));
            }
        }
        return html.toString();
    }
}
