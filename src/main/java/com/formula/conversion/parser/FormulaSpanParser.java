package com.formula.conversion.parser;

import com.formula.conversion.core.model.FormulaRecord;
import com.formula.conversion.core.model.SourcePosition;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an HTML-like document into literal text and {@code <eq>} formula spans.
 *
 * <p>Only comments and formula tags are recognized; all other markup is copied
 * through untouched, so the parser never fails on markup it does not understand.
 * Joining all literal chunks, with a placeholder for each formula, reproduces
 * the input exactly.</p>
 *
 * <pre>
 * List&lt;DocumentChunk&gt; chunks = new FormulaSpanParser().parse("&lt;p&gt;&lt;eq env=\"displaymath\"&gt;a^2&lt;/eq&gt;&lt;/p&gt;");
 * // [Literal("&lt;p&gt;"), Formula(display, "a^2"), Literal("&lt;/p&gt;")]
 * </pre>
 */
public class FormulaSpanParser {
    private static final Logger log = LoggerFactory.getLogger(FormulaSpanParser.class);

    static final String COMMENT_OPEN = "<!--";
    static final String COMMENT_CLOSE = "-->";
    static final String DISPLAY_STYLE = "displaymath";

    private static final Pattern FORMULA_OPEN = Pattern.compile("<eq(?=[\\s>/])[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern FORMULA_CLOSE = Pattern.compile("</\\s*eq\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARTIAL_CLOSE = Pattern.compile("</\\s*eq\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENV_ATTRIBUTE = Pattern.compile(
            "\\benv\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>/]+))", Pattern.CASE_INSENSITIVE);

    /**
     * Parses a document whose encoding is declared in its header.
     *
     * @throws ParseException if the encoding is missing or unknown, or the markup is malformed
     */
    public ParsedDocument parse(byte[] document) throws ParseException {
        Objects.requireNonNull(document, "document is required");
        Charset encoding = EncodingDetector.detect(document);
        log.debug("parser.encoding detected={}", encoding.name());
        return parse(document, encoding);
    }

    /**
     * Parses a document using the given encoding, ignoring any declaration in the document.
     */
    public ParsedDocument parse(byte[] document, Charset encoding) throws ParseException {
        Objects.requireNonNull(document, "document is required");
        Objects.requireNonNull(encoding, "encoding is required");
        return new ParsedDocument(encoding, parse(new String(document, encoding)));
    }

    /**
     * Parses an already decoded document.
     *
     * @return literal and formula chunks in document order
     * @throws ParseException on unclosed comments, unclosed or nested formula tags
     */
    public List<DocumentChunk> parse(String document) throws ParseException {
        Objects.requireNonNull(document, "document is required");
        LineIndex lines = new LineIndex(document);
        List<DocumentChunk> chunks = new ArrayList<>();
        Matcher open = FORMULA_OPEN.matcher(document);
        int literalStart = 0;
        int cursor = 0;
        int formulaCount = 0;
        // next marker offsets, -1 once none is left; searched again only when the cursor passed them
        int comment = document.indexOf(COMMENT_OPEN);
        int formula = open.find() ? open.start() : -1;

        while (cursor < document.length()) {
            if (comment >= 0 && comment < cursor) {
                comment = document.indexOf(COMMENT_OPEN, cursor);
            }
            if (formula >= 0 && formula < cursor) {
                formula = open.find(cursor) ? open.start() : -1;
            }
            if (comment < 0 && formula < 0) {
                break;
            }

            if (comment >= 0 && (formula < 0 || comment < formula)) {
                int close = document.indexOf(COMMENT_CLOSE, comment + COMMENT_OPEN.length());
                if (close < 0) {
                    throw new ParseException("malformed comment: no closing -->", lines.positionOf(comment));
                }
                cursor = close + COMMENT_CLOSE.length();
                addLiteral(chunks, document, literalStart, comment);
                addLiteral(chunks, document, comment, cursor);
                literalStart = cursor;
                continue;
            }

            int bodyStart = open.end();
            Span close = findClose(document, formula, bodyStart, lines);
            String openingTag = document.substring(formula, bodyStart);
            String body = Parser.unescapeEntities(document.substring(bodyStart, close.start()), false);

            addLiteral(chunks, document, literalStart, formula);
            chunks.add(DocumentChunk.formula(
                    new FormulaRecord(lines.positionOf(formula), isDisplayStyle(openingTag), body)));
            formulaCount++;
            cursor = close.end();
            literalStart = cursor;
        }

        addLiteral(chunks, document, literalStart, document.length());
        log.debug("parser.completed chunks={} formulas={}", chunks.size(), formulaCount);
        return chunks;
    }

    private Span findClose(String document, int formulaStart, int bodyStart, LineIndex lines)
            throws ParseException {
        Matcher close = FORMULA_CLOSE.matcher(document);
        Matcher nested = FORMULA_OPEN.matcher(document);
        boolean closed = close.find(bodyStart);
        boolean hasNested = nested.find(bodyStart);

        if (!closed) {
            Matcher partial = PARTIAL_CLOSE.matcher(document);
            if (partial.find(bodyStart) && (!hasNested || partial.start() < nested.start())) {
                throw new ParseException("malformed closing formula tag", lines.positionOf(partial.start()));
            }
            if (hasNested) {
                throw new ParseException("unclosed formula: another formula starts at "
                        + lines.positionOf(nested.start()) + " before this one is closed",
                        lines.positionOf(formulaStart));
            }
            throw new ParseException("unclosed formula", lines.positionOf(formulaStart));
        }
        if (hasNested && nested.start() < close.start()) {
            throw new ParseException("invalid nesting: formula opened inside another formula",
                    lines.positionOf(nested.start()));
        }
        return new Span(close.start(), close.end());
    }

    static boolean isDisplayStyle(String openingTag) {
        Matcher env = ENV_ATTRIBUTE.matcher(openingTag);
        if (!env.find()) {
            return false;
        }
        String value = env.group(1) != null ? env.group(1)
                : env.group(2) != null ? env.group(2) : env.group(3);
        return DISPLAY_STYLE.equals(value.strip().toLowerCase(Locale.ROOT));
    }

    private static void addLiteral(List<DocumentChunk> chunks, String document, int start, int end) {
        if (end > start) {
            chunks.add(DocumentChunk.literal(document.substring(start, end)));
        }
    }

    private record Span(int start, int end) {}

    /**
     * Maps character offsets to 0-based line and column numbers.
     */
    static final class LineIndex {
        private final int[] lineStarts;

        LineIndex(String text) {
            int[] starts = new int[16];
            int count = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    if (count == starts.length) {
                        starts = Arrays.copyOf(starts, count * 2);
                    }
                    starts[count++] = i + 1;
                }
            }
            this.lineStarts = Arrays.copyOf(starts, count);
        }

        SourcePosition positionOf(int offset) {
            int line = Arrays.binarySearch(lineStarts, offset);
            if (line < 0) {
                line = -line - 2;
            }
            return SourcePosition.of(line, offset - lineStarts[line]);
        }
    }
}
