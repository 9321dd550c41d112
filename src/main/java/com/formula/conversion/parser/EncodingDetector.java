package com.formula.conversion.parser;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the declared character encoding from the header of an HTML document.
 * Recognizes the HTML5 {@code <meta charset="...">} form, the HTML4
 * {@code http-equiv} content type and the XML declaration.
 */
public final class EncodingDetector {

    /** Number of bytes inspected when no end of the head section is found. */
    static final int HEADER_SCAN_LIMIT = 8192;

    private static final Pattern META_CHARSET = Pattern.compile(
            "<meta\\s[^>]*?charset\\s*=\\s*[\"']?\\s*([A-Za-z0-9._:\\-]+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern XML_DECLARATION = Pattern.compile(
            "<\\?xml\\s[^>]*?encoding\\s*=\\s*[\"']([A-Za-z0-9._:\\-]+)[\"']",
            Pattern.CASE_INSENSITIVE);

    private EncodingDetector() {
        // utility class
    }

    /**
     * Detects the declared encoding.
     *
     * @param document raw document bytes
     * @return the declared charset
     * @throws ParseException if no declaration is present or the declared charset is unknown
     */
    public static Charset detect(byte[] document) throws ParseException {
        String header = header(document);
        String name = find(META_CHARSET, header);
        if (name == null) {
            name = find(XML_DECLARATION, header);
        }
        if (name == null) {
            throw new ParseException("no character encoding declared in the document header; "
                    + "add <meta charset=\"...\"> or configure an encoding explicitly");
        }
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ParseException("unsupported character encoding declared in the document: " + name);
        }
    }

    private static String header(byte[] document) {
        // ISO-8859-1 maps every byte to one char, so offsets stay meaningful for ASCII markup
        String text = new String(document, 0, Math.min(document.length, HEADER_SCAN_LIMIT * 4),
                StandardCharsets.ISO_8859_1);
        int headEnd = text.toLowerCase(Locale.ROOT).indexOf("</head>");
        if (headEnd >= 0) {
            return text.substring(0, headEnd);
        }
        return text.substring(0, Math.min(text.length(), HEADER_SCAN_LIMIT));
    }

    private static String find(Pattern pattern, String header) {
        Matcher matcher = pattern.matcher(header);
        return matcher.find() ? matcher.group(1) : null;
    }
}
