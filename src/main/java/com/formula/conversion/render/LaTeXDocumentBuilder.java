package com.formula.conversion.render;

import com.formula.conversion.api.ConversionOptions;

import java.nio.charset.Charset;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds a standalone LaTeX document around a single formula.
 *
 * <p>The document uses {@code scrartcl} with the configured font size and the
 * {@code preview} package with {@code tightpage}, so the resulting DVI page is
 * cropped to the formula and its dimensions appear in the LaTeX log.</p>
 */
public class LaTeXDocumentBuilder implements DocumentBuilder {

    private static final Pattern HEX_COLOR = Pattern.compile("[0-9A-Fa-f]{6}");

    @Override
    public String build(String formula, boolean displayMath, ConversionOptions options) {
        String body = formula.strip();
        StringBuilder document = new StringBuilder();
        document.append("\\documentclass[fontsize=").append(options.getFontSize())
                .append("pt, fleqn]{scrartcl}\n\n");
        document.append(encodingPreamble(body, options.getEncoding()));
        document.append("\\usepackage{amsmath, amssymb}\n");
        if (!options.getPreamble().isEmpty()) {
            document.append(options.getPreamble()).append('\n');
        }
        document.append("\\usepackage[dvipsnames]{xcolor}\n");
        document.append(colorDefinition("background", options.getBackgroundColor()));
        document.append(colorDefinition("foreground", options.getForegroundColor()));
        // preview must be the last package loaded
        document.append("\\usepackage[active,textmath,displaymath,tightpage]{preview}\n\n");
        document.append("\\begin{document}\n\\noindent%\n\\begin{preview}{");
        options.getBackgroundColor().ifPresent(color ->
                document.append("\\pagecolor{").append(colorReference("background", color)).append('}'));
        options.getForegroundColor().ifPresent(color ->
                document.append("\\color{").append(colorReference("foreground", color)).append('}'));

        Optional<String> environment = options.getMathsEnvironment();
        if (environment.isPresent()) {
            document.append("\\begin{").append(environment.get()).append('}')
                    .append(body)
                    .append("\\end{").append(environment.get()).append('}');
        } else {
            document.append(displayMath ? "\\[" : "\\(")
                    .append(body)
                    .append(displayMath ? "\\]" : "\\)");
        }
        document.append("}\\end{preview}\n\\end{document}\n");
        return document.toString();
    }

    /**
     * Maps a Java charset to the option name of the {@code inputenc} package.
     *
     * @throws IllegalArgumentException if LaTeX has no matching input encoding
     */
    static String inputEncodingName(Charset charset) {
        String name = charset.name().toLowerCase(Locale.ROOT);
        if (name.startsWith("utf") && name.contains("8")) {
            return "utf8";
        }
        if (name.startsWith("iso-8859") || name.startsWith("iso8859") || name.equals("latin1")) {
            return "latin1";
        }
        throw new IllegalArgumentException("encoding " + charset.name()
                + " is not supported by the LaTeX document; use UTF-8 or ISO-8859-1");
    }

    private static String encodingPreamble(String formula, Optional<Charset> encoding) {
        if (encoding.isEmpty()) {
            if (formula.chars().anyMatch(ch -> ch > 127)) {
                throw new IllegalArgumentException(
                        "formula contains non-ASCII characters but no encoding is configured: " + formula);
            }
            return "";
        }
        return "\\usepackage[T1]{fontenc}\n\\usepackage[" + inputEncodingName(encoding.get()) + "]{inputenc}\n";
    }

    private static String colorDefinition(String name, Optional<String> color) {
        if (color.isPresent() && HEX_COLOR.matcher(color.get()).matches()) {
            return "\\definecolor{" + name + "}{HTML}{" + color.get().toUpperCase(Locale.ROOT) + "}\n";
        }
        return "";
    }

    private static String colorReference(String name, String color) {
        return HEX_COLOR.matcher(color).matches() ? name : color;
    }
}
