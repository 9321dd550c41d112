package com.formula.conversion.output;

import com.formula.conversion.core.model.ConversionResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Formats converted formulas as HTML {@code <img>} tags.
 *
 * <p>The formula text becomes the alt text, with spacing and sizing commands removed
 * since they only distract screen reader users. When long formulas are excluded, the
 * image links to an exclusion file holding the full formula, and the alt text is
 * shortened.</p>
 *
 * <p>Not thread-safe; one formatter is used per output document.</p>
 */
public class HtmlImageFormatter {
    private static final Logger log = LoggerFactory.getLogger(HtmlImageFormatter.class);

    public static final String DEFAULT_EXCLUSION_FILE_NAME = "excluded-descriptions.html";
    static final int MAX_LABEL_LENGTH = 150;
    static final String LABEL_PREFIX = "form";

    static final List<String> FORMATTING_COMMANDS = List.of(
            "\\ ", "\\,", "\\;", "\\big", "\\Big", "\\left", "\\right", "\\limits");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile(" {2,}");
    private static final String EXCLUSION_FILE_HEAD = "<!DOCTYPE html>\n<html>\n<head>\n"
            + "<meta charset=\"UTF-8\">\n<title>Excluded Formulas</title>\n</head>\n"
            + "<!-- generated file, changes will be overwritten -->\n<body>\n";

    private final String urlPrefix;
    private final String inlineMathClass;
    private final String displayMathClass;
    private final boolean excludeLongFormulas;
    private final int maxAltLength;
    private final String exclusionFileName;
    private final Map<String, String> excludedFormulas = new LinkedHashMap<>();
    private final Document shell;

    private HtmlImageFormatter(Builder builder) {
        this.urlPrefix = builder.urlPrefix;
        this.inlineMathClass = builder.inlineMathClass;
        this.displayMathClass = builder.displayMathClass;
        this.excludeLongFormulas = builder.excludeLongFormulas;
        this.maxAltLength = builder.maxAltLength;
        this.exclusionFileName = builder.exclusionFileName;
        this.shell = Document.createShell("");
        this.shell.outputSettings().prettyPrint(false);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the HTML for one converted formula.
     */
    public String format(ConversionResult result) {
        Objects.requireNonNull(result, "result is required");
        String altText = readableText(result.formula());
        boolean exclude = excludeLongFormulas && result.formula().length() > maxAltLength;
        if (exclude) {
            altText = shorten(altText);
        }

        Element img = shell.createElement("img")
                .attr("src", imageUrl(result.outputPath()))
                .attr("alt", altText)
                .attr("height", formatNumber(result.height()))
                .attr("width", formatNumber(result.width()))
                .attr("style", "vertical-align: " + formatNumber(-result.depth()) + "px")
                .attr("class", result.displayMath() ? displayMathClass : inlineMathClass);
        if (!exclude) {
            return render(img);
        }

        String label = registerExcluded(result.formula());
        Element link = shell.createElement("a").attr("href", exclusionFileName + "#" + label);
        link.appendChild(img);
        return render(link);
    }

    /**
     * Loads the formulas of an exclusion file written by an earlier run, so that
     * writing the file again keeps them.
     *
     * @return number of formulas read; 0 if the file does not exist
     */
    public int loadExclusionFile(Path file) {
        if (!Files.exists(file)) {
            return 0;
        }
        try {
            Document document = Jsoup.parse(file.toFile(), StandardCharsets.UTF_8.name());
            int loaded = 0;
            for (Element entry : document.select("div[id]")) {
                Element pre = entry.selectFirst("pre");
                if (pre != null && !excludedFormulas.containsKey(entry.id())) {
                    excludedFormulas.put(entry.id(), pre.wholeText());
                    loaded++;
                }
            }
            log.debug("exclusions.loaded path={} formulas={}", file, loaded);
            return loaded;
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read exclusion file " + file, e);
        }
    }

    /**
     * Writes all excluded formulas to {@code directory/exclusionFileName}.
     * Nothing is written if no formula was excluded.
     *
     * @return true if the file was written
     */
    public boolean writeExclusionFile(Path directory) {
        if (excludedFormulas.isEmpty()) {
            return false;
        }
        Path file = directory.resolve(exclusionFileName);
        StringBuilder html = new StringBuilder(EXCLUSION_FILE_HEAD);
        for (Map.Entry<String, String> entry : excludedFormulas.entrySet()) {
            Element div = shell.createElement("div").attr("id", entry.getKey());
            div.appendElement("pre").text(entry.getValue());
            html.append(render(div)).append('\n');
        }
        html.append("</body>\n</html>\n");
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, html, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write exclusion file " + file, e);
        }
        log.info("exclusions.written path={} formulas={}", file, excludedFormulas.size());
        return true;
    }

    /**
     * Excluded formulas by label, in the order they were first seen.
     */
    public Map<String, String> getExcludedFormulas() {
        return Collections.unmodifiableMap(excludedFormulas);
    }

    public String getExclusionFileName() {
        return exclusionFileName;
    }

    /**
     * Derives an HTML id from a formula. Letters and digits are kept; braces, parentheses,
     * backslashes and carets are mapped to {@code _ - . ,}; everything else is dropped.
     * Repeated mapped characters collapse into one, and a label not starting with a
     * letter is prefixed with {@value #LABEL_PREFIX}.
     */
    public static String generateLabel(String formula) {
        StringBuilder label = new StringBuilder();
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            char mapped = mapLabelCharacter(c);
            if (mapped != 0) {
                if (label.length() == 0 || label.charAt(label.length() - 1) != mapped) {
                    label.append(mapped);
                }
            } else if (c < 128 && Character.isLetterOrDigit(c)) {
                label.append(c);
            }
        }
        if (label.length() == 0 || !Character.isLetter(label.charAt(0))) {
            label.insert(0, LABEL_PREFIX);
        }
        return label.length() > MAX_LABEL_LENGTH ? label.substring(0, MAX_LABEL_LENGTH) : label.toString();
    }

    private static char mapLabelCharacter(char c) {
        switch (c) {
            case '{':
            case '}':
                return '_';
            case '(':
            case ')':
                return '-';
            case '\\':
                return '.';
            case '^':
                return ',';
            default:
                return 0;
        }
    }

    /**
     * Removes formatting-only commands such as {@code \,} or {@code \left} from a formula.
     * Commands preceded by a backslash, or followed by letters that make them part of a
     * longer command, are left alone.
     */
    public static String readableText(String formula) {
        String text = formula;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String command : FORMATTING_COMMANDS) {
                int index = indexOfFormattingCommand(text, command);
                if (index >= 0) {
                    text = text.substring(0, index) + " " + text.substring(index + command.length());
                    changed = true;
                }
            }
        }
        return MULTIPLE_SPACES.matcher(text).replaceAll(" ").strip();
    }

    private static int indexOfFormattingCommand(String text, String command) {
        int from = 0;
        while (true) {
            int index = text.indexOf(command, from);
            if (index < 0) {
                return -1;
            }
            int end = index + command.length();
            boolean escaped = index > 0 && text.charAt(index - 1) == '\\';
            boolean complete = !Character.isLetter(command.charAt(command.length() - 1))
                    || end >= text.length() || !Character.isLetter(text.charAt(end));
            if (!escaped && complete) {
                return index;
            }
            from = index + 1;
        }
    }

    private String render(Element element) {
        // attached elements serialize with the shell's output settings
        shell.body().appendChild(element);
        String html = element.outerHtml();
        element.remove();
        return html;
    }

    private String registerExcluded(String formula) {
        String base = generateLabel(formula);
        String label = base;
        int suffix = 2;
        while (excludedFormulas.containsKey(label) && !excludedFormulas.get(label).equals(formula)) {
            label = base + "-" + suffix++;
        }
        excludedFormulas.putIfAbsent(label, formula);
        return label;
    }

    private String shorten(String text) {
        return text.length() > maxAltLength ? text.substring(0, maxAltLength) + "..." : text;
    }

    private String imageUrl(String outputPath) {
        if (urlPrefix.isEmpty()) {
            return outputPath;
        }
        String path = outputPath.startsWith("/") ? outputPath.substring(1) : outputPath;
        return urlPrefix + "/" + path;
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /**
     * Builder for {@link HtmlImageFormatter}.
     */
    public static class Builder {
        private String urlPrefix = "";
        private String inlineMathClass = "inlinemath";
        private String displayMathClass = "displaymath";
        private boolean excludeLongFormulas = false;
        private int maxAltLength = 100;
        private String exclusionFileName = DEFAULT_EXCLUSION_FILE_NAME;

        /**
         * Prefix prepended to image paths, e.g. {@code https://example.org/img}. Trailing
         * slashes are removed so that no double slash appears in the URL.
         */
        public Builder urlPrefix(String urlPrefix) {
            String prefix = urlPrefix == null ? "" : urlPrefix.strip();
            while (prefix.endsWith("/")) {
                prefix = prefix.substring(0, prefix.length() - 1);
            }
            this.urlPrefix = prefix;
            return this;
        }

        public Builder inlineMathClass(String inlineMathClass) {
            this.inlineMathClass = requireText(inlineMathClass, "inlineMathClass");
            return this;
        }

        public Builder displayMathClass(String displayMathClass) {
            this.displayMathClass = requireText(displayMathClass, "displayMathClass");
            return this;
        }

        public Builder excludeLongFormulas(boolean excludeLongFormulas) {
            this.excludeLongFormulas = excludeLongFormulas;
            return this;
        }

        public Builder maxAltLength(int maxAltLength) {
            if (maxAltLength <= 0) {
                throw new IllegalArgumentException("maxAltLength must be positive");
            }
            this.maxAltLength = maxAltLength;
            return this;
        }

        public Builder exclusionFileName(String exclusionFileName) {
            this.exclusionFileName = requireText(exclusionFileName, "exclusionFileName");
            return this;
        }

        public HtmlImageFormatter build() {
            return new HtmlImageFormatter(this);
        }

        private static String requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
            return value.strip();
        }
    }
}
