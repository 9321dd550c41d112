package com.formula.conversion.api;

import com.formula.conversion.cache.CacheFormatException;
import com.formula.conversion.cache.ImageCache;
import com.formula.conversion.core.model.ConversionResult;
import com.formula.conversion.core.model.FormulaRecord;
import com.formula.conversion.metrics.MetricsService;
import com.formula.conversion.metrics.NoOpMetricsService;
import com.formula.conversion.output.HtmlDocumentWriter;
import com.formula.conversion.output.HtmlImageFormatter;
import com.formula.conversion.parser.DocumentChunk;
import com.formula.conversion.parser.FormulaSpanParser;
import com.formula.conversion.parser.ParseException;
import com.formula.conversion.parser.ParsedDocument;
import com.formula.conversion.render.DocumentBuilder;
import com.formula.conversion.render.LaTeXDocumentBuilder;
import com.formula.conversion.render.LatexProcessRenderer;
import com.formula.conversion.render.Renderer;
import com.formula.conversion.scheduler.BatchSummary;
import com.formula.conversion.scheduler.ConversionException;
import com.formula.conversion.scheduler.ConversionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Entry point for converting documents with embedded {@code <eq>} formulas.
 * Wires the parser, the image cache of the output directory, the conversion
 * scheduler and the HTML output together.
 *
 * <pre>
 * FormulaConverter converter = FormulaConverter.builder()
 *         .outputDirectory(Path.of("site"))
 *         .options(ConversionOptions.builder().imageDirectory("img").build())
 *         .build();
 * String html = converter.convertDocument(Files.readAllBytes(Path.of("page.htex")));
 * </pre>
 */
public class FormulaConverter {
    private static final Logger log = LoggerFactory.getLogger(FormulaConverter.class);

    private final Path outputDirectory;
    private final ConversionOptions options;
    private final Function<ConversionOptions, Renderer> rendererFactory;
    private final DocumentBuilder documentBuilder;
    private final HtmlImageFormatter.Builder formatterBuilder;
    private final MetricsService metrics;
    private final FormulaSpanParser parser = new FormulaSpanParser();

    private FormulaConverter(Builder builder) {
        this.outputDirectory = builder.outputDirectory;
        this.options = builder.options;
        this.rendererFactory = builder.rendererFactory;
        this.documentBuilder = builder.documentBuilder;
        this.formatterBuilder = builder.formatterBuilder;
        this.metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Converts a document whose character encoding is declared in its header.
     * Unless the options set an encoding, formulas are typeset with the declared one.
     *
     * @return the document with every formula replaced by an image tag
     * @throws ParseException       if the encoding is not declared or the formula markup is malformed
     * @throws CacheFormatException if the image cache is unreadable and the cache policy is {@code FAIL}
     * @throws ConversionException  if a formula cannot be rendered
     * @throws InterruptedException if interrupted while waiting for the conversion
     */
    public String convertDocument(byte[] document)
            throws ParseException, CacheFormatException, ConversionException, InterruptedException {
        ParsedDocument parsed = options.getEncoding().isPresent()
                ? parser.parse(document, options.getEncoding().get())
                : parser.parse(document);
        ConversionOptions effective = options.getEncoding().isPresent()
                ? options : options.toBuilder().encoding(parsed.encoding()).build();
        return convertChunks(parsed.chunks(), effective);
    }

    /**
     * Converts an already decoded document.
     *
     * @see #convertDocument(byte[])
     */
    public String convertDocument(String document)
            throws ParseException, CacheFormatException, ConversionException, InterruptedException {
        return convertChunks(parser.parse(document), options);
    }

    /**
     * Converts formulas that do not come from a parsed document.
     *
     * @return one result per input formula, in input order
     */
    public List<ConversionResult> convertFormulas(List<FormulaRecord> formulas)
            throws CacheFormatException, ConversionException, InterruptedException {
        ConversionScheduler scheduler = newScheduler(options);
        scheduler.convertAll(formulas);
        List<ConversionResult> results = new ArrayList<>(formulas.size());
        for (FormulaRecord formula : formulas) {
            results.add(scheduler.getResult(formula.rawText(), formula.displayMath())
                    .orElseThrow(() -> new IllegalStateException("no image for formula '"
                            + formula.rawText() + "' after conversion")));
        }
        return results;
    }

    private String convertChunks(List<DocumentChunk> chunks, ConversionOptions effective)
            throws CacheFormatException, ConversionException, InterruptedException {
        List<FormulaRecord> formulas = chunks.stream()
                .filter(DocumentChunk.Formula.class::isInstance)
                .map(chunk -> ((DocumentChunk.Formula) chunk).record())
                .toList();
        ConversionScheduler scheduler = newScheduler(effective);
        BatchSummary summary = scheduler.convertAll(formulas);

        HtmlImageFormatter formatter = formatterBuilder.build();
        formatter.loadExclusionFile(outputDirectory.resolve(formatter.getExclusionFileName()));
        String html = new HtmlDocumentWriter(formatter).write(chunks, scheduler::getResult);
        formatter.writeExclusionFile(outputDirectory);
        log.info("document.converted formulas={} converted={} cacheHits={}",
                summary.totalFormulas(), summary.converted(), summary.cacheHits());
        return html;
    }

    private ConversionScheduler newScheduler(ConversionOptions effective) throws CacheFormatException {
        Path imageDirectory = effective.getImageDirectory().isEmpty()
                ? outputDirectory : outputDirectory.resolve(effective.getImageDirectory());
        ImageCache cache = ImageCache.open(imageDirectory.resolve(ImageCache.CACHE_FILE_NAME),
                outputDirectory, effective.getCachePolicy());
        return ConversionScheduler.builder()
                .cache(cache)
                .renderer(rendererFactory.apply(effective))
                .documentBuilder(documentBuilder)
                .options(effective)
                .baseDirectory(outputDirectory)
                .metrics(metrics)
                .build();
    }

    /**
     * Builder for {@link FormulaConverter}. Only the output directory is required;
     * formulas are rendered with {@link LatexProcessRenderer} unless another renderer is given.
     */
    public static class Builder {
        private Path outputDirectory;
        private ConversionOptions options = ConversionOptions.defaults();
        private Function<ConversionOptions, Renderer> rendererFactory = LatexProcessRenderer::new;
        private DocumentBuilder documentBuilder = new LaTeXDocumentBuilder();
        private HtmlImageFormatter.Builder formatterBuilder = HtmlImageFormatter.builder();
        private MetricsService metrics = new NoOpMetricsService();

        /**
         * Directory of the output document; image paths in the output are relative to it.
         */
        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder options(ConversionOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder renderer(Renderer renderer) {
            Objects.requireNonNull(renderer, "renderer is required");
            this.rendererFactory = effective -> renderer;
            return this;
        }

        public Builder documentBuilder(DocumentBuilder documentBuilder) {
            this.documentBuilder = Objects.requireNonNull(documentBuilder, "documentBuilder is required");
            return this;
        }

        /**
         * Settings of the HTML output; a new formatter is built for every converted document.
         */
        public Builder formatter(HtmlImageFormatter.Builder formatterBuilder) {
            this.formatterBuilder = Objects.requireNonNull(formatterBuilder, "formatterBuilder is required");
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics is required");
            return this;
        }

        public FormulaConverter build() {
            Objects.requireNonNull(outputDirectory, "outputDirectory is required");
            return new FormulaConverter(this);
        }
    }
}
