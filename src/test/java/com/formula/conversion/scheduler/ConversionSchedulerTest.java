package com.formula.conversion.scheduler;

import com.formula.conversion.api.ConversionOptions;
import com.formula.conversion.cache.CachePolicy;
import com.formula.conversion.cache.ImageCache;
import com.formula.conversion.core.model.ConversionResult;
import com.formula.conversion.core.model.FormulaRecord;
import com.formula.conversion.core.model.ImagePosition;
import com.formula.conversion.core.model.SourcePosition;
import com.formula.conversion.metrics.MicrometerMetricsService;
import com.formula.conversion.render.DocumentBuilder;
import com.formula.conversion.render.LaTeXDocumentBuilder;
import com.formula.conversion.render.RenderException;
import com.formula.conversion.render.RenderResult;
import com.formula.conversion.render.Renderer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConversionScheduler Tests")
class ConversionSchedulerTest {

    /** Passes the formula through so the fake renderer can see it. */
    private static final DocumentBuilder PLAIN_DOCUMENT = (formula, displayMath, options) ->
            (displayMath ? "display:" : "inline:") + formula.strip();

    @TempDir
    Path base;

    private ImageCache cache;
    private FakeRenderer renderer;
    private ConversionOptions options;

    @BeforeEach
    void setUp() throws Exception {
        cache = openCache();
        renderer = new FakeRenderer();
        options = ConversionOptions.builder().imageDirectory("img").workerCount(4).build();
    }

    private ImageCache openCache() throws Exception {
        return ImageCache.open(base.resolve("img").resolve(ImageCache.CACHE_FILE_NAME), base, CachePolicy.FAIL);
    }

    private ConversionScheduler.Builder schedulerBuilder() {
        return ConversionScheduler.builder()
                .cache(cache)
                .renderer(renderer)
                .documentBuilder(PLAIN_DOCUMENT)
                .options(options)
                .baseDirectory(base);
    }

    private ConversionScheduler scheduler() {
        return schedulerBuilder().build();
    }

    /**
     * Writes a small file per render and records how often each document was rendered.
     */
    static class FakeRenderer implements Renderer {
        final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        final Set<String> failing = ConcurrentHashMap.newKeySet();
        volatile long delayMillis = 0;

        @Override
        public RenderResult render(String documentSource, Path outputBasePath) throws RenderException {
            calls.computeIfAbsent(documentSource, k -> new AtomicInteger()).incrementAndGet();
            if (failing.contains(documentSource)) {
                throw new RenderException("! Undefined control sequence in " + documentSource);
            }
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RenderException("interrupted");
                }
            }
            Path image = outputBasePath.resolveSibling(outputBasePath.getFileName() + ".svg");
            try {
                Files.writeString(image, documentSource);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return new RenderResult(ImagePosition.of(12, 20 + documentSource.length(), 3), image);
        }

        int totalCalls() {
            return calls.values().stream().mapToInt(AtomicInteger::get).sum();
        }

        int callsFor(String documentSource) {
            AtomicInteger count = calls.get(documentSource);
            return count == null ? 0 : count.get();
        }
    }

    @Nested
    @DisplayName("Conversion")
    class ConversionTests {

        @Test
        @DisplayName("Converts every formula and caches the result")
        void convertsAll() throws Exception {
            ConversionScheduler scheduler = scheduler();

            BatchSummary summary = scheduler.convertAll(List.of(
                    FormulaRecord.inline("a"), FormulaRecord.inline("b"), FormulaRecord.display("c")));

            assertEquals(new BatchSummary(3, 0, 0, 3), summary);
            for (String formula : List.of("a", "b")) {
                ConversionResult result = scheduler.getResult(formula, false).orElseThrow();
                assertTrue(result.outputPath().startsWith("img/eqn"));
                assertTrue(Files.exists(base.resolve(result.outputPath())));
                assertEquals(formula, result.formula());
            }
            assertTrue(scheduler.getResult("c", true).orElseThrow().displayMath());
            assertTrue(openCache().contains("c", true));
        }

        @Test
        @DisplayName("Creates a missing image directory before converting")
        void createsImageDirectory() throws Exception {
            options = ConversionOptions.builder().imageDirectory("deep/nested/img").build();

            scheduler().convertAll(List.of(FormulaRecord.inline("x")));

            assertTrue(Files.isDirectory(base.resolve("deep/nested/img")));
            assertTrue(Files.exists(base.resolve("deep/nested/img/eqn000.svg")));
        }

        @Test
        @DisplayName("New images do not overwrite existing files")
        void collisionFreeNames() throws Exception {
            Files.createDirectories(base.resolve("img"));
            Files.writeString(base.resolve("img/eqn000.svg"), "old");
            Files.writeString(base.resolve("img/eqn001.svg"), "old");
            ConversionScheduler scheduler = scheduler();

            scheduler.convertAll(List.of(FormulaRecord.inline("new")));

            assertEquals("img/eqn002.svg", scheduler.getResult("new", false).orElseThrow().outputPath());
            assertEquals("old", Files.readString(base.resolve("img/eqn000.svg")));
        }

        @Test
        @DisplayName("Empty batch renders nothing")
        void emptyBatch() throws Exception {
            assertEquals(BatchSummary.empty(), scheduler().convertAll(List.of()));
            assertEquals(0, renderer.totalCalls());
        }

        @Test
        @DisplayName("Formula spelled like a reserved cache field converts and persists")
        void reservedFieldNameFormula() throws Exception {
            ConversionScheduler scheduler = scheduler();

            BatchSummary summary = scheduler.convertAll(List.of(
                    FormulaRecord.inline(ImageCache.VERSION_FIELD), FormulaRecord.inline("y")));

            assertEquals(2, summary.converted());
            assertTrue(openCache().contains(ImageCache.VERSION_FIELD, false));
            assertTrue(openCache().contains("y", false));
        }
    }

    @Nested
    @DisplayName("Deduplication")
    class DeduplicationTests {

        @Test
        @DisplayName("Identical formulas in one batch are rendered once")
        void atMostOnce() throws Exception {
            ConversionScheduler scheduler = scheduler();

            BatchSummary summary = scheduler.convertAll(List.of(
                    FormulaRecord.inline("x^2"), FormulaRecord.inline("x^2"), FormulaRecord.inline(" x^2\t")));

            assertEquals(1, renderer.totalCalls());
            assertEquals(2, summary.duplicates());
            assertEquals(scheduler.getResult("x^2", false).orElseThrow().outputPath(),
                    scheduler.getResult(" x^2\t", false).orElseThrow().outputPath());
        }

        @Test
        @DisplayName("Many duplicates across many workers still render once each")
        void atMostOnceUnderConcurrency() throws Exception {
            options = ConversionOptions.builder().imageDirectory("img").workerCount(8).build();
            List<FormulaRecord> formulas = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                formulas.add(FormulaRecord.inline("f_" + (i % 5)));
            }

            scheduler().convertAll(formulas);

            for (int i = 0; i < 5; i++) {
                assertEquals(1, renderer.callsFor("inline:f_" + i));
            }
        }

        @Test
        @DisplayName("Inline and display versions are rendered separately")
        void styleSensitive() throws Exception {
            ConversionScheduler scheduler = scheduler();

            scheduler.convertAll(List.of(FormulaRecord.inline("x"), FormulaRecord.display("x")));

            assertEquals(2, renderer.totalCalls());
            assertNotEquals(scheduler.getResult("x", false).orElseThrow().outputPath(),
                    scheduler.getResult("x", true).orElseThrow().outputPath());
        }

        @Test
        @DisplayName("Cached formulas are not rendered again")
        void cacheHitsSkipped() throws Exception {
            scheduler().convertAll(List.of(FormulaRecord.inline("a"), FormulaRecord.display("b")));
            renderer.calls.clear();
            cache = openCache();

            BatchSummary summary = scheduler().convertAll(List.of(
                    FormulaRecord.inline("a"), FormulaRecord.display("b"), FormulaRecord.inline("c")));

            assertEquals(new BatchSummary(3, 2, 0, 1), summary);
            assertEquals(1, renderer.totalCalls());
            assertEquals(1, renderer.callsFor("inline:c"));
        }

        @Test
        @DisplayName("Formula whose image was deleted is rendered again")
        void staleEntryRerendered() throws Exception {
            ConversionScheduler first = scheduler();
            first.convertAll(List.of(FormulaRecord.inline("a")));
            Files.delete(base.resolve(first.getResult("a", false).orElseThrow().outputPath()));
            renderer.calls.clear();

            scheduler().convertAll(List.of(FormulaRecord.inline("a")));

            assertEquals(1, renderer.callsFor("inline:a"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Completed work survives a failure in the same batch")
        void partialFailureDurability() throws Exception {
            options = ConversionOptions.builder().imageDirectory("img").workerCount(1).build();
            renderer.failing.add("inline:f3");

            ConversionException e = assertThrows(ConversionException.class, () -> scheduler().convertAll(List.of(
                    FormulaRecord.inline("f1"), FormulaRecord.inline("f2"),
                    FormulaRecord.inline("f3"), FormulaRecord.inline("f4"))));

            assertEquals(3, e.getOrdinal());
            assertEquals("f3", e.getFormula());
            assertEquals("! Undefined control sequence in inline:f3", e.getDiagnostic());
            assertInstanceOf(RenderException.class, e.getCause());

            ImageCache onDisk = openCache();
            assertTrue(onDisk.contains("f1", false));
            assertTrue(onDisk.contains("f2", false));
            assertFalse(onDisk.contains("f3", false));
        }

        @Test
        @DisplayName("Jobs not yet started are cancelled after a failure")
        void cancelsPendingJobs() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            options = ConversionOptions.builder().imageDirectory("img").workerCount(1).build();
            renderer.failing.add("inline:first");
            renderer.delayMillis = 200;

            assertThrows(ConversionException.class, () -> schedulerBuilder()
                    .metrics(new MicrometerMetricsService(registry))
                    .build()
                    .convertAll(List.of(
                            FormulaRecord.inline("first"), FormulaRecord.inline("second"),
                            FormulaRecord.inline("third"), FormulaRecord.inline("fourth"),
                            FormulaRecord.inline("fifth"))));

            int cancelled = (int) registry.get("formula.conversion.cancelled").counter().count();
            assertTrue(renderer.totalCalls() <= 2, "at most the failing and one in-flight job ran");
            assertEquals(5, renderer.totalCalls() + cancelled);
        }

        @Test
        @DisplayName("Error names the 1-based source position and counts cached formulas in the ordinal")
        void errorCarriesPosition() throws Exception {
            scheduler().convertAll(List.of(FormulaRecord.inline("cached")));
            renderer.failing.add("display:\\broken");

            ConversionException e = assertThrows(ConversionException.class, () -> scheduler().convertAll(List.of(
                    FormulaRecord.inline("cached"),
                    new FormulaRecord(SourcePosition.of(4, 2), true, "\\broken"))));

            assertEquals(2, e.getOrdinal());
            assertEquals(SourcePosition.of(4, 2), e.getPosition().orElseThrow());
            assertTrue(e.getMessage().startsWith("Conversion failed for formula no. 2 at line 5, column 3: "));
        }

        @Test
        @DisplayName("Error without source position omits it from the message")
        void errorWithoutPosition() {
            renderer.failing.add("inline:bad");

            ConversionException e = assertThrows(ConversionException.class,
                    () -> scheduler().convertAll(List.of(FormulaRecord.inline("bad"))));

            assertTrue(e.getPosition().isEmpty());
            assertEquals("Conversion failed for formula no. 1: ! Undefined control sequence in inline:bad",
                    e.getMessage());
        }

        @Test
        @DisplayName("Formula the document builder rejects fails like a render error")
        void documentBuilderRejection() {
            ConversionException e = assertThrows(ConversionException.class, () -> schedulerBuilder()
                    .documentBuilder(new LaTeXDocumentBuilder())
                    .build()
                    .convertAll(List.of(FormulaRecord.inline("\\text{Größe}"))));

            assertTrue(e.getDiagnostic().contains("non-ASCII"));
            assertEquals(0, renderer.totalCalls());
        }

        @Test
        @DisplayName("Empty formula is rejected before rendering")
        void emptyFormula() {
            ConversionException e = assertThrows(ConversionException.class,
                    () -> scheduler().convertAll(List.of(FormulaRecord.inline("a"), FormulaRecord.inline("{} "))));

            assertEquals(2, e.getOrdinal());
            assertEquals(0, renderer.totalCalls());
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        @Test
        @DisplayName("Records batch size, cache hits, misses and successes")
        void recordsMetrics() throws Exception {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            ConversionScheduler scheduler = schedulerBuilder()
                    .metrics(new MicrometerMetricsService(registry))
                    .build();

            scheduler.convertAll(List.of(FormulaRecord.inline("a"), FormulaRecord.inline("b")));
            scheduler.convertAll(List.of(FormulaRecord.inline("a")));

            assertEquals(2.0, registry.get("formula.conversion.success").counter().count());
            assertEquals(2.0, registry.get("formula.cache.miss").counter().count());
            assertEquals(1.0, registry.get("formula.cache.hit").counter().count());
            assertEquals(2, registry.get("formula.batch.size").summary().count());
            assertEquals(2, registry.get("formula.conversion.duration")
                    .tag("style", "inline").tag("outcome", "success").timer().count());
        }
    }

    @Test
    @DisplayName("Builder requires cache and renderer")
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> ConversionScheduler.builder().renderer(renderer).build());
        assertThrows(NullPointerException.class, () -> ConversionScheduler.builder().cache(cache).build());
    }
}
