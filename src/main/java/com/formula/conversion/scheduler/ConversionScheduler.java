package com.formula.conversion.scheduler;

import com.formula.conversion.api.ConversionOptions;
import com.formula.conversion.cache.CacheKey;
import com.formula.conversion.cache.ImageCache;
import com.formula.conversion.core.model.CacheEntry;
import com.formula.conversion.core.model.ConversionResult;
import com.formula.conversion.core.model.FormulaRecord;
import com.formula.conversion.logging.LogContext;
import com.formula.conversion.metrics.MetricsService;
import com.formula.conversion.metrics.NoOpMetricsService;
import com.formula.conversion.render.DocumentBuilder;
import com.formula.conversion.render.LaTeXDocumentBuilder;
import com.formula.conversion.render.RenderException;
import com.formula.conversion.render.RenderResult;
import com.formula.conversion.render.Renderer;
import com.formula.conversion.rules.FormulaNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Converts the formulas of a document that are not yet cached, using a bounded pool of workers.
 *
 * <p>A batch runs in these steps:</p>
 * <ol>
 *   <li>formulas found in the cache, and repeats of a formula seen earlier in the batch, are skipped;</li>
 *   <li>every remaining formula gets a free {@code eqnNNN} image name;</li>
 *   <li>the image directory is created;</li>
 *   <li>the formulas are rendered concurrently;</li>
 *   <li>results are folded into the cache in completion order, persisting after each one.</li>
 * </ol>
 *
 * <p>The first failure is remembered and rethrown once all jobs have settled. Jobs that have
 * not started when the failure is observed are cancelled; jobs already running finish and
 * their images are still cached. Only the coordinating thread touches the cache.</p>
 *
 * <pre>
 * ConversionScheduler scheduler = ConversionScheduler.builder()
 *         .cache(cache)
 *         .renderer(new LatexProcessRenderer(options))
 *         .options(options)
 *         .build();
 * scheduler.convertAll(document.formulas());
 * ConversionResult result = scheduler.getResult("a^2", false).orElseThrow();
 * </pre>
 */
public class ConversionScheduler {
    private static final Logger log = LoggerFactory.getLogger(ConversionScheduler.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final ImageCache cache;
    private final Renderer renderer;
    private final DocumentBuilder documentBuilder;
    private final ConversionOptions options;
    private final Path baseDirectory;
    private final MetricsService metrics;

    private ConversionScheduler(Builder builder) {
        this.cache = builder.cache;
        this.renderer = builder.renderer;
        this.documentBuilder = builder.documentBuilder;
        this.options = builder.options;
        this.baseDirectory = builder.baseDirectory != null ? builder.baseDirectory : cache.getBaseDirectory();
        this.metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Makes sure every given formula has an image in the cache.
     *
     * @param formulas formulas in document order
     * @return counts of cached, duplicate and converted formulas
     * @throws ConversionException  for the first formula that failed; all other outcomes are cached
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers
     */
    public BatchSummary convertAll(List<FormulaRecord> formulas) throws ConversionException, InterruptedException {
        Objects.requireNonNull(formulas, "formulas is required");
        String batchId = LogContext.generateBatchId();
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            metrics.recordBatchSize(formulas.size());

            int cacheHits = 0;
            int duplicates = 0;
            List<ConversionJob> jobs = new ArrayList<>();
            Set<CacheKey> scheduled = new HashSet<>();
            FileSlotAllocator slots = new FileSlotAllocator(baseDirectory, options.getImageDirectory(),
                    options.getImageFormat().extension());

            int ordinal = 0;
            for (FormulaRecord formula : formulas) {
                ordinal++;
                if (FormulaNormalizer.normalize(formula.rawText()).isEmpty()) {
                    throw new ConversionException("formula is empty", formula.rawText(), ordinal,
                            formula.position());
                }
                if (cache.contains(formula.rawText(), formula.displayMath())) {
                    cacheHits++;
                    metrics.recordCacheHit();
                    continue;
                }
                if (!scheduled.add(CacheKey.of(formula))) {
                    duplicates++;
                    continue;
                }
                metrics.recordCacheMiss();
                jobs.add(new ConversionJob(formula, ordinal, slots.allocate()));
            }

            log.info("conversion.batch.started formulas={} cacheHits={} duplicates={} toConvert={}",
                    formulas.size(), cacheHits, duplicates, jobs.size());
            if (jobs.isEmpty()) {
                return new BatchSummary(formulas.size(), cacheHits, duplicates, 0);
            }

            prepareImageDirectory();
            int converted = runJobs(batchId, jobs);
            log.info("conversion.batch.completed converted={}", converted);
            return new BatchSummary(formulas.size(), cacheHits, duplicates, converted);
        }
    }

    /**
     * Returns the image of a formula converted or found in the cache by {@link #convertAll}.
     */
    public Optional<ConversionResult> getResult(String formula, boolean displayMath) {
        return cache.get(formula, displayMath)
                .map(entry -> ConversionResult.of(entry, formula, displayMath));
    }

    private void prepareImageDirectory() {
        Path imageDirectory = options.getImageDirectory().isEmpty()
                ? baseDirectory : baseDirectory.resolve(options.getImageDirectory());
        try {
            Files.createDirectories(imageDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create image directory " + imageDirectory, e);
        }
    }

    private int runJobs(String batchId, List<ConversionJob> jobs) throws ConversionException, InterruptedException {
        int workers = Math.min(options.getWorkerCount(), jobs.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers, new RenderThreadFactory());
        CompletionService<JobOutcome> completion = new ExecutorCompletionService<>(executor);
        for (ConversionJob job : jobs) {
            completion.submit(() -> runJob(batchId, job));
        }

        ConversionException firstError = null;
        int converted = 0;
        int cancelled = 0;
        try {
            for (int settled = 0; settled < jobs.size(); settled++) {
                JobOutcome outcome = awaitNext(completion);
                ConversionJob job = outcome.job();
                FormulaRecord formula = job.getFormula();
                switch (outcome.state()) {
                    case SUCCEEDED -> {
                        cache.put(formula.rawText(), formula.displayMath(),
                                new CacheEntry(job.getOutputPath(), outcome.result().position()));
                        cache.persist();
                        converted++;
                    }
                    case FAILED -> {
                        cache.persist();
                        if (firstError == null) {
                            firstError = new ConversionException(outcome.diagnostic(), formula.rawText(),
                                    job.getOrdinal(), formula.position(), outcome.cause());
                            int dropped = cancelPending(jobs);
                            log.error("conversion.job.failed ordinal={} cancelledPending={} diagnostic={}",
                                    job.getOrdinal(), dropped, outcome.diagnostic());
                        } else {
                            log.warn("conversion.job.failed ordinal={} diagnostic={}",
                                    job.getOrdinal(), outcome.diagnostic());
                        }
                    }
                    case CANCELLED -> {
                        cancelled++;
                        metrics.incrementConversionCancelled();
                    }
                    default -> throw new IllegalStateException("job settled in state " + outcome.state());
                }
            }
        } catch (InterruptedException e) {
            cancelPending(jobs);
            executor.shutdownNow();
            throw e;
        } finally {
            shutdown(executor);
        }

        if (firstError != null) {
            log.info("conversion.batch.failed converted={} cancelled={}", converted, cancelled);
            throw firstError;
        }
        return converted;
    }

    private JobOutcome runJob(String batchId, ConversionJob job) {
        if (!job.markRunning()) {
            return JobOutcome.cancelled(job);
        }
        FormulaRecord formula = job.getFormula();
        try (LogContext ctx = LogContext.forJob(batchId, job.getOrdinal())) {
            long start = System.nanoTime();
            try {
                String source = documentBuilder.build(formula.rawText(), formula.displayMath(), options);
                RenderResult result = renderer.render(source, baseDirectory.resolve(job.getOutputBasePath()));
                job.markSucceeded();
                metrics.recordConversionDuration(formula.displayMath(), true, Duration.ofNanos(System.nanoTime() - start));
                metrics.incrementConversionSucceeded();
                log.debug("conversion.job.succeeded path={}", job.getOutputPath());
                return JobOutcome.succeeded(job, result);
            } catch (RenderException e) {
                return failed(job, start, e.getDiagnostic(), e);
            } catch (RuntimeException e) {
                log.debug("conversion.job.error type={}", e.getClass().getSimpleName(), e);
                return failed(job, start, String.valueOf(e.getMessage()), e);
            }
        }
    }

    private JobOutcome failed(ConversionJob job, long start, String diagnostic, Throwable cause) {
        job.markFailed();
        metrics.recordConversionDuration(job.getFormula().displayMath(), false,
                Duration.ofNanos(System.nanoTime() - start));
        metrics.incrementConversionFailed();
        return JobOutcome.failed(job, diagnostic, cause);
    }

    private static JobOutcome awaitNext(CompletionService<JobOutcome> completion) throws InterruptedException {
        try {
            return completion.take().get();
        } catch (ExecutionException e) {
            // runJob converts every exception into an outcome
            throw new IllegalStateException("conversion worker terminated abnormally", e.getCause());
        }
    }

    private static int cancelPending(List<ConversionJob> jobs) {
        int cancelled = 0;
        for (ConversionJob job : jobs) {
            if (job.cancel()) {
                cancelled++;
            }
        }
        return cancelled;
    }

    private static void shutdown(ExecutorService executor) throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("conversion.workers.stuck timeoutSeconds={}", SHUTDOWN_TIMEOUT_SECONDS);
            executor.shutdownNow();
        }
    }

    private record JobOutcome(ConversionJob job, JobState state, RenderResult result,
                              String diagnostic, Throwable cause) {

        static JobOutcome succeeded(ConversionJob job, RenderResult result) {
            return new JobOutcome(job, JobState.SUCCEEDED, result, null, null);
        }

        static JobOutcome failed(ConversionJob job, String diagnostic, Throwable cause) {
            return new JobOutcome(job, JobState.FAILED, null, diagnostic, cause);
        }

        static JobOutcome cancelled(ConversionJob job) {
            return new JobOutcome(job, JobState.CANCELLED, null, null, null);
        }
    }

    private static final class RenderThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNT = new AtomicInteger();
        private final int pool = POOL_COUNT.incrementAndGet();
        private final AtomicInteger threadCount = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "formula-render-" + pool + "-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    /**
     * Builder for {@link ConversionScheduler}. A cache and a renderer are required;
     * documents default to {@link LaTeXDocumentBuilder}, options to
     * {@link ConversionOptions#defaults()} and images are placed relative to the
     * cache's base directory.
     */
    public static class Builder {
        private ImageCache cache;
        private Renderer renderer;
        private DocumentBuilder documentBuilder = new LaTeXDocumentBuilder();
        private ConversionOptions options = ConversionOptions.defaults();
        private Path baseDirectory;
        private MetricsService metrics = new NoOpMetricsService();

        public Builder cache(ImageCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder renderer(Renderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder documentBuilder(DocumentBuilder documentBuilder) {
            this.documentBuilder = Objects.requireNonNull(documentBuilder, "documentBuilder is required");
            return this;
        }

        public Builder options(ConversionOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder baseDirectory(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics is required");
            return this;
        }

        public ConversionScheduler build() {
            Objects.requireNonNull(cache, "cache is required");
            Objects.requireNonNull(renderer, "renderer is required");
            return new ConversionScheduler(this);
        }
    }
}
