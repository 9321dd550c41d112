package com.formula.conversion.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code formula.conversion.duration}: Timer (tags: style, outcome)</li>
 *   <li>{@code formula.conversion.success}: Counter</li>
 *   <li>{@code formula.conversion.failure}: Counter</li>
 *   <li>{@code formula.conversion.cancelled}: Counter</li>
 *   <li>{@code formula.batch.size}: DistributionSummary</li>
 *   <li>{@code formula.cache.hit}: Counter</li>
 *   <li>{@code formula.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter cancelledCounter;
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.successCounter = Counter.builder("formula.conversion.success")
                .description("Number of formulas rendered to an image")
                .register(registry);
        this.failureCounter = Counter.builder("formula.conversion.failure")
                .description("Number of formulas the renderer rejected")
                .register(registry);
        this.cancelledCounter = Counter.builder("formula.conversion.cancelled")
                .description("Number of queued conversions dropped after a failure")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("formula.batch.size")
                .description("Number of formulas submitted per batch")
                .register(registry);
        this.cacheHitCounter = Counter.builder("formula.cache.hit")
                .description("Number of formulas served from the image cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("formula.cache.miss")
                .description("Number of formulas not found in the image cache")
                .register(registry);
    }

    @Override
    public void recordConversionDuration(boolean displayMath, boolean succeeded, Duration duration) {
        String style = displayMath ? "display" : "inline";
        String outcome = succeeded ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent(style + ":" + outcome, k ->
                Timer.builder("formula.conversion.duration")
                        .description("Duration of single formula renders")
                        .tag("style", style)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementConversionSucceeded() {
        successCounter.increment();
    }

    @Override
    public void incrementConversionFailed() {
        failureCounter.increment();
    }

    @Override
    public void incrementConversionCancelled() {
        cancelledCounter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
