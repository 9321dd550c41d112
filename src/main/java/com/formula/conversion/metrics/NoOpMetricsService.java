package com.formula.conversion.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordConversionDuration(boolean displayMath, boolean succeeded, Duration duration) {
    }

    @Override
    public void incrementConversionSucceeded() {
    }

    @Override
    public void incrementConversionFailed() {
    }

    @Override
    public void incrementConversionCancelled() {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
