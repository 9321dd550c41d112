package com.formula.conversion.metrics;

import java.time.Duration;

/**
 * Records formula conversion metrics.
 * The default {@link NoOpMetricsService} does nothing, so callers that do not
 * collect metrics need no registry.
 */
public interface MetricsService {

    /**
     * Records how long one render took.
     *
     * @param displayMath style of the rendered formula
     * @param succeeded   whether the render produced an image
     */
    void recordConversionDuration(boolean displayMath, boolean succeeded, Duration duration);

    void incrementConversionSucceeded();

    void incrementConversionFailed();

    void incrementConversionCancelled();

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
