package com.formula.conversion.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Entries are removed from the SLF4J MDC when the context is closed.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBatch(LogContext.generateBatchId())) {
 *     log.info("batch.started formulas={}", count);
 * }
 * </pre>
 *
 * <p>MDC is thread-local: a context opened on the coordinating thread is not seen
 * by worker threads, which open their own with {@link #forJob(String, int)}.</p>
 */
public class LogContext implements AutoCloseable {

    public static final String BATCH_ID = "batchId";
    public static final String OPERATION = "operation";
    public static final String FORMULA_ORDINAL = "formulaOrdinal";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one conversion batch.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put(BATCH_ID, batchId);
        ctx.put(OPERATION, "convert");
        return ctx;
    }

    /**
     * Creates a log context for rendering a single formula of a batch.
     */
    public static LogContext forJob(String batchId, int ordinal) {
        LogContext ctx = new LogContext();
        ctx.put(BATCH_ID, batchId);
        ctx.put(OPERATION, "render");
        ctx.put(FORMULA_ORDINAL, String.valueOf(ordinal));
        return ctx;
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
