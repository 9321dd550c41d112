package com.formula.conversion.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forBatch should set batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-456")) {
            assertEquals("batch-456", MDC.get(LogContext.BATCH_ID));
            assertEquals("convert", MDC.get(LogContext.OPERATION));
            assertNull(MDC.get(LogContext.FORMULA_ORDINAL));
        }
    }

    @Test
    @DisplayName("forJob should set batchId, operation and formula ordinal in MDC")
    void forJobSetsMDC() {
        try (LogContext ctx = LogContext.forJob("batch-1", 7)) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("render", MDC.get("operation"));
            assertEquals("7", MDC.get("formulaOrdinal"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forJob("batch-1", 3);
        assertNotNull(MDC.get("batchId"));

        ctx.close();

        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("formulaOrdinal"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forBatch("batch-1").with("document", "page.htex")) {
            assertEquals("page.htex", MDC.get("document"));
        }
        assertNull(MDC.get("document"));
        assertNull(MDC.get("batchId"));
    }

    @Test
    @DisplayName("Context of another thread is not visible")
    void threadLocal() throws Exception {
        try (LogContext ctx = LogContext.forBatch("batch-1")) {
            String[] seen = new String[1];
            Thread worker = new Thread(() -> seen[0] = MDC.get("batchId"));
            worker.start();
            worker.join();
            assertNull(seen[0]);
        }
    }

    @Test
    @DisplayName("generateBatchId should return unique UUIDs")
    void generateBatchIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateBatchId());
        }
        assertEquals(100, ids.size(), "All generated IDs should be unique");
        assertTrue(ids.iterator().next().matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }

    @Test
    @DisplayName("Closing an inner context keeps keys it did not set")
    void nestedContexts() {
        try (LogContext outer = LogContext.forBatch("outer").with("document", "a.htex")) {
            try (LogContext inner = LogContext.forJob("outer", 1)) {
                assertEquals("1", MDC.get("formulaOrdinal"));
            }
            assertNull(MDC.get("formulaOrdinal"));
            assertEquals("a.htex", MDC.get("document"));
        }
        assertNull(MDC.get("document"));
    }
}
