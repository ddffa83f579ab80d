package com.entity.consolidation.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LogContext MDC handling.
 */
class LogContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void runContextSetsAndClearsKeys() {
        try (LogContext ctx = LogContext.forRun("run-1", "Person", true)) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("Person", MDC.get("entityType"));
            assertEquals("dry-run", MDC.get("mode"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("mode"));
    }

    @Test
    void mergeContextNestsInsideRunContext() {
        try (LogContext run = LogContext.forRun("run-1", "Person", false)) {
            try (LogContext merge = LogContext.forMerge("corr-1", 2, 1).with("method", "exact_match")) {
                assertEquals("2", MDC.get("sourceEntityId"));
                assertEquals("1", MDC.get("targetEntityId"));
                assertEquals("exact_match", MDC.get("method"));
                assertEquals("run-1", MDC.get("runId"));
            }
            assertNull(MDC.get("correlationId"));
            assertEquals("live", MDC.get("mode"));
        }
    }

    @Test
    void correlationIdsAreUnique() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
