package com.entity.consolidation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forMerge(correlationId, sourceId, targetId)) {
 *     log.info("merge.completed sourceEntityId={} targetEntityId={}", sourceId, targetId);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one consolidation run.
     */
    public static LogContext forRun(String runId, String entityType, boolean dryRun) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("entityType", entityType);
        ctx.put("mode", dryRun ? "dry-run" : "live");
        return ctx;
    }

    /**
     * Creates a log context for a single merge.
     */
    public static LogContext forMerge(String correlationId, long sourceId, long targetId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("sourceEntityId", String.valueOf(sourceId));
        ctx.put("targetEntityId", String.valueOf(targetId));
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
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
