package com.lifter.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRow(correlationId, meetId, "Jane Smith")) {
 *     log.info("resolution.resolved lifterId={} outcome={}", lifterId, outcome);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for resolving one result row.
     */
    public static LogContext forRow(String correlationId, Long meetId, String athlete) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("meetId", meetId != null ? meetId.toString() : "unknown");
        ctx.put("athlete", athlete);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Context for one verification tier inside a row.
     */
    public static LogContext forTier(String tier) {
        LogContext ctx = new LogContext();
        ctx.put("tier", tier);
        return ctx;
    }

    /**
     * Context for a batch import.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

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
