package com.elevation.catalog.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forPartition(batchId, "arcticdem-strips-s2s041-2m", "n67w132")) {
 *     log.info("node.written path={}", path);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forBatch(String batchId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", operation);
        return ctx;
    }

    public static LogContext forCollection(String batchId, String collectionId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("collection", collectionId);
        return ctx;
    }

    public static LogContext forPartition(String batchId, String collectionId, String partition) {
        LogContext ctx = forCollection(batchId, collectionId);
        ctx.put("partition", partition);
        return ctx;
    }

    public static LogContext forIdentity(String batchId, String logicalIdentity) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("logicalIdentity", logicalIdentity);
        return ctx;
    }

    /**
     * Generates a unique batch id.
     */
    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

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
