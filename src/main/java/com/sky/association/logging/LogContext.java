package com.sky.association.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forStage(runId, image.getFilename(), "association")) {
 *     log.info("association.completed newSources={}", created);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a whole pipeline run.
     */
    public static LogContext forRun(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "run");
        return ctx;
    }

    /**
     * Context for one stage of one image.
     */
    public static LogContext forStage(String correlationId, String filename, String stage) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("filename", filename);
        ctx.put("stage", stage);
        ctx.put("operation", "stage");
        return ctx;
    }

    /**
     * Context for a maintenance operation such as removing images or catalogs.
     */
    public static LogContext forMaintenance(String correlationId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", operation);
        return ctx;
    }

    public static String generateCorrelationId() {
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
