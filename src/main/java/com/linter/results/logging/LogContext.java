package com.linter.results.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCacheLoad(runId, path.toString())) {
 *     log.info("cache.loaded files={}", cache.cachedFiles().size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for loading a cache file.
     */
    public static LogContext forCacheLoad(String runId, String cachePath) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("cachePath", cachePath);
        ctx.put("operation", "cache-load");
        return ctx;
    }

    /**
     * Creates a log context for saving a cache file.
     */
    public static LogContext forCacheSave(String runId, String cachePath) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("cachePath", cachePath);
        ctx.put("operation", "cache-save");
        return ctx;
    }

    public static String generateRunId() {
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
