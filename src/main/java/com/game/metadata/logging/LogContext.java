package com.game.metadata.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forFetch(correlationId, titleId, "video_game")) {
 *     log.info("metadata.fetch.found provider={}", providerId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forFetch(String correlationId, String titleId, String titleType) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("titleId", titleId);
        ctx.put("titleType", titleType);
        ctx.put("operation", "fetch");
        return ctx;
    }

    public static LogContext forSync(String batchId, String providerId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("providerId", providerId);
        ctx.put("operation", "sync");
        return ctx;
    }

    public static LogContext forPlatformMerge(String correlationId, String sourceId, String targetId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("sourcePlatformId", sourceId);
        ctx.put("targetPlatformId", targetId);
        ctx.put("operation", "platform-merge");
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
