package com.sportsync.resolution.logging;

import com.sportsync.resolution.core.model.EntityKind;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC scope for structured logging. Keys put through a context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, EntityKind.GAME, source, sourceId)) {
 *     log.info("game.resolved canonicalId={} method={}", id, method);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forResolution(String correlationId, EntityKind kind, String source, String sourceId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entityKind", kind.wireName());
        ctx.put("source", source);
        ctx.put("sourceId", sourceId);
        ctx.put("operation", "resolve");
        return ctx;
    }

    public static LogContext forSyncJob(String source, String dataType, String runId) {
        LogContext ctx = new LogContext();
        ctx.put("source", source);
        ctx.put("dataType", dataType);
        ctx.put("runId", runId);
        ctx.put("operation", "sync");
        return ctx;
    }

    public static LogContext forMerge(String correlationId, EntityKind kind, String survivorId, String loserId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entityKind", kind.wireName());
        ctx.put("survivorId", survivorId);
        ctx.put("loserId", loserId);
        ctx.put("operation", "merge");
        return ctx;
    }

    public static LogContext forReview(String reviewItemId, String reviewerId) {
        LogContext ctx = new LogContext();
        ctx.put("reviewItemId", reviewItemId);
        ctx.put("reviewerId", reviewerId);
        ctx.put("operation", "review");
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
        if (value == null) {
            return;
        }
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
