package com.story.analysis.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAnalysis(scenario.id(), "analyze")) {
 *     log.info("analysis.completed issues={}", issues.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for an analysis of one scenario.
     */
    public static LogContext forAnalysis(String scenarioId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("scenarioId", scenarioId);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for path evaluation.
     */
    public static LogContext forEvaluation(String scenarioId, String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("scenarioId", scenarioId);
        ctx.put("operation", "evaluate");
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
