package com.z254.argus.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Structured logging utility for the ARGUS service.
 * <p>
 * Emits {@code message | data={...}} lines with MDC context so triage,
 * snooze and threshold events can be correlated per alert.
 */
@Slf4j
@Component
public class ArgusStructuredLogger {

    // MDC keys
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_ALERT_ID = "alertId";
    public static final String MDC_GROUP_ID = "groupId";
    public static final String MDC_COMPONENT = "component";

    private static final long SLOW_OPERATION_MS = 1000;

    /**
     * Log a triage decision for an alert.
     */
    public void logTriageEvent(String alertId, TriageEventType eventType, String message,
                               Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_ALERT_ID, alertId))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            logData.put("alertId", alertId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case DEGRADED -> log.warn("{} | data={}", message, formatLogData(logData));
                case SUPPRESSED, SNOOZED, GROUPED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a grouping event.
     */
    public void logGroupEvent(String groupId, GroupEventType eventType, String message,
                              Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_GROUP_ID, groupId != null ? groupId : ""))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            logData.put("groupId", groupId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case CREATED, EXPIRED, MERGE_SUGGESTED -> log.info("{} | data={}", message, formatLogData(logData));
                default -> log.debug("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a snooze lifecycle event.
     */
    public void logSnoozeEvent(String alertId, SnoozeEventType eventType, String message,
                               Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_ALERT_ID, alertId))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            logData.put("alertId", alertId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case CONFLICT, STORE_UNAVAILABLE -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a threshold or model change.
     */
    public void logControlEvent(ControlEventType eventType, String message, Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", eventType.name());
        if (details != null) {
            logData.putAll(details);
        }

        switch (eventType) {
            case SAVE_FAILED, MODEL_LOAD_FAILED -> log.warn("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log a performance metric.
     */
    public void logPerformance(String operation, Duration duration, boolean success,
                               Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", "PERFORMANCE");
        logData.put("operation", operation);
        logData.put("durationMs", duration.toMillis());
        logData.put("success", success);
        if (details != null) {
            logData.putAll(details);
        }

        if (duration.toMillis() > SLOW_OPERATION_MS) {
            log.warn("Slow operation: {} took {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Performance: {} completed in {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Execute a timed operation with logging.
     */
    public <T> T timed(String operation, Supplier<T> action) {
        Instant start = Instant.now();
        boolean success = false;
        try {
            T result = action.get();
            success = true;
            return result;
        } finally {
            logPerformance(operation, Duration.between(start, Instant.now()), success, null);
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    public MDCScope withCorrelationId(String correlationId) {
        MDC.put(MDC_CORRELATION_ID, correlationId);
        return new MDCScope(MDC_CORRELATION_ID);
    }

    static String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private static String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum TriageEventType {
        SURFACED, SUPPRESSED, SNOOZED, GROUPED, DEGRADED
    }

    public enum GroupEventType {
        CREATED, MERGED, EXPIRED, MERGE_SUGGESTED
    }

    public enum SnoozeEventType {
        CREATED, EXTENDED, UNSNOOZED, AUTO_UNSNOOZED, CONFLICT, STORE_UNAVAILABLE, AUDIT_PURGED
    }

    public enum ControlEventType {
        THRESHOLD_UPDATED, THRESHOLD_OPTIMIZED, SAVE_FAILED, MODEL_LOADED, MODEL_LOAD_FAILED,
        MODEL_TRAINED, RULES_LOADED, INDEX_SNAPSHOT, INDEX_COMPACTED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
