package com.z254.argus.kafka;

import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.HistoricalContext;
import com.z254.argus.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps raw alert events (JSON objects decoded as maps) to {@link Alert}s.
 * <p>
 * Accepts both the collector's snake_case keys and Alertmanager style events
 * ({@code labels.alertname}, {@code annotations.description}, {@code startsAt}).
 */
@Component
public class AlertEventMapper {

    private final Clock clock;

    public AlertEventMapper(Clock clock) {
        this.clock = clock;
    }

    public AlertEvent map(Map<String, Object> data) {
        if (data == null) {
            throw new InvalidAlertEventException("Empty alert event");
        }
        Map<String, String> labels = stringMap(data.get("labels"));
        Map<String, String> annotations = stringMap(data.get("annotations"));

        String id = firstText(data, "id", "alert_id", "alertId", "fingerprint");
        if (id == null) {
            throw new InvalidAlertEventException("Alert event has no id");
        }
        String name = firstText(data, "name", "alert_name", "alertname");
        if (name == null) {
            name = labels.get("alertname");
        }
        if (name == null) {
            throw new InvalidAlertEventException("Alert event " + id + " has no name");
        }

        String description = firstText(data, "description");
        if (description == null) {
            description = annotations.get("description");
        }
        String summary = firstText(data, "summary");
        if (summary == null) {
            summary = annotations.get("summary");
        }
        String severity = firstText(data, "severity");
        if (severity == null) {
            severity = labels.get("severity");
        }
        String environment = firstText(data, "environment", "env");
        if (environment == null) {
            environment = labels.getOrDefault("environment", labels.get("env"));
        }
        String region = firstText(data, "region");
        if (region == null) {
            region = labels.get("region");
        }

        Alert alert = Alert.builder()
                .id(id)
                .name(name)
                .description(description)
                .summary(summary)
                .severity(Severity.fromString(severity))
                .labels(Map.copyOf(labels))
                .service(firstText(data, "service"))
                .environment(environment)
                .region(region)
                .firedAt(timestamp(data, "fired_at", "firedAt", "startsAt", "timestamp"))
                .build();

        return new AlertEvent(alert, historical(data.get("historical")));
    }

    private Instant timestamp(Map<String, Object> data, String... keys) {
        for (String key : keys) {
            Object value = data.get(key);
            if (value instanceof Number) {
                return Instant.ofEpochMilli(((Number) value).longValue());
            }
            if (value instanceof String && !((String) value).isBlank()) {
                String text = ((String) value).trim();
                try {
                    return Instant.parse(text);
                } catch (DateTimeParseException e) {
                    try {
                        return Instant.ofEpochMilli(Long.parseLong(text));
                    } catch (NumberFormatException nfe) {
                        throw new InvalidAlertEventException("Unparseable timestamp in " + key + ": " + text);
                    }
                }
            }
        }
        return clock.instant();
    }

    @SuppressWarnings("unchecked")
    private HistoricalContext historical(Object value) {
        if (!(value instanceof Map)) {
            return HistoricalContext.empty();
        }
        Map<String, Object> map = (Map<String, Object>) value;
        return HistoricalContext.builder()
                .count24h(number(map, "count_24h", "count24h"))
                .count7d(number(map, "count_7d", "count7d"))
                .avgResolutionTime(number(map, "avg_resolution_time", "avgResolutionTime"))
                .falsePositiveRate(number(map, "false_positive_rate", "falsePositiveRate"))
                .snoozeCount(number(map, "snooze_count", "snoozeCount"))
                .ackRate(number(map, "ack_rate", "ackRate"))
                .escalationRate(number(map, "escalation_rate", "escalationRate"))
                .duplicateRate(number(map, "duplicate_rate", "duplicateRate"))
                .build();
    }

    private static double number(Map<String, Object> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value instanceof Number) {
                return ((Number) value).doubleValue();
            }
            if (value instanceof String) {
                try {
                    return Double.parseDouble(((String) value).trim());
                } catch (NumberFormatException e) {
                    throw new InvalidAlertEventException("Historical field " + key + " is not numeric: " + value);
                }
            }
        }
        return 0.0;
    }

    private static String firstText(Map<String, Object> data, String... keys) {
        for (String key : keys) {
            Object value = data.get(key);
            if (value != null && !(value instanceof Map) && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        return null;
    }

    private static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((k, v) -> {
                if (k != null && v != null) {
                    result.put(k.toString(), v.toString());
                }
            });
        }
        return result;
    }

    /**
     * A decoded alert with the history supplied alongside it.
     */
    public record AlertEvent(Alert alert, HistoricalContext historical) {
    }

    public static class InvalidAlertEventException extends RuntimeException {
        public InvalidAlertEventException(String message) {
            super(message);
        }
    }
}
