package com.z254.argus.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of an alert as delivered by the upstream collector.
 * <p>
 * The core never mutates alerts; derived state (scores, groups, snoozes)
 * is keyed by {@link #id}.
 */
@Value
@Builder(toBuilder = true)
public class Alert {

    String id;
    String name;
    String description;
    String summary;

    @Builder.Default
    Severity severity = Severity.INFO;

    @Builder.Default
    Map<String, String> labels = Map.of();

    String service;
    String environment;
    String region;

    @Builder.Default
    Instant firedAt = Instant.EPOCH;

    /**
     * Service owning the alert, falling back to the {@code service} label.
     */
    public String effectiveService() {
        if (service != null && !service.isBlank()) {
            return service;
        }
        return labels != null ? labels.get("service") : null;
    }
}
