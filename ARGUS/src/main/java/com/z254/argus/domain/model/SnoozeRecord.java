package com.z254.argus.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Live snooze state for one alert. {@code expiresAt} is always
 * {@code createdAt + duration}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnoozeRecord {

    private String id;
    private String alertId;
    private Instant createdAt;
    private Instant expiresAt;
    private Duration duration;
    private String reason;
    private String createdBy;

    @Builder.Default
    private boolean active = true;
}
