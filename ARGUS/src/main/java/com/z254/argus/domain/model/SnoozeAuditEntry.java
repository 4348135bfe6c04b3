package com.z254.argus.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Audit trail entry for a snooze transition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnoozeAuditEntry {

    private String snoozeId;
    private String alertId;
    private Action action;
    private Instant timestamp;
    private String userId;
    private String reason;
    private Duration duration;

    public enum Action {
        CREATED, EXTENDED, UNSNOOZED, AUTO_UNSNOOZED
    }
}
