package com.z254.argus.snooze;

import java.time.Instant;

/**
 * The alert already has an active snooze. Use {@code extend} to lengthen it.
 */
public class SnoozeConflictException extends RuntimeException {

    private final String alertId;
    private final Instant activeUntil;

    public SnoozeConflictException(String alertId, Instant activeUntil) {
        super("Alert " + alertId + " is already snoozed until " + activeUntil);
        this.alertId = alertId;
        this.activeUntil = activeUntil;
    }

    public String getAlertId() {
        return alertId;
    }

    public Instant getActiveUntil() {
        return activeUntil;
    }
}
