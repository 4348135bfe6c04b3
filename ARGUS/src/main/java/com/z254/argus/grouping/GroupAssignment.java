package com.z254.argus.grouping;

import com.z254.argus.domain.model.AlertGroup;

/**
 * Outcome of placing one alert.
 *
 * @param group      snapshot of the group after the alert was applied
 * @param created    whether a new group was opened for the alert
 * @param similarity similarity to the group's representative (1 for a new group)
 */
public record GroupAssignment(AlertGroup group, boolean created, double similarity) {
}
