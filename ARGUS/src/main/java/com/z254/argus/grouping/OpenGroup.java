package com.z254.argus.grouping;

import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.AlertGroup;

/**
 * A live group together with the alert that represents it for similarity checks.
 */
public record OpenGroup(AlertGroup group, Alert representative) {
}
