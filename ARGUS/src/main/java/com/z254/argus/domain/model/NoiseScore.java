package com.z254.argus.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Noise probability computed for an alert.
 */
@Value
public class NoiseScore {
    String alertId;
    double score;
    Instant computedAt;
}
