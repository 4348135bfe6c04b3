package com.z254.argus.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate outcome metrics of suppression decisions over a window.
 */
@Value
@Builder
public class PerformanceMetrics {
    double falsePositiveRate;
    double falseNegativeRate;
    double accuracy;
    long sampleCount;
}
