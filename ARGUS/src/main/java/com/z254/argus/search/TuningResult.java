package com.z254.argus.search;

import lombok.Builder;
import lombok.Value;

/**
 * Measured outcome of one index configuration.
 */
@Value
@Builder
public class TuningResult {
    IndexType indexType;
    IndexParameters parameters;
    double recall;
    double p99Ms;
    double meanMs;
    double buildMs;
    long memoryBytes;
    boolean meetsTargets;
}
