package com.z254.argus.search;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time statistics of the search engine.
 */
@Value
@Builder
public class IndexStats {
    IndexType indexType;
    int dimension;
    int totalVectors;
    int liveVectors;
    int tombstonedVectors;
    long memoryBytes;
    double avgQueryMs;
    double p99QueryMs;
    long queries;

    public double tombstoneRatio() {
        return totalVectors == 0 ? 0.0 : (double) tombstonedVectors / totalVectors;
    }
}
