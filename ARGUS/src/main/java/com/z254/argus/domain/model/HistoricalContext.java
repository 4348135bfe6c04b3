package com.z254.argus.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated history for an alert signature, supplied by the alert event store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoricalContext {

    private double count24h;
    private double count7d;
    /** Average resolution time in seconds */
    private double avgResolutionTime;
    private double falsePositiveRate;
    private double snoozeCount;
    private double ackRate;
    private double escalationRate;
    private double duplicateRate;

    public static HistoricalContext empty() {
        return new HistoricalContext();
    }

    public float[] toFeatures() {
        return new float[]{
                (float) count24h,
                (float) count7d,
                (float) avgResolutionTime,
                (float) falsePositiveRate,
                (float) snoozeCount,
                (float) ackRate,
                (float) escalationRate,
                (float) duplicateRate
        };
    }
}
