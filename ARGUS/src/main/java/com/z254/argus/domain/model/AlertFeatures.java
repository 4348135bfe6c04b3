package com.z254.argus.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Feature blocks derived from an alert for a single scoring call.
 * Never persisted.
 */
@Value
@Builder
public class AlertFeatures {

    float[] textEmbedding;
    float[] lexicalFeatures;
    float[] temporalFeatures;
    float[] historicalFeatures;
    float[] serviceFeatures;

    /**
     * Concatenate all blocks in a fixed order into one row vector.
     */
    public double[] concatenate() {
        int length = textEmbedding.length + lexicalFeatures.length + temporalFeatures.length
                + historicalFeatures.length + serviceFeatures.length;
        double[] row = new double[length];
        int offset = 0;
        for (float[] block : new float[][]{textEmbedding, lexicalFeatures, temporalFeatures,
                historicalFeatures, serviceFeatures}) {
            for (float value : block) {
                row[offset++] = value;
            }
        }
        return row;
    }
}
