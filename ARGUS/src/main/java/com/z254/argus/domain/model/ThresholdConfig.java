package com.z254.argus.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Operating thresholds for the noise ranker.
 * <p>
 * Immutable; changes go through {@link #toBuilder()}. Instances handed out
 * by the threshold service are always clamped; use {@link #clamped()} after
 * building one from untrusted input.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdConfig {

    public static final double NOISE_MIN = 0.5;
    public static final double NOISE_MAX = 0.95;
    public static final double CONFIDENCE_MIN = 0.7;
    public static final double CONFIDENCE_MAX = 0.95;
    public static final int BATCH_SIZE_MIN = 1;
    public static final int BATCH_SIZE_MAX = 1000;
    public static final double LEARNING_RATE_MIN = 0.0001;
    public static final double LEARNING_RATE_MAX = 1.0;

    @JsonProperty("noise_threshold")
    @Builder.Default
    double noiseThreshold = 0.7;

    @JsonProperty("confidence_min")
    @Builder.Default
    double confidenceMin = 0.85;

    @JsonProperty("batch_size")
    @Builder.Default
    int batchSize = 100;

    @JsonProperty("learning_rate")
    @Builder.Default
    double learningRate = 0.01;

    public static ThresholdConfig defaults() {
        return ThresholdConfig.builder().build();
    }

    /**
     * Copy with every field forced into its documented range.
     */
    public ThresholdConfig clamped() {
        return ThresholdConfig.builder()
                .noiseThreshold(clamp(noiseThreshold, NOISE_MIN, NOISE_MAX))
                .confidenceMin(clamp(confidenceMin, CONFIDENCE_MIN, CONFIDENCE_MAX))
                .batchSize((int) clamp(batchSize, BATCH_SIZE_MIN, BATCH_SIZE_MAX))
                .learningRate(clamp(learningRate, LEARNING_RATE_MIN, LEARNING_RATE_MAX))
                .build();
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
