package com.z254.argus.ranker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Evaluation of a freshly trained model over its own training set.
 * <p>
 * Labels are noise (positive) versus signal. The false-negative rate is the
 * share of signal alerts the model would suppress and gates promotion.
 */
@Value
@Builder
public class TrainingReport {
    int samples;
    int noiseSamples;
    int signalSamples;
    double falseNegativeRate;
    double falsePositiveRate;
    double accuracy;
    int trees;
    int featureCount;
    int vocabularySize;
    Duration trainingTime;

    public boolean meetsFalseNegativeTarget(double target) {
        return falseNegativeRate <= target;
    }
}
