package com.z254.argus.threshold;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.PerformanceMetrics;
import com.z254.argus.observability.ArgusMetrics;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding window of operator feedback on suppression decisions.
 * <p>
 * Each outcome pairs the ranker's verdict with the operator's verdict. The
 * false-negative rate is the share of real signals that were suppressed; the
 * false-positive rate is the share of suppressions that turned out to be signal.
 */
@Component
public class SuppressionOutcomeTracker {

    private final int capacity;
    private final ArgusMetrics metrics;
    private final Deque<Outcome> window = new ArrayDeque<>();

    public SuppressionOutcomeTracker(ArgusProperties argusProperties, ArgusMetrics metrics) {
        this.capacity = argusProperties.getThresholds().getOutcomeWindow();
        this.metrics = metrics;
    }

    public void record(boolean predictedNoise, boolean actuallyNoise) {
        double fnr;
        synchronized (window) {
            window.addLast(new Outcome(predictedNoise, actuallyNoise));
            while (window.size() > capacity) {
                window.removeFirst();
            }
            fnr = compute().getFalseNegativeRate();
        }
        metrics.updateFalseNegativeRate(fnr);
    }

    public double falseNegativeRate() {
        return snapshot().getFalseNegativeRate();
    }

    public PerformanceMetrics snapshot() {
        synchronized (window) {
            return compute();
        }
    }

    public void reset() {
        synchronized (window) {
            window.clear();
        }
        metrics.updateFalseNegativeRate(0.0);
    }

    private PerformanceMetrics compute() {
        long signals = 0;
        long signalsSuppressed = 0;
        long suppressions = 0;
        long wrongSuppressions = 0;
        long correct = 0;
        for (Outcome outcome : window) {
            if (!outcome.actuallyNoise()) {
                signals++;
                if (outcome.predictedNoise()) {
                    signalsSuppressed++;
                }
            }
            if (outcome.predictedNoise()) {
                suppressions++;
                if (!outcome.actuallyNoise()) {
                    wrongSuppressions++;
                }
            }
            if (outcome.predictedNoise() == outcome.actuallyNoise()) {
                correct++;
            }
        }
        int total = window.size();
        return PerformanceMetrics.builder()
                .falseNegativeRate(signals == 0 ? 0.0 : (double) signalsSuppressed / signals)
                .falsePositiveRate(suppressions == 0 ? 0.0 : (double) wrongSuppressions / suppressions)
                .accuracy(total == 0 ? 1.0 : (double) correct / total)
                .sampleCount(total)
                .build();
    }

    private record Outcome(boolean predictedNoise, boolean actuallyNoise) {
    }
}
