package com.z254.argus.threshold;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.PerformanceMetrics;
import com.z254.argus.domain.model.ThresholdConfig;
import com.z254.argus.observability.ArgusMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SuppressionOutcomeTrackerTest {

    private ArgusProperties properties;
    private SimpleMeterRegistry registry;
    private SuppressionOutcomeTracker tracker;

    @BeforeEach
    void setUp() {
        properties = new ArgusProperties();
        properties.getThresholds().setOutcomeWindow(10);
        properties.getThresholds().setMinSamples(5);
        registry = new SimpleMeterRegistry();
        tracker = new SuppressionOutcomeTracker(properties, new ArgusMetrics(registry));
    }

    @Test
    @DisplayName("should report perfect accuracy with no feedback")
    void empty() {
        PerformanceMetrics snapshot = tracker.snapshot();

        assertThat(snapshot.getSampleCount()).isZero();
        assertThat(snapshot.getAccuracy()).isEqualTo(1.0);
        assertThat(snapshot.getFalseNegativeRate()).isZero();
    }

    @Test
    @DisplayName("should compute miss and false-alarm rates over the window")
    void rates() {
        tracker.record(true, true);
        tracker.record(true, false);
        tracker.record(false, false);
        tracker.record(false, false);
        tracker.record(false, true);

        PerformanceMetrics snapshot = tracker.snapshot();

        assertThat(snapshot.getFalseNegativeRate()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(snapshot.getFalsePositiveRate()).isCloseTo(0.5, within(1e-9));
        assertThat(snapshot.getAccuracy()).isCloseTo(0.6, within(1e-9));
        assertThat(registry.get("argus.ranker.false_negative_rate").gauge().value())
                .isCloseTo(1.0 / 3, within(1e-9));
    }

    @Test
    @DisplayName("should forget outcomes that slide out of the window")
    void slides() {
        for (int i = 0; i < 10; i++) {
            tracker.record(true, false);
        }
        for (int i = 0; i < 10; i++) {
            tracker.record(false, false);
        }

        assertThat(tracker.snapshot().getSampleCount()).isEqualTo(10);
        assertThat(tracker.falseNegativeRate()).isZero();

        tracker.reset();
        assertThat(tracker.snapshot().getSampleCount()).isZero();
    }

    @Test
    @DisplayName("should only calibrate with enough feedback")
    void calibration() {
        ThresholdService thresholds = mock(ThresholdService.class);
        when(thresholds.optimize(any())).thenReturn(ThresholdConfig.defaults());
        ThresholdCalibrationJob job = new ThresholdCalibrationJob(thresholds, tracker, properties);

        tracker.record(false, false);
        assertThat(job.calibrate()).isEqualTo(Optional.empty());
        verify(thresholds, never()).optimize(any());

        for (int i = 0; i < 4; i++) {
            tracker.record(false, false);
        }
        assertThat(job.calibrate()).contains(ThresholdConfig.defaults());
        verify(thresholds).optimize(any(PerformanceMetrics.class));
    }
}
