package com.z254.argus.threshold;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.PerformanceMetrics;
import com.z254.argus.domain.model.ThresholdConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Periodically runs the threshold controller over recent operator feedback.
 */
@Slf4j
@Component
public class ThresholdCalibrationJob {

    private final ThresholdService thresholdService;
    private final SuppressionOutcomeTracker tracker;
    private final int minSamples;

    public ThresholdCalibrationJob(ThresholdService thresholdService,
                                   SuppressionOutcomeTracker tracker,
                                   ArgusProperties argusProperties) {
        this.thresholdService = thresholdService;
        this.tracker = tracker;
        this.minSamples = argusProperties.getThresholds().getMinSamples();
    }

    @Scheduled(fixedDelayString = "${argus.thresholds.calibration-interval:PT1H}",
            initialDelayString = "${argus.thresholds.calibration-interval:PT1H}")
    public void scheduledCalibration() {
        calibrate();
    }

    /**
     * @return the optimized thresholds, or empty when there is too little feedback
     */
    public Optional<ThresholdConfig> calibrate() {
        PerformanceMetrics performance = tracker.snapshot();
        if (performance.getSampleCount() < minSamples) {
            log.debug("Skipping threshold calibration: {} outcomes, need {}",
                    performance.getSampleCount(), minSamples);
            return Optional.empty();
        }
        return Optional.of(thresholdService.optimize(performance));
    }
}
