package com.z254.argus.ranker;

import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.HistoricalContext;

/**
 * An alert with the history it was observed with, as used for training.
 */
public record TrainingSample(Alert alert, HistoricalContext historical) {

    public static TrainingSample of(Alert alert) {
        return new TrainingSample(alert, HistoricalContext.empty());
    }
}
