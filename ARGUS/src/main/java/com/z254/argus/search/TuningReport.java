package com.z254.argus.search;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a tuning run. When no configuration met both targets,
 * {@link #getResults()} is ordered by P99 latency for manual selection.
 */
@Value
@Builder
public class TuningReport {
    double targetP99Ms;
    double minRecall;
    boolean earlyStopped;
    List<TuningResult> results;

    /**
     * First configuration that met both targets.
     */
    public Optional<TuningResult> best() {
        return results.stream().filter(TuningResult::isMeetsTargets).findFirst();
    }

    /**
     * The best configuration, or the highest-recall one when none met the targets.
     */
    public Optional<TuningResult> recommended() {
        return best().or(() -> results.stream().max(Comparator.comparingDouble(TuningResult::getRecall)));
    }
}
