package com.z254.argus.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of running one alert through the triage pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriageDecision {

    private String alertId;
    private Outcome outcome;

    /** Noise probability, {@code null} when scoring was unavailable */
    private Double noiseScore;
    private boolean suppressed;
    private boolean snoozed;

    private String groupId;
    private String groupKey;
    private boolean newGroup;
    private int groupSize;

    @Builder.Default
    private List<SimilarAlert> similarAlerts = new ArrayList<>();

    /** Stages that degraded and were skipped */
    @Builder.Default
    private List<String> degradations = new ArrayList<>();

    private Instant decidedAt;

    public enum Outcome {
        /** Novel signal shown to operators */
        SURFACE,
        /** Likely noise */
        SUPPRESS,
        /** Actively snoozed by an operator */
        SNOOZED,
        /** Merged into an existing open group */
        GROUPED
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SimilarAlert {
        private String alertId;
        private double score;
    }
}
