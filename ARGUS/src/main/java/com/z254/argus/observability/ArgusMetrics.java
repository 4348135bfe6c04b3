package com.z254.argus.observability;

import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Centralized metrics for the ARGUS service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Triage outcomes (suppression rate, volume reduction)</li>
 *     <li>Noise ranker scoring (latency, score distribution, model state)</li>
 *     <li>Vector search (query latency, index size)</li>
 *     <li>Grouping and snoozing</li>
 *     <li>Threshold values and false-negative rate</li>
 * </ul>
 */
@Component
public class ArgusMetrics {

    private final MeterRegistry meterRegistry;

    // Triage metrics
    @Getter
    private final Counter alertsProcessed;
    @Getter
    private final Counter alertsSuppressed;
    @Getter
    private final Counter alertsSurfaced;
    @Getter
    private final Counter pipelineDegradations;
    @Getter
    private final Counter invalidEvents;
    private final Timer pipelineLatency;
    private final Map<String, Counter> outcomes = new ConcurrentHashMap<>();

    // Ranker metrics
    @Getter
    private final Counter modelNotReady;
    @Getter
    private final Counter modelReloads;
    private final Timer scoringLatency;
    private final DistributionSummary noiseScores;
    private final AtomicReference<Double> volumeReduction = new AtomicReference<>(0.0);

    // Search metrics
    private final Timer searchLatency;
    private final AtomicLong indexedVectors;
    private final AtomicLong tombstonedVectors;
    @Getter
    private final Counter indexPersistenceErrors;

    // Grouping metrics
    @Getter
    private final Counter groupsCreated;
    @Getter
    private final Counter alertsMerged;
    @Getter
    private final Counter groupsExpired;
    private final AtomicInteger openGroups;

    // Snooze metrics
    @Getter
    private final Counter snoozesUnsnoozedManual;
    @Getter
    private final Counter snoozesUnsnoozedAuto;
    @Getter
    private final Counter snoozeConflicts;
    private final Map<String, Counter> snoozesByBucket = new ConcurrentHashMap<>();
    private final AtomicLong activeSnoozes;

    // Threshold metrics
    private final AtomicReference<Double> noiseThreshold = new AtomicReference<>(0.0);
    private final AtomicReference<Double> confidenceMin = new AtomicReference<>(0.0);
    private final AtomicReference<Double> falseNegativeRate = new AtomicReference<>(0.0);
    @Getter
    private final Counter thresholdSaveErrors;
    @Getter
    private final Counter thresholdAdjustments;

    public ArgusMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // Initialize triage metrics
        this.alertsProcessed = Counter.builder("argus.alerts.processed")
                .description("Alerts run through the triage pipeline")
                .register(meterRegistry);
        this.alertsSuppressed = Counter.builder("argus.alerts.suppressed")
                .description("Alerts suppressed as noise")
                .register(meterRegistry);
        this.alertsSurfaced = Counter.builder("argus.alerts.surfaced")
                .description("Alerts surfaced as new signals")
                .register(meterRegistry);
        this.pipelineDegradations = Counter.builder("argus.pipeline.degradations")
                .description("Pipeline stages skipped due to degraded conditions")
                .register(meterRegistry);
        this.invalidEvents = Counter.builder("argus.alerts.invalid")
                .description("Inbound alert events that could not be mapped")
                .register(meterRegistry);
        this.pipelineLatency = Timer.builder("argus.pipeline.latency")
                .description("End-to-end triage latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        Gauge.builder("argus.alerts.suppression_rate", this, ArgusMetrics::suppressionRate)
                .description("Share of processed alerts that were suppressed")
                .register(meterRegistry);

        // Initialize ranker metrics
        this.modelNotReady = Counter.builder("argus.ranker.not_ready")
                .description("Scoring requests made before a model was loaded")
                .register(meterRegistry);
        this.modelReloads = Counter.builder("argus.ranker.model.reloads")
                .description("Model bundles loaded")
                .register(meterRegistry);
        this.scoringLatency = Timer.builder("argus.ranker.latency")
                .description("Noise scoring latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.noiseScores = DistributionSummary.builder("argus.ranker.score")
                .description("Noise probability distribution")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
        Gauge.builder("argus.ranker.volume_reduction", volumeReduction, AtomicReference::get)
                .description("Share of the last ranked batch above the suppression threshold")
                .register(meterRegistry);

        // Initialize search metrics
        this.searchLatency = Timer.builder("argus.search.latency")
                .description("Vector search query latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.indexedVectors = meterRegistry.gauge("argus.search.index.size", new AtomicLong(0));
        this.tombstonedVectors = meterRegistry.gauge("argus.search.index.tombstones", new AtomicLong(0));
        this.indexPersistenceErrors = Counter.builder("argus.search.persistence.errors")
                .description("Index snapshot failures")
                .register(meterRegistry);

        // Initialize grouping metrics
        this.groupsCreated = Counter.builder("argus.groups.created")
                .description("Alert groups opened")
                .register(meterRegistry);
        this.alertsMerged = Counter.builder("argus.groups.merged")
                .description("Alerts merged into an existing group")
                .register(meterRegistry);
        this.groupsExpired = Counter.builder("argus.groups.expired")
                .description("Alert groups closed by window expiry")
                .register(meterRegistry);
        this.openGroups = meterRegistry.gauge("argus.groups.open", new AtomicInteger(0));

        // Initialize snooze metrics
        this.snoozesUnsnoozedManual = Counter.builder("argus.snooze.unsnoozed")
                .tag("trigger", "manual")
                .description("Snoozes removed")
                .register(meterRegistry);
        this.snoozesUnsnoozedAuto = Counter.builder("argus.snooze.unsnoozed")
                .tag("trigger", "auto")
                .description("Snoozes removed")
                .register(meterRegistry);
        this.snoozeConflicts = Counter.builder("argus.snooze.conflicts")
                .description("Snooze requests rejected because one is already active")
                .register(meterRegistry);
        this.activeSnoozes = meterRegistry.gauge("argus.snooze.active", new AtomicLong(0));

        // Initialize threshold metrics
        Gauge.builder("argus.threshold.noise", noiseThreshold, AtomicReference::get)
                .description("Nominal noise threshold")
                .register(meterRegistry);
        Gauge.builder("argus.threshold.confidence_min", confidenceMin, AtomicReference::get)
                .description("Minimum confidence")
                .register(meterRegistry);
        Gauge.builder("argus.ranker.false_negative_rate", falseNegativeRate, AtomicReference::get)
                .description("Observed false-negative rate of suppression")
                .register(meterRegistry);
        this.thresholdSaveErrors = Counter.builder("argus.threshold.save_errors")
                .description("Threshold persistence failures")
                .register(meterRegistry);
        this.thresholdAdjustments = Counter.builder("argus.threshold.adjustments")
                .description("Threshold changes applied by update or calibration")
                .register(meterRegistry);
    }

    // ========== Triage Methods ==========

    public Timer.Sample startPipelineTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTriage(Timer.Sample sample, String outcome, boolean suppressed) {
        sample.stop(pipelineLatency);
        alertsProcessed.increment();
        if (suppressed) {
            alertsSuppressed.increment();
        } else {
            alertsSurfaced.increment();
        }
        outcomes.computeIfAbsent(outcome, o ->
                Counter.builder("argus.alerts.outcome")
                        .tag("outcome", o)
                        .description("Triage outcomes")
                        .register(meterRegistry)).increment();
    }

    public void recordDegradation(String stage) {
        pipelineDegradations.increment();
        Counter.builder("argus.pipeline.degradations.by_stage")
                .tag("stage", stage)
                .register(meterRegistry)
                .increment();
    }

    public void recordInvalidEvent() {
        invalidEvents.increment();
    }

    /**
     * Share of processed alerts that were suppressed; the volume reduction achieved.
     */
    public double suppressionRate() {
        double processed = alertsProcessed.count();
        return processed == 0 ? 0.0 : alertsSuppressed.count() / processed;
    }

    // ========== Ranker Methods ==========

    public Timer.Sample startScoringTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordScore(Timer.Sample sample, double score) {
        sample.stop(scoringLatency);
        noiseScores.record(score);
    }

    public void recordModelNotReady() {
        modelNotReady.increment();
    }

    public void recordModelReload() {
        modelReloads.increment();
    }

    public void updateVolumeReduction(double rate) {
        volumeReduction.set(rate);
    }

    public double volumeReduction() {
        return volumeReduction.get();
    }

    // ========== Search Methods ==========

    public void recordSearchLatency(Duration duration) {
        searchLatency.record(duration);
    }

    public void updateIndexSize(long live, long tombstoned) {
        indexedVectors.set(live);
        tombstonedVectors.set(tombstoned);
    }

    public void recordIndexPersistenceError() {
        indexPersistenceErrors.increment();
    }

    // ========== Grouping Methods ==========

    public void recordGroupCreated() {
        groupsCreated.increment();
        openGroups.incrementAndGet();
    }

    public void recordAlertMerged() {
        alertsMerged.increment();
    }

    public void recordGroupsExpired(int count) {
        groupsExpired.increment(count);
        openGroups.addAndGet(-count);
    }

    // ========== Snooze Methods ==========

    public void recordSnoozeCreated(Duration duration) {
        String bucket = durationBucket(duration);
        snoozesByBucket.computeIfAbsent(bucket, b ->
                Counter.builder("argus.snooze.created")
                        .tag("duration_bucket", b)
                        .description("Snoozes created by duration bucket")
                        .register(meterRegistry)).increment();
    }

    public void recordUnsnoozed(boolean automatic) {
        if (automatic) {
            snoozesUnsnoozedAuto.increment();
        } else {
            snoozesUnsnoozedManual.increment();
        }
    }

    public void recordSnoozeConflict() {
        snoozeConflicts.increment();
    }

    public void updateActiveSnoozes(long count) {
        activeSnoozes.set(count);
    }

    static String durationBucket(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds < 3600) {
            return "<1h";
        } else if (seconds < 6 * 3600) {
            return "1h-6h";
        } else if (seconds <= 24 * 3600) {
            return "6h-24h";
        }
        return ">24h";
    }

    // ========== Threshold Methods ==========

    public void updateThresholds(double noise, double confidence) {
        noiseThreshold.set(noise);
        confidenceMin.set(confidence);
    }

    public void updateFalseNegativeRate(double rate) {
        falseNegativeRate.set(rate);
    }

    public void recordThresholdSaveError() {
        thresholdSaveErrors.increment();
    }

    public void recordThresholdAdjustment() {
        thresholdAdjustments.increment();
    }
}
