package com.z254.argus.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ArgusMetricsTest {

    private SimpleMeterRegistry registry;
    private ArgusMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ArgusMetrics(registry);
    }

    @Test
    void tracksOutcomesAndSuppressionRate() {
        metrics.recordTriage(metrics.startPipelineTimer(), "SUPPRESS", true);
        metrics.recordTriage(metrics.startPipelineTimer(), "SURFACE", false);
        metrics.recordTriage(metrics.startPipelineTimer(), "SURFACE", false);
        metrics.recordTriage(metrics.startPipelineTimer(), "GROUPED", false);

        assertThat(registry.get("argus.alerts.outcome").tag("outcome", "SURFACE").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("argus.pipeline.latency").timer().count()).isEqualTo(4);
        assertThat(metrics.suppressionRate()).isEqualTo(0.25);
        assertThat(registry.get("argus.alerts.suppression_rate").gauge().value()).isEqualTo(0.25);
    }

    @Test
    void suppressionRateIsZeroBeforeTraffic() {
        assertThat(metrics.suppressionRate()).isZero();
    }

    @Test
    void tagsDegradationsByStage() {
        metrics.recordDegradation("search");
        metrics.recordDegradation("search");
        metrics.recordDegradation("snooze");

        assertThat(registry.get("argus.pipeline.degradations").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("argus.pipeline.degradations.by_stage").tag("stage", "search").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void tracksOpenGroups() {
        metrics.recordGroupCreated();
        metrics.recordGroupCreated();
        metrics.recordGroupCreated();
        metrics.recordGroupsExpired(2);

        assertThat(registry.get("argus.groups.open").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("argus.groups.expired").counter().count()).isEqualTo(2.0);
    }

    @Test
    void bucketsSnoozeDurations() {
        assertThat(ArgusMetrics.durationBucket(Duration.ofMinutes(30))).isEqualTo("<1h");
        assertThat(ArgusMetrics.durationBucket(Duration.ofHours(1))).isEqualTo("1h-6h");
        assertThat(ArgusMetrics.durationBucket(Duration.ofHours(6))).isEqualTo("6h-24h");
        assertThat(ArgusMetrics.durationBucket(Duration.ofHours(24))).isEqualTo("6h-24h");
        assertThat(ArgusMetrics.durationBucket(Duration.ofHours(25))).isEqualTo(">24h");

        metrics.recordSnoozeCreated(Duration.ofHours(2));
        assertThat(registry.get("argus.snooze.created").tag("duration_bucket", "1h-6h").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void separatesManualAndAutomaticUnsnoozes() {
        metrics.recordUnsnoozed(true);
        metrics.recordUnsnoozed(false);
        metrics.recordUnsnoozed(true);

        assertThat(registry.get("argus.snooze.unsnoozed").tag("trigger", "auto").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("argus.snooze.unsnoozed").tag("trigger", "manual").counter().count()).isEqualTo(1.0);
    }

    @Test
    void publishesThresholdGauges() {
        metrics.updateThresholds(0.9, 0.8);
        metrics.updateFalseNegativeRate(0.02);
        metrics.updateIndexSize(120, 8);

        assertThat(registry.get("argus.threshold.noise").gauge().value()).isEqualTo(0.9);
        assertThat(registry.get("argus.threshold.confidence_min").gauge().value()).isEqualTo(0.8);
        assertThat(registry.get("argus.ranker.false_negative_rate").gauge().value()).isEqualTo(0.02);
        assertThat(registry.get("argus.search.index.size").gauge().value()).isEqualTo(120.0);
    }
}
