package com.z254.argus.kafka;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.threshold.SuppressionOutcomeTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.Acknowledgment;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SuppressionFeedbackConsumerTest {

    private SimpleMeterRegistry registry;
    private SuppressionOutcomeTracker tracker;
    private SuppressionFeedbackConsumer consumer;
    private Acknowledgment ack;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        ArgusMetrics metrics = new ArgusMetrics(registry);
        tracker = new SuppressionOutcomeTracker(new ArgusProperties(), metrics);
        consumer = new SuppressionFeedbackConsumer(tracker, metrics);
        ack = mock(Acknowledgment.class);
    }

    private static ConsumerRecord<String, Map<String, Object>> record(Map<String, Object> value) {
        return new ConsumerRecord<>("argus.alerts.feedback", 0, 7L, "key", value);
    }

    @Test
    void recordsVerdictsIntoTracker() {
        consumer.consume(record(Map.of("alert_id", "a-1", "predicted_noise", true, "actually_noise", false)), ack);
        consumer.consume(record(Map.of("alert_id", "a-2", "suppressed", "false", "noise", "FALSE")), ack);

        assertThat(tracker.snapshot().getSampleCount()).isEqualTo(2);
        assertThat(tracker.falseNegativeRate()).isEqualTo(0.5);
        verify(ack, times(2)).acknowledge();
    }

    @Test
    void skipsEventsWithoutVerdict() {
        Map<String, Object> partial = new HashMap<>();
        partial.put("alert_id", "a-3");
        partial.put("predicted_noise", "maybe");
        partial.put("actually_noise", true);

        consumer.consume(record(partial), ack);
        consumer.consume(record(null), ack);

        assertThat(tracker.snapshot().getSampleCount()).isZero();
        assertThat(registry.get("argus.alerts.invalid").counter().count()).isEqualTo(2.0);
        verify(ack, times(2)).acknowledge();
    }

    @Test
    void readsFirstPresentFlag() {
        assertThat(SuppressionFeedbackConsumer.flag(Map.of("noise", false), "actually_noise", "noise")).isFalse();
        assertThat(SuppressionFeedbackConsumer.flag(Map.of("other", true), "noise")).isNull();
    }
}
