package com.z254.argus.kafka;

import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.threshold.SuppressionOutcomeTracker;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Consumes operator verdicts on past triage decisions.
 * <p>
 * Events carry whether the alert was suppressed and whether an operator judged it
 * to be noise; they drive the false-negative guard and threshold calibration.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "argus.kafka", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SuppressionFeedbackConsumer {

    private final SuppressionOutcomeTracker tracker;
    private final ArgusMetrics metrics;

    public SuppressionFeedbackConsumer(SuppressionOutcomeTracker tracker, ArgusMetrics metrics) {
        this.tracker = tracker;
        this.metrics = metrics;
    }

    @KafkaListener(
            topics = "${argus.kafka.topics.suppression-feedback}",
            groupId = "${argus.kafka.consumer-group:argus-triage}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, Map<String, Object>> record, Acknowledgment ack) {
        try {
            Map<String, Object> data = record.value();
            Boolean predicted = data != null ? flag(data, "predicted_noise", "suppressed") : null;
            Boolean actual = data != null ? flag(data, "actually_noise", "noise") : null;
            if (predicted == null || actual == null) {
                metrics.recordInvalidEvent();
                log.warn("Skipping feedback event without verdict at partition {} offset {}",
                        record.partition(), record.offset());
                return;
            }
            tracker.record(predicted, actual);
            log.debug("Recorded feedback for alert {}: predictedNoise={}, actuallyNoise={}",
                    data.get("alert_id"), predicted, actual);
        } finally {
            ack.acknowledge();
        }
    }

    static Boolean flag(Map<String, Object> data, String... keys) {
        for (String key : keys) {
            Object value = data.get(key);
            if (value instanceof Boolean) {
                return (Boolean) value;
            }
            if (value instanceof String) {
                String text = ((String) value).trim();
                if ("true".equalsIgnoreCase(text)) {
                    return true;
                }
                if ("false".equalsIgnoreCase(text)) {
                    return false;
                }
            }
        }
        return null;
    }
}
