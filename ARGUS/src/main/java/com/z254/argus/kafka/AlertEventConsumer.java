package com.z254.argus.kafka;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.TriageDecision;
import com.z254.argus.kafka.AlertEventMapper.AlertEvent;
import com.z254.argus.kafka.AlertEventMapper.InvalidAlertEventException;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.pipeline.AlertTriagePipeline;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Kafka consumer for incoming alerts.
 * <p>
 * Each record is triaged on the listener thread so the offset is only
 * acknowledged after its decision has been handed to the producer. Records for
 * the same alert id land on the same partition and are therefore seen in order.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "argus.kafka", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AlertEventConsumer {

    static final String PIPELINE_STAGE = "pipeline";

    private final AlertTriagePipeline pipeline;
    private final AlertEventMapper mapper;
    private final TriageDecisionProducer producer;
    private final ArgusMetrics metrics;
    private final Duration processTimeout;
    private final Clock clock;

    public AlertEventConsumer(AlertTriagePipeline pipeline,
                              AlertEventMapper mapper,
                              TriageDecisionProducer producer,
                              ArgusMetrics metrics,
                              ArgusProperties argusProperties,
                              Clock clock) {
        this.pipeline = pipeline;
        this.mapper = mapper;
        this.producer = producer;
        this.metrics = metrics;
        this.processTimeout = argusProperties.getKafka().getProcessTimeout();
        this.clock = clock;
    }

    @KafkaListener(
            topics = "${argus.kafka.topics.alerts-input}",
            groupId = "${argus.kafka.consumer-group:argus-triage}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, Map<String, Object>> record, Acknowledgment ack) {
        try {
            AlertEvent event;
            try {
                event = mapper.map(record.value());
            } catch (InvalidAlertEventException e) {
                metrics.recordInvalidEvent();
                log.warn("Skipping invalid alert event at partition {} offset {}: {}",
                        record.partition(), record.offset(), e.getMessage());
                return;
            }

            String alertId = event.alert().getId();
            MDC.put("alertId", alertId);
            log.debug("Received alert {} from partition {} offset {}", alertId, record.partition(), record.offset());

            producer.publish(triage(event));
        } finally {
            ack.acknowledge();
            MDC.remove("alertId");
        }
    }

    /**
     * Runs the pipeline, surfacing the alert when the pipeline itself fails.
     */
    TriageDecision triage(AlertEvent event) {
        String alertId = event.alert().getId();
        try {
            TriageDecision decision = pipeline.process(event.alert(), event.historical()).block(processTimeout);
            if (decision != null) {
                return decision;
            }
            log.error("Pipeline completed without a decision for alert {}", alertId);
        } catch (RuntimeException e) {
            log.error("Pipeline failed for alert {}, surfacing it: {}", alertId, e.getMessage(), e);
        }
        metrics.recordDegradation(PIPELINE_STAGE);
        List<String> degradations = new ArrayList<>();
        degradations.add(PIPELINE_STAGE);
        return TriageDecision.builder()
                .alertId(alertId)
                .outcome(TriageDecision.Outcome.SURFACE)
                .degradations(degradations)
                .decidedAt(clock.instant())
                .build();
    }
}
