package com.z254.argus.kafka;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.MergeSuggestion;
import com.z254.argus.domain.model.TriageDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Kafka producer for triage decisions and group merge suggestions.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "argus.kafka", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TriageDecisionProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ArgusProperties.Kafka.Topics topics;
    private final Counter decisionsPublished;
    private final Counter publishFailures;
    private final Counter suggestionsPublished;

    public TriageDecisionProducer(KafkaTemplate<String, Object> kafkaTemplate,
                                  ArgusProperties argusProperties,
                                  MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = argusProperties.getKafka().getTopics();
        this.decisionsPublished = Counter.builder("argus.kafka.decisions.published").register(meterRegistry);
        this.publishFailures = Counter.builder("argus.kafka.publish.failures").register(meterRegistry);
        this.suggestionsPublished = Counter.builder("argus.kafka.merge_suggestions.published").register(meterRegistry);
    }

    /**
     * Publish a decision keyed by alert id so decisions for one alert stay ordered.
     */
    public void publish(TriageDecision decision) {
        String topic = topics.getTriageDecisions();
        kafkaTemplate.send(topic, decision.getAlertId(), decision)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        publishFailures.increment();
                        log.error("Failed to publish triage decision: alertId={}, error={}",
                                decision.getAlertId(), ex.getMessage());
                    } else {
                        decisionsPublished.increment();
                        log.debug("Published triage decision: alertId={}, outcome={}, partition={}",
                                decision.getAlertId(), decision.getOutcome(),
                                result.getRecordMetadata().partition());
                    }
                });
    }

    public void publishMergeSuggestions(List<MergeSuggestion> suggestions) {
        String topic = topics.getMergeSuggestions();
        for (MergeSuggestion suggestion : suggestions) {
            kafkaTemplate.send(topic, suggestion.getGroupIdA(), suggestion)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            publishFailures.increment();
                            log.error("Failed to publish merge suggestion: {} <-> {}, error={}",
                                    suggestion.getGroupIdA(), suggestion.getGroupIdB(), ex.getMessage());
                        } else {
                            suggestionsPublished.increment();
                        }
                    });
        }
    }
}
