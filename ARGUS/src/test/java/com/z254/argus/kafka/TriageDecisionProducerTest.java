package com.z254.argus.kafka;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.MergeSuggestion;
import com.z254.argus.domain.model.TriageDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriageDecisionProducerTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private SimpleMeterRegistry registry;
    private TriageDecisionProducer producer;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        producer = new TriageDecisionProducer(kafkaTemplate, new ArgusProperties(), registry);
    }

    private static CompletableFuture<SendResult<String, Object>> sent(String topic, Object value) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 2), 0, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(topic, value), metadata));
    }

    @Test
    void publishesDecisionKeyedByAlertId() {
        TriageDecision decision = TriageDecision.builder()
                .alertId("a-1")
                .outcome(TriageDecision.Outcome.SURFACE)
                .build();
        when(kafkaTemplate.send("argus.alerts.triaged", "a-1", decision))
                .thenReturn(sent("argus.alerts.triaged", decision));

        producer.publish(decision);

        verify(kafkaTemplate).send("argus.alerts.triaged", "a-1", decision);
        assertThat(registry.get("argus.kafka.decisions.published").counter().count()).isEqualTo(1.0);
    }

    @Test
    void countsFailedSends() {
        TriageDecision decision = TriageDecision.builder()
                .alertId("a-2")
                .outcome(TriageDecision.Outcome.SUPPRESS)
                .build();
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        producer.publish(decision);

        assertThat(registry.get("argus.kafka.publish.failures").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("argus.kafka.decisions.published").counter().count()).isZero();
    }

    @Test
    void publishesEachMergeSuggestion() {
        MergeSuggestion first = new MergeSuggestion("g-1", "g-2", 0.91);
        MergeSuggestion second = new MergeSuggestion("g-3", "g-4", 0.88);
        when(kafkaTemplate.send(eq("argus.groups.merge-suggestions"), anyString(), any()))
                .thenReturn(sent("argus.groups.merge-suggestions", first));

        producer.publishMergeSuggestions(List.of(first, second));

        verify(kafkaTemplate, times(2)).send(eq("argus.groups.merge-suggestions"), anyString(), any());
        assertThat(registry.get("argus.kafka.merge_suggestions.published").counter().count()).isEqualTo(2.0);
    }
}
