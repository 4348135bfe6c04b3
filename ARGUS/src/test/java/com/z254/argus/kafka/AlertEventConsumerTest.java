package com.z254.argus.kafka;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.HistoricalContext;
import com.z254.argus.domain.model.TriageDecision;
import com.z254.argus.fixtures.AlertFixtures;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.pipeline.AlertTriagePipeline;
import com.z254.argus.testing.time.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertEventConsumerTest {

    @Mock
    private AlertTriagePipeline pipeline;

    @Mock
    private TriageDecisionProducer producer;

    @Mock
    private Acknowledgment ack;

    private SimpleMeterRegistry registry;
    private AlertEventConsumer consumer;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        ArgusProperties properties = new ArgusProperties();
        properties.getKafka().setProcessTimeout(Duration.ofMillis(200));
        MutableClock clock = new MutableClock(AlertFixtures.T0);
        consumer = new AlertEventConsumer(pipeline, new AlertEventMapper(clock), producer,
                new ArgusMetrics(registry), properties, clock);
    }

    private static ConsumerRecord<String, Map<String, Object>> record(Map<String, Object> value) {
        return new ConsumerRecord<>("argus.alerts.incoming", 0, 42L, "key", value);
    }

    @Test
    void publishesPipelineDecisionThenAcknowledges() {
        TriageDecision decision = TriageDecision.builder()
                .alertId("a-1")
                .outcome(TriageDecision.Outcome.GROUPED)
                .build();
        when(pipeline.process(any(Alert.class), any(HistoricalContext.class))).thenReturn(Mono.just(decision));

        consumer.consume(record(Map.of("id", "a-1", "name", "HighCPUUsage")), ack);

        verify(producer).publish(decision);
        verify(ack).acknowledge();
    }

    @Test
    void surfacesAlertWhenPipelineFails() {
        when(pipeline.process(any(Alert.class), any(HistoricalContext.class)))
                .thenReturn(Mono.error(new IllegalStateException("boom")));

        consumer.consume(record(Map.of("id", "a-2", "name", "HighCPUUsage")), ack);

        ArgumentCaptor<TriageDecision> published = ArgumentCaptor.forClass(TriageDecision.class);
        verify(producer).publish(published.capture());
        assertThat(published.getValue().getOutcome()).isEqualTo(TriageDecision.Outcome.SURFACE);
        assertThat(published.getValue().getDegradations()).containsExactly("pipeline");
        assertThat(published.getValue().getDecidedAt()).isEqualTo(AlertFixtures.T0);
        assertThat(registry.get("argus.pipeline.degradations").counter().count()).isEqualTo(1.0);
        verify(ack).acknowledge();
    }

    @Test
    void surfacesAlertWhenPipelineHangs() {
        when(pipeline.process(any(Alert.class), any(HistoricalContext.class))).thenReturn(Mono.never());

        consumer.consume(record(Map.of("id", "a-3", "name", "HighCPUUsage")), ack);

        ArgumentCaptor<TriageDecision> published = ArgumentCaptor.forClass(TriageDecision.class);
        verify(producer).publish(published.capture());
        assertThat(published.getValue().getDegradations()).containsExactly("pipeline");
    }

    @Test
    void skipsAndAcknowledgesInvalidEvents() {
        consumer.consume(record(Map.of("name", "NoId")), ack);

        verify(pipeline, never()).process(any(Alert.class), any(HistoricalContext.class));
        verify(producer, never()).publish(any());
        verify(ack).acknowledge();
        assertThat(registry.get("argus.alerts.invalid").counter().count()).isEqualTo(1.0);
    }
}
