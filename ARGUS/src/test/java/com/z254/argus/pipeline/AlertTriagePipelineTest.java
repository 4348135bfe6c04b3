package com.z254.argus.pipeline;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.AlertGroup;
import com.z254.argus.domain.model.HistoricalContext;
import com.z254.argus.domain.model.TriageDecision;
import com.z254.argus.fixtures.AlertFixtures;
import com.z254.argus.grouping.AlertGroupingService;
import com.z254.argus.grouping.GroupAssignment;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.observability.ArgusStructuredLogger;
import com.z254.argus.ranker.NoiseRanker;
import com.z254.argus.search.AlertSearchService;
import com.z254.argus.search.SearchResult;
import com.z254.argus.snooze.SnoozeService;
import com.z254.argus.snooze.SnoozeStoreUnavailableException;
import com.z254.argus.testing.time.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertTriagePipelineTest {

    @Mock
    private SnoozeService snoozeService;

    @Mock
    private NoiseRanker ranker;

    @Mock
    private AlertGroupingService groupingService;

    @Mock
    private AlertSearchService searchService;

    private SimpleMeterRegistry registry;
    private ArgusProperties properties;
    private AlertTriagePipeline pipeline;
    private Alert alert;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new ArgusProperties();
        properties.getPipeline().setStageTimeout(Duration.ofMillis(300));
        pipeline = new AlertTriagePipeline(snoozeService, ranker, groupingService, searchService,
                new ArgusMetrics(registry), new ArgusStructuredLogger(), properties,
                new MutableClock(AlertFixtures.T0));
        alert = AlertFixtures.cpuAlert("alert-1").build();

        lenient().when(snoozeService.autoUnsnoozeIfChanged(any())).thenReturn(Mono.just(false));
        lenient().when(snoozeService.isSnoozed(any())).thenReturn(Mono.just(false));
        lenient().when(ranker.score(any(), any())).thenReturn(0.2);
        lenient().when(ranker.effectiveThreshold()).thenReturn(0.7);
        lenient().when(groupingService.assign(any(Alert.class))).thenReturn(assignment("g-1", true, 1));
        lenient().when(searchService.searchSimilar(any(Alert.class), anyInt(), anyDouble())).thenReturn(List.of());
    }

    private static GroupAssignment assignment(String groupId, boolean created, int size) {
        AlertGroup group = AlertGroup.builder()
                .id(groupId)
                .groupKey("api:HighCPUUsage:warning")
                .alertCount(size)
                .firstSeen(AlertFixtures.T0)
                .lastSeen(AlertFixtures.T0)
                .timeWindow(Duration.ofMinutes(15))
                .build();
        return new GroupAssignment(group, created, created ? 1.0 : 0.9);
    }

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        @DisplayName("should surface a novel alert with its similar history")
        void surface() {
            when(searchService.searchSimilar(any(Alert.class), anyInt(), anyDouble()))
                    .thenReturn(List.of(new SearchResult("old-1", 0.8, Map.of())));

            StepVerifier.create(pipeline.process(alert))
                    .assertNext(decision -> {
                        assertThat(decision.getOutcome()).isEqualTo(TriageDecision.Outcome.SURFACE);
                        assertThat(decision.getNoiseScore()).isEqualTo(0.2);
                        assertThat(decision.isNewGroup()).isTrue();
                        assertThat(decision.getGroupId()).isEqualTo("g-1");
                        assertThat(decision.getSimilarAlerts()).extracting(TriageDecision.SimilarAlert::getAlertId)
                                .containsExactly("old-1");
                        assertThat(decision.getDegradations()).isEmpty();
                        assertThat(decision.getDecidedAt()).isEqualTo(AlertFixtures.T0);
                    })
                    .verifyComplete();
            verify(searchService).index(alert);
            assertThat(registry.get("argus.alerts.processed").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should suppress a confident noise score and still group it")
        void suppress() {
            when(ranker.score(any(), any())).thenReturn(0.92);

            StepVerifier.create(pipeline.process(alert, HistoricalContext.builder().count24h(30).build()))
                    .assertNext(decision -> {
                        assertThat(decision.getOutcome()).isEqualTo(TriageDecision.Outcome.SUPPRESS);
                        assertThat(decision.isSuppressed()).isTrue();
                        assertThat(decision.getGroupId()).isEqualTo("g-1");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report an alert merged into an open group as grouped")
        void grouped() {
            when(groupingService.assign(any(Alert.class))).thenReturn(assignment("g-7", false, 4));

            StepVerifier.create(pipeline.process(alert))
                    .assertNext(decision -> {
                        assertThat(decision.getOutcome()).isEqualTo(TriageDecision.Outcome.GROUPED);
                        assertThat(decision.getGroupSize()).isEqualTo(4);
                        assertThat(decision.isNewGroup()).isFalse();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should stop at an active snooze")
        void snoozed() {
            when(snoozeService.isSnoozed("alert-1")).thenReturn(Mono.just(true));

            StepVerifier.create(pipeline.process(alert))
                    .assertNext(decision -> {
                        assertThat(decision.getOutcome()).isEqualTo(TriageDecision.Outcome.SNOOZED);
                        assertThat(decision.isSnoozed()).isTrue();
                        assertThat(decision.getGroupId()).isNull();
                    })
                    .verifyComplete();
            verify(ranker, never()).score(any(), any());
            verify(groupingService, never()).assign(any(Alert.class));
        }

        @Test
        @DisplayName("should skip indexing when disabled")
        void noIndexing() {
            properties.getPipeline().setIndexAlerts(false);

            pipeline.process(alert).block();

            verify(searchService, never()).index(any(Alert.class));
        }
    }

    @Nested
    @DisplayName("Degradation")
    class Degradation {

        @Test
        @DisplayName("should surface unscored alerts while the ranker has no model")
        void rankerNotReady() {
            when(ranker.score(any(), any())).thenThrow(new NoiseRanker.ModelNotReadyException("no model"));

            StepVerifier.create(pipeline.process(alert))
                    .assertNext(decision -> {
                        assertThat(decision.getOutcome()).isEqualTo(TriageDecision.Outcome.SURFACE);
                        assertThat(decision.getNoiseScore()).isNull();
                        assertThat(decision.getDegradations()).containsExactly("ranker:not_ready");
                    })
                    .verifyComplete();
            assertThat(registry.get("argus.pipeline.degradations").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should carry on without snooze state when the store is down")
        void snoozeStoreDown() {
            when(snoozeService.autoUnsnoozeIfChanged(any())).thenReturn(Mono.error(
                    new SnoozeStoreUnavailableException("down", new IllegalStateException("refused"))));

            StepVerifier.create(pipeline.process(alert))
                    .assertNext(decision -> {
                        assertThat(decision.getOutcome()).isEqualTo(TriageDecision.Outcome.SURFACE);
                        assertThat(decision.getDegradations()).containsExactly("snooze");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should give up on a slow grouping stage after its timeout")
        void groupingTimeout() {
            when(groupingService.assign(any(Alert.class))).thenAnswer(invocation -> {
                Thread.sleep(1_000);
                return assignment("late", false, 2);
            });

            StepVerifier.create(pipeline.process(alert))
                    .assertNext(decision -> {
                        assertThat(decision.getOutcome()).isEqualTo(TriageDecision.Outcome.SURFACE);
                        assertThat(decision.getGroupId()).isNull();
                        assertThat(decision.getDegradations()).containsExactly("grouping");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should record every failed stage")
        void severalFailures() {
            when(ranker.score(any(), any())).thenThrow(new IllegalStateException("boom"));
            when(searchService.searchSimilar(any(Alert.class), anyInt(), anyDouble()))
                    .thenThrow(new IllegalStateException("index offline"));

            StepVerifier.create(pipeline.process(alert))
                    .assertNext(decision -> assertThat(decision.getDegradations())
                            .containsExactly("ranker", "search"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("should run requests for the same alert one after another")
        void sameIdSerialized() {
            AtomicInteger active = new AtomicInteger();
            AtomicInteger maxActive = new AtomicInteger();
            when(groupingService.assign(any(Alert.class))).thenAnswer(invocation -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                Thread.sleep(50);
                active.decrementAndGet();
                return assignment("g-1", true, 1);
            });

            StepVerifier.create(Flux.merge(pipeline.process(alert), pipeline.process(alert), pipeline.process(alert)))
                    .expectNextCount(3)
                    .verifyComplete();

            assertThat(maxActive.get()).isEqualTo(1);
            await().atMost(Duration.ofSeconds(2)).until(() -> pipeline.inFlightCount() == 0);
        }

        @Test
        @DisplayName("should hold the next request for an alert until timed-out work has finished")
        void timedOutWorkHoldsTurn() {
            AtomicInteger active = new AtomicInteger();
            AtomicInteger maxActive = new AtomicInteger();
            AtomicInteger calls = new AtomicInteger();
            when(groupingService.assign(any(Alert.class))).thenAnswer(invocation -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(calls.incrementAndGet() == 1 ? 800 : 10);
                } finally {
                    active.decrementAndGet();
                }
                return assignment("g-1", false, 2);
            });

            StepVerifier.create(pipeline.process(alert))
                    .assertNext(decision -> {
                        assertThat(decision.getOutcome()).isEqualTo(TriageDecision.Outcome.SURFACE);
                        assertThat(decision.getDegradations()).containsExactly("grouping");
                    })
                    .verifyComplete();
            assertThat(pipeline.inFlightCount()).isEqualTo(1);

            StepVerifier.create(pipeline.process(alert))
                    .assertNext(decision -> {
                        assertThat(decision.getOutcome()).isEqualTo(TriageDecision.Outcome.GROUPED);
                        assertThat(decision.getDegradations()).isEmpty();
                    })
                    .verifyComplete();

            assertThat(calls.get()).isEqualTo(2);
            assertThat(maxActive.get()).isEqualTo(1);
            await().atMost(Duration.ofSeconds(2)).until(() -> pipeline.inFlightCount() == 0);
        }

        @Test
        @DisplayName("should run different alerts in parallel")
        void differentIdsParallel() {
            AtomicInteger active = new AtomicInteger();
            AtomicInteger maxActive = new AtomicInteger();
            when(groupingService.assign(any(Alert.class))).thenAnswer(invocation -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                Thread.sleep(150);
                active.decrementAndGet();
                return assignment("g-1", true, 1);
            });

            Flux<Alert> alerts = Flux.range(0, 4).map(i -> AlertFixtures.cpuAlert("p-" + i).build());
            StepVerifier.create(pipeline.processAll(alerts, 4))
                    .expectNextCount(4)
                    .verifyComplete();

            assertThat(maxActive.get()).isGreaterThan(1);
        }
    }
}
