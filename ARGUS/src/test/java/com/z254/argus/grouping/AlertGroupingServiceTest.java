package com.z254.argus.grouping;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.AlertGroup;
import com.z254.argus.domain.model.MergeSuggestion;
import com.z254.argus.domain.model.Severity;
import com.z254.argus.fixtures.AlertFixtures;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.observability.ArgusStructuredLogger;
import com.z254.argus.rules.RuleConfigLoader;
import com.z254.argus.rules.RuleEngine;
import com.z254.argus.testing.time.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AlertGroupingServiceTest {

    private static final String RULES = """
            services:
              api:
                rules:
                  - name: API latency
                    priority: 10
                    conditions:
                      - field: name
                        operator: contains
                        value: Latency
                    grouping_keys: [service, environment]
                    similarity_threshold: 0.5
                    time_window: 5m
            """;

    private ArgusProperties properties;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private RuleEngine ruleEngine;
    private AlertGroupingService service;

    @BeforeEach
    void setUp() {
        properties = new ArgusProperties();
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(AlertFixtures.T0);
        ruleEngine = new RuleEngine(properties, new RuleConfigLoader(properties), new DefaultResourceLoader(),
                new ArgusStructuredLogger());
        ruleEngine.loadYaml(RULES);
        service = new AlertGroupingService(ruleEngine, new AlertSimilarity(properties), new ArgusMetrics(registry),
                new ArgusStructuredLogger(), properties, clock);
    }

    private static Alert highCpu(String id, Instant firedAt) {
        return Alert.builder()
                .id(id)
                .name("HighCPU")
                .severity(Severity.WARNING)
                .labels(Map.of("service", "api", "env", "prod"))
                .firedAt(firedAt)
                .build();
    }

    @Nested
    @DisplayName("Assignment")
    class Assignment {

        @Test
        @DisplayName("should fold two identical alerts two minutes apart into one group")
        void scenarioA() {
            GroupAssignment first = service.assign(highCpu("a-1", AlertFixtures.T0));
            GroupAssignment second = service.assign(highCpu("a-2", AlertFixtures.T0.plus(Duration.ofMinutes(2))));

            assertThat(first.created()).isTrue();
            assertThat(second.created()).isFalse();
            assertThat(second.similarity()).isEqualTo(1.0);
            assertThat(second.group().getId()).isEqualTo(first.group().getId());
            assertThat(second.group().getAlertCount()).isEqualTo(2);
            assertThat(second.group().getMemberAlertIds()).containsExactly("a-1", "a-2");
            assertThat(second.group().getLastSeen()).isEqualTo(AlertFixtures.T0.plus(Duration.ofMinutes(2)));
            assertThat(service.openGroupCount()).isEqualTo(1);
            assertThat(registry.get("argus.groups.created").counter().count()).isEqualTo(1.0);
            assertThat(registry.get("argus.groups.merged").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should count the same alert twice but keep a single group")
        void sameAlertTwice() {
            Alert alert = highCpu("dup", AlertFixtures.T0);

            service.assign(alert);
            GroupAssignment again = service.assign(alert);

            assertThat(again.created()).isFalse();
            assertThat(again.group().getAlertCount()).isEqualTo(2);
            assertThat(service.openGroups()).hasSize(1);
        }

        @Test
        @DisplayName("should merge at the window edge and split just beyond it")
        void windowEdges() {
            Duration window = properties.getRules().getDefaultTimeWindow();
            service.assign(highCpu("a-1", AlertFixtures.T0));

            GroupAssignment edge = service.assign(highCpu("a-2", AlertFixtures.T0.plus(window)));
            GroupAssignment beyond = service.assign(highCpu("a-3",
                    AlertFixtures.T0.plus(window).plus(window).plusSeconds(1)));

            assertThat(edge.created()).isFalse();
            assertThat(beyond.created()).isTrue();
            assertThat(service.openGroupCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should accept late alerts inside the window and move first-seen back")
        void lateArrival() {
            service.assign(highCpu("a-1", AlertFixtures.T0));

            GroupAssignment late = service.assign(highCpu("a-0", AlertFixtures.T0.minusSeconds(60)));

            assertThat(late.created()).isFalse();
            assertThat(late.group().getFirstSeen()).isEqualTo(AlertFixtures.T0.minusSeconds(60));
            assertThat(late.group().getLastSeen()).isEqualTo(AlertFixtures.T0);
        }

        @Test
        @DisplayName("should keep alerts with different keys apart")
        void differentKeys() {
            service.assign(highCpu("a-1", AlertFixtures.T0));
            service.assign(highCpu("a-2", AlertFixtures.T0).toBuilder().severity(Severity.CRITICAL).build());

            assertThat(service.openGroups()).extracting(AlertGroup::getGroupKey)
                    .containsExactlyInAnyOrder("api:HighCPU:warning", "api:HighCPU:critical");
        }

        @Test
        @DisplayName("should capture the matching rule's threshold and window")
        void ruleParameters() {
            Alert latency = AlertFixtures.cpuAlert("l-1").name("APILatencyHigh").build();

            AlertGroup group = service.assign(latency).group();

            assertThat(group.getMatchedRule()).isEqualTo("API latency");
            assertThat(group.getGroupKey()).isEqualTo("api:production");
            assertThat(group.getSimilarityThreshold()).isEqualTo(0.5);
            assertThat(group.getTimeWindow()).isEqualTo(Duration.ofMinutes(5));
        }

        @Test
        @DisplayName("should never open duplicate groups under concurrent assignment")
        void concurrent() throws Exception {
            int threads = 8;
            int perThread = 50;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        service.assign(highCpu("c-" + thread + "-" + i, AlertFixtures.T0.plusSeconds(i)));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            List<AlertGroup> groups = service.openGroups();
            assertThat(groups).hasSize(1);
            assertThat(groups.get(0).getAlertCount()).isEqualTo(threads * perThread);
        }

        @Test
        @DisplayName("should place into caller-supplied groups without touching the registry")
        void externalGroups() {
            List<OpenGroup> external = new ArrayList<>();

            service.assign(highCpu("e-1", AlertFixtures.T0), external);
            GroupAssignment second = service.assign(highCpu("e-2", AlertFixtures.T0.plusSeconds(30)), external);

            assertThat(external).hasSize(1);
            assertThat(second.group().getAlertCount()).isEqualTo(2);
            assertThat(service.openGroupCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Batches, expiry and merge suggestions")
    class Lifecycle {

        @Test
        @DisplayName("should group a batch in fired-at order")
        void batch() {
            List<AlertGroup> groups = service.group(List.of(
                    highCpu("b-3", AlertFixtures.T0.plus(Duration.ofHours(2))),
                    highCpu("b-1", AlertFixtures.T0),
                    highCpu("b-2", AlertFixtures.T0.plusSeconds(90))));

            assertThat(groups).hasSize(2);
            assertThat(groups.get(0).getMemberAlertIds()).containsExactly("b-1", "b-2");
            assertThat(groups.get(1).getMemberAlertIds()).containsExactly("b-3");
            assertThat(service.openGroupCount()).isZero();
        }

        @Test
        @DisplayName("should close idle groups and keep them findable")
        void expiry() {
            String groupId = service.assign(highCpu("x-1", AlertFixtures.T0)).group().getId();
            clock.advance(Duration.ofMinutes(16));

            service.expireStaleGroups();

            assertThat(service.openGroupCount()).isZero();
            assertThat(service.findGroup(groupId)).hasValueSatisfying(g ->
                    assertThat(g.getStatus()).isEqualTo(AlertGroup.GroupStatus.CLOSED));
            assertThat(registry.get("argus.groups.expired").counter().count()).isEqualTo(1.0);
            assertThat(service.expireGroups(clock.instant())).isEmpty();
        }

        @Test
        @DisplayName("should keep groups that are still inside their window")
        void notYetExpired() {
            service.assign(highCpu("x-1", AlertFixtures.T0));

            assertThat(service.expireGroups(AlertFixtures.T0.plus(Duration.ofMinutes(15)))).isEmpty();
            assertThat(service.openGroupCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should suggest merging groups with near-identical representatives")
        void mergeSuggestions() {
            AlertGroup warning = service.assign(highCpu("m-1", AlertFixtures.T0)).group();
            AlertGroup critical = service.assign(highCpu("m-2", AlertFixtures.T0).toBuilder()
                    .severity(Severity.CRITICAL).build()).group();
            service.assign(AlertFixtures.alert("m-3", "DiskFull", Severity.CRITICAL, Map.of("service", "storage")));

            List<MergeSuggestion> suggestions = service.suggestMerges();

            assertThat(suggestions).hasSize(1);
            MergeSuggestion suggestion = suggestions.get(0);
            assertThat(List.of(suggestion.getGroupIdA(), suggestion.getGroupIdB()))
                    .containsExactlyInAnyOrder(warning.getId(), critical.getId());
            assertThat(suggestion.getSimilarity()).isGreaterThan(0.85);
            assertThat(service.openGroupCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should fall back to key similarity for groups it does not know")
        void unknownGroups() {
            AlertGroup a = AlertGroup.builder().id("g-a").groupKey("api:HighCPU:warning").build();
            AlertGroup b = AlertGroup.builder().id("g-b").groupKey("api:HighCPU:warninG").build();
            AlertGroup c = AlertGroup.builder().id("g-c").groupKey("db:Replication:critical").build();

            List<MergeSuggestion> suggestions = service.suggestMerges(List.of(a, b, c));

            assertThat(suggestions).extracting(MergeSuggestion::getGroupIdA).containsExactly("g-a");
            assertThat(suggestions).extracting(MergeSuggestion::getGroupIdB).containsExactly("g-b");
        }
    }
}
