package com.z254.argus.threshold;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.PerformanceMetrics;
import com.z254.argus.domain.model.ThresholdConfig;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.observability.ArgusStructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.lang.reflect.Modifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ThresholdServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ArgusProperties properties;
    private SimpleMeterRegistry registry;
    private ThresholdService service;

    @BeforeEach
    void setUp() {
        properties = new ArgusProperties();
        properties.getThresholds().setConfigPath(tempDir.resolve("config/thresholds.json").toString());
        registry = new SimpleMeterRegistry();
        service = newService();
        service.load();
    }

    private ThresholdService newService() {
        return new ThresholdService(properties, objectMapper, new ArgusMetrics(registry), new ArgusStructuredLogger());
    }

    private static PerformanceMetrics performance(double fpr, double accuracy) {
        return PerformanceMetrics.builder()
                .falsePositiveRate(fpr)
                .accuracy(accuracy)
                .sampleCount(500)
                .build();
    }

    @Nested
    @DisplayName("Updates")
    class Updates {

        @Test
        @DisplayName("should start from defaults when nothing is persisted")
        void defaults() {
            ThresholdConfig config = service.get();

            assertThat(config.getNoiseThreshold()).isEqualTo(0.7);
            assertThat(config.getConfidenceMin()).isEqualTo(0.85);
            assertThat(config.getBatchSize()).isEqualTo(100);
            assertThat(config.getLearningRate()).isEqualTo(0.01);
        }

        @Test
        @DisplayName("should clamp out-of-range values")
        void clamps() {
            ThresholdConfig config = service.update(Map.of(
                    ThresholdService.NOISE_THRESHOLD, 5.0,
                    ThresholdService.CONFIDENCE_MIN, 0.1,
                    ThresholdService.BATCH_SIZE, 50_000,
                    ThresholdService.LEARNING_RATE, "0.5"));

            assertThat(config.getNoiseThreshold()).isEqualTo(0.95);
            assertThat(config.getConfidenceMin()).isEqualTo(0.7);
            assertThat(config.getBatchSize()).isEqualTo(1000);
            assertThat(config.getLearningRate()).isEqualTo(0.5);
            assertThat(registry.get("argus.threshold.noise").gauge().value()).isEqualTo(0.95);
        }

        @Test
        @DisplayName("should reject unknown keys without applying anything")
        void unknownKey() {
            assertThatThrownBy(() -> service.update(Map.of(
                    ThresholdService.NOISE_THRESHOLD, 0.8,
                    "bogus_key", 1.0)))
                    .isInstanceOf(InvalidThresholdUpdateException.class)
                    .satisfies(e -> assertThat(((InvalidThresholdUpdateException) e).getRejectedKeys())
                            .containsExactly("bogus_key"));

            assertThat(service.get().getNoiseThreshold()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("should reject non-numeric and non-finite values")
        void nonNumeric() {
            Map<String, Object> updates = new HashMap<>();
            updates.put(ThresholdService.NOISE_THRESHOLD, "high");
            updates.put(ThresholdService.CONFIDENCE_MIN, Double.NaN);
            updates.put(ThresholdService.BATCH_SIZE, null);

            assertThatThrownBy(() -> service.update(updates))
                    .isInstanceOf(InvalidThresholdUpdateException.class)
                    .satisfies(e -> assertThat(((InvalidThresholdUpdateException) e).getRejectedKeys())
                            .containsExactlyInAnyOrder(ThresholdService.NOISE_THRESHOLD,
                                    ThresholdService.CONFIDENCE_MIN, ThresholdService.BATCH_SIZE));
        }

        @Test
        @DisplayName("should persist updates and reload them")
        void persists() {
            service.update(Map.of(ThresholdService.NOISE_THRESHOLD, 0.8));

            ThresholdService reloaded = newService();
            reloaded.load();

            assertThat(Files.exists(service.getConfigPath())).isTrue();
            assertThat(reloaded.get().getNoiseThreshold()).isEqualTo(0.8);
        }

        @Test
        @DisplayName("should clamp persisted values on load and fall back on unreadable files")
        void loadsDefensively() throws IOException {
            Files.createDirectories(service.getConfigPath().getParent());
            Files.writeString(service.getConfigPath(), "{\"noise_threshold\": 3.0, \"extra\": true}");
            ThresholdService clamped = newService();
            clamped.load();
            assertThat(clamped.get().getNoiseThreshold()).isEqualTo(0.95);

            Files.writeString(service.getConfigPath(), "{broken");
            ThresholdService fallback = newService();
            fallback.load();
            assertThat(fallback.get()).isEqualTo(ThresholdConfig.defaults());
        }

        @Test
        @DisplayName("should hand out snapshots that callers cannot change")
        void immutableSnapshots() {
            ThresholdConfig before = service.get();

            ThresholdConfig derived = before.toBuilder().noiseThreshold(0.9).build();

            assertThat(derived.getNoiseThreshold()).isEqualTo(0.9);
            assertThat(service.get()).isSameAs(before);
            assertThat(service.get().getNoiseThreshold()).isEqualTo(0.7);
            assertThat(Arrays.stream(ThresholdConfig.class.getDeclaredFields())
                    .filter(field -> !Modifier.isStatic(field.getModifiers())))
                    .isNotEmpty()
                    .allMatch(field -> Modifier.isFinal(field.getModifiers()));
        }

        @Test
        @DisplayName("should leave the persisted file equal to memory after concurrent writers")
        void concurrentWriters() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<?>> writers = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    double noise = 0.5 + i * 0.025;
                    boolean optimize = i % 2 == 0;
                    writers.add(executor.submit(() -> {
                        start.await();
                        if (optimize) {
                            return service.optimize(performance(0.2, 0.8));
                        }
                        return service.update(Map.of(ThresholdService.NOISE_THRESHOLD, noise));
                    }));
                }
                start.countDown();
                for (Future<?> writer : writers) {
                    writer.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            ThresholdConfig persisted = objectMapper.readValue(service.getConfigPath().toFile(), ThresholdConfig.class);
            assertThat(persisted).isEqualTo(service.get());
            assertThat(registry.get("argus.threshold.save_errors").counter().count()).isZero();
            assertThat(Files.exists(service.getConfigPath().resolveSibling("thresholds.json.tmp"))).isFalse();
        }

        @Test
        @DisplayName("should keep the update in memory and count a failed save")
        void saveFailure() throws IOException {
            Path blocker = tempDir.resolve("blocker");
            Files.writeString(blocker, "file, not a directory");
            properties.getThresholds().setConfigPath(blocker.resolve("thresholds.json").toString());
            ThresholdService unwritable = newService();

            ThresholdConfig config = unwritable.update(Map.of(ThresholdService.NOISE_THRESHOLD, 0.75));

            assertThat(config.getNoiseThreshold()).isEqualTo(0.75);
            assertThat(unwritable.get().getNoiseThreshold()).isEqualTo(0.75);
            assertThat(registry.get("argus.threshold.save_errors").counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Optimization")
    class Optimization {

        @Test
        @DisplayName("should raise the noise threshold when false positives are high")
        void highFalsePositives() {
            ThresholdConfig config = service.optimize(performance(0.2, 0.93));

            assertThat(config.getNoiseThreshold()).isCloseTo(0.75, within(1e-9));
            assertThat(config.getConfidenceMin()).isEqualTo(0.85);
        }

        @Test
        @DisplayName("should lower the noise threshold when false positives are rare")
        void lowFalsePositives() {
            ThresholdConfig config = service.optimize(performance(0.01, 0.93));

            assertThat(config.getNoiseThreshold()).isCloseTo(0.68, within(1e-9));
        }

        @Test
        @DisplayName("should move the confidence floor with accuracy")
        void confidence() {
            assertThat(service.optimize(performance(0.07, 0.8)).getConfidenceMin()).isCloseTo(0.87, within(1e-9));
            assertThat(service.optimize(performance(0.07, 0.99)).getConfidenceMin()).isCloseTo(0.86, within(1e-9));
        }

        @Test
        @DisplayName("should stay within bounds under repeated pressure")
        void bounded() {
            for (int i = 0; i < 50; i++) {
                service.optimize(performance(0.0, 1.0));
            }

            assertThat(service.get().getNoiseThreshold()).isEqualTo(ThresholdConfig.NOISE_MIN);
            assertThat(service.get().getConfidenceMin()).isEqualTo(ThresholdConfig.CONFIDENCE_MIN);
        }

        @Test
        @DisplayName("should not count an adjustment when nothing changes")
        void noChange() {
            double before = registry.get("argus.threshold.adjustments").counter().count();

            service.optimize(performance(0.07, 0.93));

            assertThat(registry.get("argus.threshold.adjustments").counter().count()).isEqualTo(before);
        }
    }
}
