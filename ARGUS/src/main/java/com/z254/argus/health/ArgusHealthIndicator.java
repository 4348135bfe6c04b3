package com.z254.argus.health;

import com.z254.argus.domain.model.ThresholdConfig;
import com.z254.argus.encoder.TextEncoder;
import com.z254.argus.grouping.AlertGroupingService;
import com.z254.argus.ranker.NoiseRanker;
import com.z254.argus.search.IndexStats;
import com.z254.argus.search.VectorSearchEngine;
import com.z254.argus.snooze.SnoozeStore;
import com.z254.argus.threshold.ThresholdService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for the ARGUS service.
 * <p>
 * The service is DOWN when the encoder cannot embed or the snooze store is
 * unreachable. A missing ranker model only degrades triage (nothing is
 * suppressed) and is reported as a detail.
 */
@Slf4j
@Component
public class ArgusHealthIndicator implements ReactiveHealthIndicator {

    private final TextEncoder encoder;
    private final NoiseRanker noiseRanker;
    private final VectorSearchEngine searchEngine;
    private final AlertGroupingService groupingService;
    private final ThresholdService thresholdService;
    private final SnoozeStore snoozeStore;

    public ArgusHealthIndicator(TextEncoder encoder,
                                NoiseRanker noiseRanker,
                                VectorSearchEngine searchEngine,
                                AlertGroupingService groupingService,
                                ThresholdService thresholdService,
                                SnoozeStore snoozeStore) {
        this.encoder = encoder;
        this.noiseRanker = noiseRanker;
        this.searchEngine = searchEngine;
        this.groupingService = groupingService;
        this.thresholdService = thresholdService;
        this.snoozeStore = snoozeStore;
    }

    @Override
    public Mono<Health> health() {
        return checkSnoozeStore()
                .map(storeUp -> {
                    boolean encoderReady = encoder.isReady();
                    Health.Builder builder = storeUp && encoderReady ? Health.up() : Health.down();

                    TextEncoder.ModelInfo modelInfo = encoder.modelInfo();
                    builder.withDetail("encoder.ready", encoderReady);
                    builder.withDetail("encoder.model", modelInfo.model());
                    builder.withDetail("encoder.dimension", modelInfo.dimension());

                    builder.withDetail("ranker.modelLoaded", noiseRanker.isModelLoaded());
                    builder.withDetail("ranker.effectiveThreshold", noiseRanker.effectiveThreshold());

                    IndexStats stats = searchEngine.stats();
                    builder.withDetail("index.type", stats.getIndexType());
                    builder.withDetail("index.liveVectors", stats.getLiveVectors());
                    builder.withDetail("index.tombstonedVectors", stats.getTombstonedVectors());
                    builder.withDetail("index.p99QueryMs", stats.getP99QueryMs());

                    builder.withDetail("grouping.openGroups", groupingService.openGroupCount());

                    ThresholdConfig thresholds = thresholdService.get();
                    builder.withDetail("thresholds.noise", thresholds.getNoiseThreshold());
                    builder.withDetail("thresholds.confidenceMin", thresholds.getConfidenceMin());

                    builder.withDetail("snoozeStore", storeUp ? "UP" : "DOWN");
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<Boolean> checkSnoozeStore() {
        return snoozeStore.isAvailable()
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false);
    }
}
