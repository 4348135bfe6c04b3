package com.z254.argus.health;

import com.z254.argus.domain.model.ThresholdConfig;
import com.z254.argus.encoder.TextEncoder;
import com.z254.argus.grouping.AlertGroupingService;
import com.z254.argus.ranker.NoiseRanker;
import com.z254.argus.search.IndexStats;
import com.z254.argus.search.IndexType;
import com.z254.argus.search.VectorSearchEngine;
import com.z254.argus.snooze.SnoozeStore;
import com.z254.argus.threshold.ThresholdService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArgusHealthIndicatorTest {

    @Mock
    private TextEncoder encoder;

    @Mock
    private NoiseRanker noiseRanker;

    @Mock
    private VectorSearchEngine searchEngine;

    @Mock
    private AlertGroupingService groupingService;

    @Mock
    private ThresholdService thresholdService;

    @Mock
    private SnoozeStore snoozeStore;

    private ArgusHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new ArgusHealthIndicator(encoder, noiseRanker, searchEngine, groupingService,
                thresholdService, snoozeStore);
        lenient().when(encoder.isReady()).thenReturn(true);
        lenient().when(encoder.modelInfo())
                .thenReturn(new TextEncoder.ModelInfo("hashing", "hashing-v1", 384, 512, true));
        lenient().when(noiseRanker.isModelLoaded()).thenReturn(false);
        lenient().when(noiseRanker.effectiveThreshold()).thenReturn(0.95);
        lenient().when(searchEngine.stats()).thenReturn(IndexStats.builder()
                .indexType(IndexType.HNSW)
                .dimension(384)
                .totalVectors(10)
                .liveVectors(9)
                .tombstonedVectors(1)
                .build());
        lenient().when(groupingService.openGroupCount()).thenReturn(3);
        lenient().when(thresholdService.get()).thenReturn(ThresholdConfig.defaults());
    }

    @Test
    void upWithoutRankerModel() {
        when(snoozeStore.isAvailable()).thenReturn(Mono.just(true));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("ranker.modelLoaded", false)
                            .containsEntry("encoder.dimension", 384)
                            .containsEntry("index.liveVectors", 9)
                            .containsEntry("grouping.openGroups", 3)
                            .containsEntry("snoozeStore", "UP");
                })
                .verifyComplete();
    }

    @Test
    void downWhenEncoderNotReady() {
        when(snoozeStore.isAvailable()).thenReturn(Mono.just(true));
        when(encoder.isReady()).thenReturn(false);

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }

    @Test
    void downWhenSnoozeStoreErrors() {
        when(snoozeStore.isAvailable()).thenReturn(Mono.error(new IllegalStateException("connection refused")));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("snoozeStore", "DOWN");
                })
                .verifyComplete();
    }

    @Test
    void downWithErrorDetailWhenAComponentThrows() {
        when(snoozeStore.isAvailable()).thenReturn(Mono.just(true));
        when(searchEngine.stats()).thenThrow(new IllegalStateException("index closed"));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("error", "index closed");
                })
                .verifyComplete();
    }
}
