package com.z254.argus.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.argus.config.ArgusProperties;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.observability.ArgusStructuredLogger;
import com.z254.argus.testing.fixtures.TestDataFactories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class IndexMaintenanceJobTest {

    private static final int DIMENSION = 16;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private ArgusProperties properties;
    private SimpleMeterRegistry registry;
    private float[][] vectors;

    @BeforeEach
    void setUp() {
        properties = new ArgusProperties();
        properties.getSearch().setSnapshotPath(tempDir.resolve("index/alerts").toString());
        properties.getSearch().setCompactionRatio(0.2);
        registry = new SimpleMeterRegistry();
        vectors = TestDataFactories.gaussianVectors(50, DIMENSION, 1L);
    }

    private VectorSearchEngine engine() {
        return new VectorSearchEngine(IndexType.FLAT, DIMENSION, IndexParameters.builder().build(), objectMapper);
    }

    private IndexMaintenanceJob job(VectorSearchEngine engine) {
        return new IndexMaintenanceJob(engine, properties, new ArgusMetrics(registry), new ArgusStructuredLogger());
    }

    @Test
    @DisplayName("should start empty when no snapshot exists")
    void restoreWithoutSnapshot() {
        VectorSearchEngine engine = engine();

        job(engine).restore();

        assertThat(engine.stats().getTotalVectors()).isZero();
        assertThat(registry.get("argus.search.persistence.errors").counter().count()).isZero();
    }

    @Test
    @DisplayName("should compact past the tombstone ratio and restore the snapshot")
    void maintainThenRestore() {
        VectorSearchEngine engine = engine();
        engine.add(Arrays.asList(vectors), TestDataFactories.ids("a", 50), null);
        engine.remove(TestDataFactories.ids("a", 20));

        job(engine).maintain();

        assertThat(engine.stats().getTotalVectors()).isEqualTo(30);
        VectorSearchEngine restored = engine();
        job(restored).restore();
        assertThat(restored.stats().getLiveVectors()).isEqualTo(30);
        assertThat(restored.contains("a-49")).isTrue();
        assertThat(restored.contains("a-0")).isFalse();
    }

    @Test
    @DisplayName("should leave tombstones below the ratio in place")
    void belowRatio() {
        VectorSearchEngine engine = engine();
        engine.add(Arrays.asList(vectors), TestDataFactories.ids("a", 50), null);
        engine.remove(TestDataFactories.ids("a", 5));

        job(engine).maintain();

        assertThat(engine.stats().getTombstonedVectors()).isEqualTo(5);
        assertThat(VectorSearchEngine.snapshotExists(Path.of(properties.getSearch().getSnapshotPath()))).isTrue();
    }

    @Test
    @DisplayName("should count a corrupt snapshot and start empty")
    void corruptSnapshot() throws IOException {
        VectorSearchEngine engine = engine();
        engine.add(Arrays.asList(vectors), TestDataFactories.ids("a", 50), null);
        job(engine).snapshot();
        Path base = Path.of(properties.getSearch().getSnapshotPath());
        Files.writeString(Path.of(base + VectorSearchEngine.META_SUFFIX), "{not json");

        VectorSearchEngine restored = engine();
        job(restored).restore();

        assertThat(restored.stats().getTotalVectors()).isZero();
        assertThat(registry.get("argus.search.persistence.errors").counter().count()).isEqualTo(1.0);
    }
}
