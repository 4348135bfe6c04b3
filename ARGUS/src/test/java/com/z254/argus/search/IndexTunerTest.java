package com.z254.argus.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.argus.config.ArgusProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IndexTunerTest {

    private static final int DIMENSION = 32;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private ArgusProperties properties;
    private float[][] base;
    private float[][] queries;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        properties = new ArgusProperties();
        ArgusProperties.Search.Tuner tuner = properties.getSearch().getTuner();
        tuner.setRecallK(5);
        tuner.setHnswM(List.of(8));
        tuner.setHnswEfConstruction(List.of(50));
        tuner.setHnswEfSearch(List.of(16, 64));
        tuner.setPqSubVectors(List.of(5, 8));
        tuner.setPqBits(List.of(4));
        tuner.setOpqHnswM(List.of(8));

        float[][] data = IndexBenchmark.clusteredDataset(400, DIMENSION, 10, 3L);
        base = Arrays.copyOfRange(data, 0, 360);
        queries = Arrays.copyOfRange(data, 360, 400);
    }

    @Test
    @DisplayName("should stop at the first configuration meeting both targets")
    void earlyStop() {
        properties.getSearch().getTuner().setTargetP99Ms(10_000.0);
        properties.getSearch().getTuner().setMinRecall(0.0);

        TuningReport report = new IndexTuner(properties, objectMapper).tune(base, queries);

        assertThat(report.isEarlyStopped()).isTrue();
        assertThat(report.getResults()).hasSize(1);
        assertThat(report.best()).hasValueSatisfying(best -> {
            assertThat(best.getIndexType()).isEqualTo(IndexType.HNSW);
            assertThat(best.getParameters().getEfSearch()).isEqualTo(16);
            assertThat(best.isMeetsTargets()).isTrue();
        });
    }

    @Test
    @DisplayName("should return every configuration ordered by latency when targets are unreachable")
    void unreachableTargets() {
        properties.getSearch().getTuner().setMinRecall(1.01);

        TuningReport report = new IndexTuner(properties, objectMapper).tune(base, queries);

        assertThat(report.isEarlyStopped()).isFalse();
        // two HNSW search widths plus one OPQ configuration; 5 sub-vectors do not divide 32
        assertThat(report.getResults()).hasSize(3);
        assertThat(report.getResults()).extracting(TuningResult::getP99Ms).isSorted();
        assertThat(report.getResults()).extracting(TuningResult::getIndexType)
                .containsOnly(IndexType.HNSW, IndexType.OPQ_HNSW);
        assertThat(report.best()).isEmpty();
        double topRecall = report.getResults().stream().mapToDouble(TuningResult::getRecall).max().orElseThrow();
        assertThat(report.recommended()).hasValueSatisfying(r -> assertThat(r.getRecall()).isEqualTo(topRecall));
    }

    @Test
    @DisplayName("should write the report as JSON")
    void saveReport() throws Exception {
        properties.getSearch().getTuner().setMinRecall(1.01);
        IndexTuner tuner = new IndexTuner(properties, objectMapper);
        TuningReport report = tuner.tune(base, queries);
        Path path = tempDir.resolve("reports/tuning.json");

        tuner.save(report, path);

        JsonNode json = objectMapper.readTree(path.toFile());
        assertThat(json.get("earlyStopped").asBoolean()).isFalse();
        assertThat(json.get("results")).hasSize(3);
        assertThat(json.get("results").get(0).get("parameters").has("efSearch")).isTrue();
    }
}
