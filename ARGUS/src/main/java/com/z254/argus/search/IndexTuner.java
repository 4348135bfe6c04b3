package com.z254.argus.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.argus.config.ArgusProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Grid search over HNSW and OPQ+HNSW hyperparameters against a held-out
 * query set with exact ground truth.
 * <p>
 * Stops at the first configuration whose P99 latency is within the target
 * and whose recall@k reaches the minimum; otherwise returns every result
 * ordered by P99 latency.
 */
@Slf4j
@Service
public class IndexTuner {

    private static final int OPQ_EF_CONSTRUCTION = 200;
    private static final int OPQ_EF_SEARCH = 128;

    private final ArgusProperties.Search.Tuner config;
    private final ObjectMapper objectMapper;

    public IndexTuner(ArgusProperties argusProperties, ObjectMapper objectMapper) {
        this.config = argusProperties.getSearch().getTuner();
        this.objectMapper = objectMapper;
    }

    public TuningReport tune(float[][] base, float[][] queries) {
        int k = config.getRecallK();
        int dimension = base[0].length;
        int[][] truth = IndexBenchmark.groundTruth(base, queries, k);
        List<TuningResult> results = new ArrayList<>();

        for (int m : config.getHnswM()) {
            for (int efConstruction : config.getHnswEfConstruction()) {
                IndexParameters built = IndexParameters.builder().m(m).efConstruction(efConstruction).build();
                long start = System.nanoTime();
                HnswIndex index = (HnswIndex) IndexType.HNSW.create(dimension, built);
                index.add(base);
                double buildMs = (System.nanoTime() - start) / 1_000_000.0;

                for (int efSearch : config.getHnswEfSearch()) {
                    index.setEfSearch(efSearch);
                    TuningResult result = evaluate(IndexType.HNSW, built.toBuilder().efSearch(efSearch).build(),
                            index, queries, truth, k, buildMs);
                    results.add(result);
                    if (result.isMeetsTargets()) {
                        return finish(results, true);
                    }
                }
            }
        }

        for (int subVectors : config.getPqSubVectors()) {
            if (dimension % subVectors != 0) {
                log.debug("Skipping {} sub-vectors: does not divide dimension {}", subVectors, dimension);
                continue;
            }
            for (int bits : config.getPqBits()) {
                for (int m : config.getOpqHnswM()) {
                    IndexParameters parameters = IndexParameters.builder()
                            .m(m)
                            .efConstruction(OPQ_EF_CONSTRUCTION)
                            .efSearch(OPQ_EF_SEARCH)
                            .pqSubVectors(subVectors)
                            .pqBits(bits)
                            .build();
                    long start = System.nanoTime();
                    VectorIndex index = IndexType.OPQ_HNSW.create(dimension, parameters);
                    index.train(base);
                    index.add(base);
                    double buildMs = (System.nanoTime() - start) / 1_000_000.0;

                    TuningResult result = evaluate(IndexType.OPQ_HNSW, parameters, index, queries, truth, k, buildMs);
                    results.add(result);
                    if (result.isMeetsTargets()) {
                        return finish(results, true);
                    }
                }
            }
        }
        return finish(results, false);
    }

    /**
     * Write the report as JSON for later manual selection.
     */
    public void save(TuningReport report, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
        } catch (IOException e) {
            throw new IndexPersistenceException("Failed to write tuning report to " + path, e);
        }
    }

    private TuningResult evaluate(IndexType type, IndexParameters parameters, VectorIndex index,
                                  float[][] queries, int[][] truth, int k, double buildMs) {
        IndexBenchmark.Measurement measurement = IndexBenchmark.measure(index, queries, truth, k);
        boolean meets = measurement.getP99Ms() <= config.getTargetP99Ms()
                && measurement.getRecall() >= config.getMinRecall();
        log.info("Tuning {}: params={}, recall@{}={}, p99={}ms, meets={}",
                type, parameters, k, String.format("%.4f", measurement.getRecall()),
                String.format("%.3f", measurement.getP99Ms()), meets);
        return TuningResult.builder()
                .indexType(type)
                .parameters(parameters)
                .recall(measurement.getRecall())
                .p99Ms(measurement.getP99Ms())
                .meanMs(measurement.getMeanMs())
                .buildMs(buildMs)
                .memoryBytes(measurement.getMemoryBytes())
                .meetsTargets(meets)
                .build();
    }

    private TuningReport finish(List<TuningResult> results, boolean earlyStopped) {
        List<TuningResult> ordered = new ArrayList<>(results);
        if (!earlyStopped) {
            ordered.sort(Comparator.comparingDouble(TuningResult::getP99Ms));
        }
        return TuningReport.builder()
                .targetP99Ms(config.getTargetP99Ms())
                .minRecall(config.getMinRecall())
                .earlyStopped(earlyStopped)
                .results(ordered)
                .build();
    }
}
