package com.z254.argus.search;

import com.z254.argus.encoder.VectorMath;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Recall and latency measurement for index configurations.
 */
public final class IndexBenchmark {

    private IndexBenchmark() {
    }

    /**
     * Seeded, L2-normalized vectors drawn around {@code clusters} random centres,
     * which resembles embedding distributions better than uniform noise.
     */
    public static float[][] clusteredDataset(int count, int dimension, int clusters, long seed) {
        Random random = new Random(seed);
        float[][] centres = new float[Math.max(1, clusters)][dimension];
        for (float[] centre : centres) {
            for (int d = 0; d < dimension; d++) {
                centre[d] = (float) random.nextGaussian();
            }
        }
        float[][] out = new float[count][];
        for (int i = 0; i < count; i++) {
            float[] centre = centres[random.nextInt(centres.length)];
            float[] v = new float[dimension];
            for (int d = 0; d < dimension; d++) {
                v[d] = centre[d] + (float) (random.nextGaussian() * 0.35);
            }
            out[i] = VectorMath.normalize(v);
        }
        return out;
    }

    /**
     * Exact top-{@code k} positions for each query.
     */
    public static int[][] groundTruth(float[][] base, float[][] queries, int k) {
        FlatIndex exact = new FlatIndex(base[0].length);
        exact.add(base);
        int[][] truth = new int[queries.length][];
        for (int q = 0; q < queries.length; q++) {
            truth[q] = exact.search(queries[q], k).stream().mapToInt(Neighbor::position).toArray();
        }
        return truth;
    }

    /**
     * Mean share of the true top-{@code k} found in the approximate top-{@code k}.
     */
    public static double recallAtK(List<List<Neighbor>> results, int[][] truth, int k) {
        double total = 0;
        for (int q = 0; q < truth.length; q++) {
            Set<Integer> expected = new HashSet<>();
            for (int i = 0; i < Math.min(k, truth[q].length); i++) {
                expected.add(truth[q][i]);
            }
            if (expected.isEmpty()) {
                total += 1.0;
                continue;
            }
            int found = 0;
            List<Neighbor> approx = results.get(q);
            for (int i = 0; i < Math.min(k, approx.size()); i++) {
                if (expected.contains(approx.get(i).position())) {
                    found++;
                }
            }
            total += (double) found / expected.size();
        }
        return truth.length == 0 ? 1.0 : total / truth.length;
    }

    /**
     * Run every query once against {@code index}, after a short warmup.
     */
    public static Measurement measure(VectorIndex index, float[][] queries, int[][] truth, int k) {
        int warmup = Math.min(queries.length, 20);
        for (int i = 0; i < warmup; i++) {
            index.search(queries[i], k);
        }
        double[] latencies = new double[queries.length];
        List<List<Neighbor>> results = new ArrayList<>(queries.length);
        for (int q = 0; q < queries.length; q++) {
            long start = System.nanoTime();
            results.add(index.search(queries[q], k));
            latencies[q] = (System.nanoTime() - start) / 1_000_000.0;
        }
        Arrays.sort(latencies);
        return Measurement.builder()
                .recall(recallAtK(results, truth, k))
                .meanMs(Arrays.stream(latencies).average().orElse(0.0))
                .p50Ms(percentile(latencies, 0.50))
                .p95Ms(percentile(latencies, 0.95))
                .p99Ms(percentile(latencies, 0.99))
                .memoryBytes(index.memoryBytes())
                .build();
    }

    static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int rank = (int) Math.ceil(p * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank))];
    }

    @Value
    @Builder
    public static class Measurement {
        double recall;
        double meanMs;
        double p50Ms;
        double p95Ms;
        double p99Ms;
        long memoryBytes;
    }
}
