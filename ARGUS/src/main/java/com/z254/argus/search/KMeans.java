package com.z254.argus.search;

import com.z254.argus.encoder.VectorMath;

import java.util.Arrays;
import java.util.Random;

/**
 * Seeded Lloyd k-means used by the coarse and product quantizers.
 */
final class KMeans {

    private static final int DEFAULT_ITERATIONS = 20;

    private KMeans() {
    }

    static float[][] train(float[][] data, int k, long seed) {
        return train(data, k, DEFAULT_ITERATIONS, seed);
    }

    /**
     * Cluster {@code data} into at most {@code k} centroids. When there are fewer
     * points than {@code k}, every point becomes a centroid.
     */
    static float[][] train(float[][] data, int k, int iterations, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train k-means on an empty set");
        }
        int clusters = Math.min(k, data.length);
        int dim = data[0].length;
        Random random = new Random(seed);

        float[][] centroids = new float[clusters][];
        int[] order = shuffledIndices(data.length, random);
        for (int c = 0; c < clusters; c++) {
            centroids[c] = data[order[c]].clone();
        }

        int[] assignment = new int[data.length];
        Arrays.fill(assignment, -1);
        for (int iter = 0; iter < iterations; iter++) {
            boolean changed = false;
            for (int i = 0; i < data.length; i++) {
                int nearest = nearest(centroids, data[i]);
                if (nearest != assignment[i]) {
                    changed = true;
                    assignment[i] = nearest;
                }
            }

            float[][] sums = new float[clusters][dim];
            int[] counts = new int[clusters];
            for (int i = 0; i < data.length; i++) {
                int c = assignment[i];
                counts[c]++;
                float[] point = data[i];
                float[] sum = sums[c];
                for (int d = 0; d < dim; d++) {
                    sum[d] += point[d];
                }
            }
            for (int c = 0; c < clusters; c++) {
                if (counts[c] == 0) {
                    // re-seed empty cluster from a random point
                    centroids[c] = data[random.nextInt(data.length)].clone();
                    changed = true;
                    continue;
                }
                for (int d = 0; d < dim; d++) {
                    sums[c][d] /= counts[c];
                }
                centroids[c] = sums[c];
            }
            if (!changed) {
                break;
            }
        }
        return centroids;
    }

    static int nearest(float[][] centroids, float[] point) {
        int best = 0;
        float bestDistance = Float.MAX_VALUE;
        for (int c = 0; c < centroids.length; c++) {
            float d = VectorMath.squaredL2(point, centroids[c]);
            if (d < bestDistance) {
                bestDistance = d;
                best = c;
            }
        }
        return best;
    }

    private static int[] shuffledIndices(int n, Random random) {
        int[] idx = new int[n];
        for (int i = 0; i < n; i++) {
            idx[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
        }
        return idx;
    }
}
