package com.z254.argus.ranker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Binary CART classification tree grown with Gini impurity.
 * <p>
 * Nodes are stored in flat arrays. A node with {@code feature == -1} is a leaf
 * and {@code value} holds the fraction of noise samples that reached it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DecisionTree {

    static final int LEAF = -1;

    private int[] feature;
    private double[] threshold;
    private int[] left;
    private int[] right;
    private double[] value;

    /**
     * Probability that the row belongs to the positive (noise) class.
     */
    public double predict(double[] row) {
        int node = 0;
        while (feature[node] != LEAF) {
            node = row[feature[node]] <= threshold[node] ? left[node] : right[node];
        }
        return value[node];
    }

    public int nodeCount() {
        return feature.length;
    }

    /**
     * Grow a tree over the given sample indices (duplicates allowed for bootstrap samples).
     */
    static DecisionTree grow(double[][] x, boolean[] y, int[] samples, Settings settings, Random random) {
        Grower grower = new Grower(x, y, settings, random);
        grower.build(samples, 0);
        return grower.toTree();
    }

    /**
     * Stopping criteria and feature subsampling for one tree.
     */
    record Settings(int maxDepth, int minSamplesSplit, int minSamplesLeaf, int maxFeatures) {
    }

    private static final class Grower {

        private final double[][] x;
        private final boolean[] y;
        private final Settings settings;
        private final Random random;
        private final int columns;

        private final List<Integer> features = new ArrayList<>();
        private final List<Double> thresholds = new ArrayList<>();
        private final List<Integer> lefts = new ArrayList<>();
        private final List<Integer> rights = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();

        Grower(double[][] x, boolean[] y, Settings settings, Random random) {
            this.x = x;
            this.y = y;
            this.settings = settings;
            this.random = random;
            this.columns = x[0].length;
        }

        int build(int[] samples, int depth) {
            int node = features.size();
            int positives = 0;
            for (int s : samples) {
                if (y[s]) {
                    positives++;
                }
            }
            features.add(LEAF);
            thresholds.add(0.0);
            lefts.add(LEAF);
            rights.add(LEAF);
            values.add(samples.length == 0 ? 0.0 : (double) positives / samples.length);

            if (depth >= settings.maxDepth()
                    || samples.length < settings.minSamplesSplit()
                    || positives == 0 || positives == samples.length) {
                return node;
            }

            Split split = findSplit(samples, positives);
            if (split == null) {
                return node;
            }

            int leftCount = 0;
            for (int s : samples) {
                if (x[s][split.feature] <= split.threshold) {
                    leftCount++;
                }
            }
            int[] leftSamples = new int[leftCount];
            int[] rightSamples = new int[samples.length - leftCount];
            int li = 0;
            int ri = 0;
            for (int s : samples) {
                if (x[s][split.feature] <= split.threshold) {
                    leftSamples[li++] = s;
                } else {
                    rightSamples[ri++] = s;
                }
            }

            features.set(node, split.feature);
            thresholds.set(node, split.threshold);
            int leftNode = build(leftSamples, depth + 1);
            lefts.set(node, leftNode);
            int rightNode = build(rightSamples, depth + 1);
            rights.set(node, rightNode);
            return node;
        }

        /**
         * Best split over a random subset of features. When every sampled feature is
         * constant on this node the remaining features are tried in random order.
         */
        private Split findSplit(int[] samples, int positives) {
            int[] order = new int[columns];
            for (int i = 0; i < columns; i++) {
                order[i] = i;
            }
            for (int i = columns - 1; i > 0; i--) {
                int j = random.nextInt(i + 1);
                int tmp = order[i];
                order[i] = order[j];
                order[j] = tmp;
            }

            double[] keys = new double[samples.length];
            int[] sorted = new int[samples.length];
            Split best = null;
            for (int visited = 0; visited < columns; visited++) {
                if (visited >= settings.maxFeatures() && best != null) {
                    break;
                }
                int f = order[visited];
                for (int i = 0; i < samples.length; i++) {
                    sorted[i] = samples[i];
                    keys[i] = x[samples[i]][f];
                }
                sort(keys, sorted, 0, samples.length - 1);
                Split candidate = sweep(f, keys, sorted, positives);
                if (candidate != null && (best == null || candidate.impurity < best.impurity)) {
                    best = candidate;
                }
            }
            return best;
        }

        private Split sweep(int f, double[] keys, int[] sorted, int positives) {
            int n = sorted.length;
            int minLeaf = settings.minSamplesLeaf();
            int leftPositives = 0;
            Split best = null;
            for (int i = 0; i < n - 1; i++) {
                if (y[sorted[i]]) {
                    leftPositives++;
                }
                int leftN = i + 1;
                int rightN = n - leftN;
                if (keys[i] == keys[i + 1] || leftN < minLeaf || rightN < minLeaf) {
                    continue;
                }
                double impurity = leftN * gini(leftPositives, leftN)
                        + rightN * gini(positives - leftPositives, rightN);
                if (best == null || impurity < best.impurity) {
                    best = new Split(f, (keys[i] + keys[i + 1]) / 2.0, impurity);
                }
            }
            return best;
        }

        DecisionTree toTree() {
            int size = features.size();
            int[] f = new int[size];
            double[] t = new double[size];
            int[] l = new int[size];
            int[] r = new int[size];
            double[] v = new double[size];
            for (int i = 0; i < size; i++) {
                f[i] = features.get(i);
                t[i] = thresholds.get(i);
                l[i] = lefts.get(i);
                r[i] = rights.get(i);
                v[i] = values.get(i);
            }
            return new DecisionTree(f, t, l, r, v);
        }
    }

    private record Split(int feature, double threshold, double impurity) {
    }

    static double gini(int positives, int total) {
        double p = (double) positives / total;
        return 2.0 * p * (1.0 - p);
    }

    /**
     * In-place quicksort of {@code keys} carrying {@code values} along.
     */
    static void sort(double[] keys, int[] values, int lo, int hi) {
        while (hi - lo > 16) {
            double pivot = keys[(lo + hi) >>> 1];
            int i = lo;
            int j = hi;
            while (i <= j) {
                while (keys[i] < pivot) {
                    i++;
                }
                while (keys[j] > pivot) {
                    j--;
                }
                if (i <= j) {
                    swap(keys, values, i++, j--);
                }
            }
            if (j - lo < hi - i) {
                sort(keys, values, lo, j);
                lo = i;
            } else {
                sort(keys, values, i, hi);
                hi = j;
            }
        }
        for (int i = lo + 1; i <= hi; i++) {
            for (int j = i; j > lo && keys[j - 1] > keys[j]; j--) {
                swap(keys, values, j, j - 1);
            }
        }
    }

    private static void swap(double[] keys, int[] values, int a, int b) {
        double k = keys[a];
        keys[a] = keys[b];
        keys[b] = k;
        int v = values[a];
        values[a] = values[b];
        values[b] = v;
    }
}
