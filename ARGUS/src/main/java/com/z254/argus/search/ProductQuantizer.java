package com.z254.argus.search;

import com.z254.argus.encoder.VectorMath;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;

/**
 * Splits vectors into {@code m} sub-vectors and replaces each with the index
 * of its nearest sub-centroid, one byte per sub-vector.
 */
class ProductQuantizer {

    static final int MAX_BITS = 8;
    private static final int TRAIN_ITERATIONS = 12;

    private final int dimension;
    private final int m;
    private final int dsub;
    private final int requestedCentroids;
    private final long seed;

    /** [sub-vector][centroid] -> centroid of length dsub */
    private float[][][] centroids;
    /** [sub-vector][a * ksub + b] -> squared distance between centroids a and b */
    private float[][] symmetric;
    private int ksub;

    ProductQuantizer(int dimension, int m, int bits, long seed) {
        if (m <= 0 || dimension % m != 0) {
            throw new IllegalArgumentException(
                    "Sub-vector count " + m + " must divide dimension " + dimension);
        }
        this.dimension = dimension;
        this.m = m;
        this.dsub = dimension / m;
        this.requestedCentroids = 1 << Math.max(1, Math.min(MAX_BITS, bits));
        this.seed = seed;
    }

    int subVectors() {
        return m;
    }

    boolean isTrained() {
        return centroids != null;
    }

    void train(float[][] vectors) {
        ksub = Math.min(requestedCentroids, vectors.length);
        centroids = new float[m][][];
        for (int s = 0; s < m; s++) {
            float[][] slice = new float[vectors.length][];
            for (int i = 0; i < vectors.length; i++) {
                slice[i] = Arrays.copyOfRange(vectors[i], s * dsub, (s + 1) * dsub);
            }
            float[][] trained = KMeans.train(slice, ksub, TRAIN_ITERATIONS, seed + s);
            centroids[s] = pad(trained, ksub);
        }
        buildSymmetricTables();
    }

    byte[] encode(float[] vector) {
        byte[] codes = new byte[m];
        for (int s = 0; s < m; s++) {
            float[] sub = Arrays.copyOfRange(vector, s * dsub, (s + 1) * dsub);
            codes[s] = (byte) KMeans.nearest(centroids[s], sub);
        }
        return codes;
    }

    float[] decode(byte[] codes, int offset) {
        float[] out = new float[dimension];
        for (int s = 0; s < m; s++) {
            float[] centroid = centroids[s][codes[offset + s] & 0xff];
            System.arraycopy(centroid, 0, out, s * dsub, dsub);
        }
        return out;
    }

    /**
     * Per-query table of squared distances from each query sub-vector to every sub-centroid.
     */
    float[] distanceTable(float[] query) {
        float[] table = new float[m * ksub];
        for (int s = 0; s < m; s++) {
            for (int c = 0; c < ksub; c++) {
                table[s * ksub + c] = VectorMath.squaredL2(query, s * dsub, centroids[s][c]);
            }
        }
        return table;
    }

    float asymmetricDistance(float[] table, byte[] codes, int offset) {
        float sum = 0f;
        for (int s = 0; s < m; s++) {
            sum += table[s * ksub + (codes[offset + s] & 0xff)];
        }
        return sum;
    }

    float symmetricDistance(byte[] codes, int offsetA, int offsetB) {
        float sum = 0f;
        for (int s = 0; s < m; s++) {
            sum += symmetric[s][(codes[offsetA + s] & 0xff) * ksub + (codes[offsetB + s] & 0xff)];
        }
        return sum;
    }

    long memoryBytes() {
        return centroids == null ? 0 : (long) m * ksub * dsub * Float.BYTES + (long) m * ksub * ksub * Float.BYTES;
    }

    void write(DataOutputStream out) throws IOException {
        out.writeInt(m);
        out.writeInt(ksub);
        for (int s = 0; s < m; s++) {
            for (int c = 0; c < ksub; c++) {
                for (float v : centroids[s][c]) {
                    out.writeFloat(v);
                }
            }
        }
    }

    void read(DataInputStream in) throws IOException {
        int storedM = in.readInt();
        if (storedM != m) {
            throw new IOException("Product quantizer sub-vector mismatch: expected " + m + " but found " + storedM);
        }
        ksub = in.readInt();
        centroids = new float[m][ksub][dsub];
        for (int s = 0; s < m; s++) {
            for (int c = 0; c < ksub; c++) {
                for (int d = 0; d < dsub; d++) {
                    centroids[s][c][d] = in.readFloat();
                }
            }
        }
        buildSymmetricTables();
    }

    private void buildSymmetricTables() {
        symmetric = new float[m][ksub * ksub];
        for (int s = 0; s < m; s++) {
            for (int a = 0; a < ksub; a++) {
                for (int b = a; b < ksub; b++) {
                    float d = VectorMath.squaredL2(centroids[s][a], centroids[s][b]);
                    symmetric[s][a * ksub + b] = d;
                    symmetric[s][b * ksub + a] = d;
                }
            }
        }
    }

    private static float[][] pad(float[][] trained, int k) {
        if (trained.length == k) {
            return trained;
        }
        float[][] out = Arrays.copyOf(trained, k);
        for (int i = trained.length; i < k; i++) {
            out[i] = trained[i % trained.length].clone();
        }
        return out;
    }
}
