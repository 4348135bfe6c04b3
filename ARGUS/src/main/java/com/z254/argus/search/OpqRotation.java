package com.z254.argus.search;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Random;

/**
 * Learned orthogonal rotation applied before product quantization.
 * <p>
 * Training alternates between fitting the quantizer on rotated data and
 * solving the orthogonal Procrustes problem for the rotation that best maps
 * the data onto its reconstruction. The polar factor is computed with
 * Newton-Schulz iterations so no SVD is needed.
 */
class OpqRotation {

    private static final int MAX_TRAINING_ROWS = 4096;
    private static final int POLAR_ITERATIONS = 40;
    private static final double POLAR_TOLERANCE = 1e-6;
    private static final double RIDGE = 1e-3;

    private final int dimension;
    /** Row-major d x d; rotated = R * x */
    private float[] matrix;

    OpqRotation(int dimension) {
        this.dimension = dimension;
        this.matrix = identity(dimension);
    }

    float[] apply(float[] x) {
        float[] out = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            float sum = 0f;
            int row = i * dimension;
            for (int j = 0; j < dimension; j++) {
                sum += matrix[row + j] * x[j];
            }
            out[i] = sum;
        }
        return out;
    }

    /**
     * Inverse rotation; R is orthogonal so the inverse is the transpose.
     */
    float[] invert(float[] y) {
        float[] out = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            float yi = y[i];
            int row = i * dimension;
            for (int j = 0; j < dimension; j++) {
                out[j] += matrix[row + j] * yi;
            }
        }
        return out;
    }

    /**
     * Learn the rotation jointly with {@code quantizer}; leaves the quantizer
     * trained on the final rotated data.
     */
    void train(float[][] vectors, ProductQuantizer quantizer, int iterations, long seed) {
        float[][] sample = sample(vectors, seed);
        for (int iter = 0; iter < iterations; iter++) {
            float[][] rotated = rotateAll(sample);
            quantizer.train(rotated);

            // M = sum_i x_i * y_i^T where y_i is the reconstruction in rotated space
            double[] m = new double[dimension * dimension];
            for (int i = 0; i < sample.length; i++) {
                float[] y = quantizer.decode(quantizer.encode(rotated[i]), 0);
                float[] x = sample[i];
                for (int a = 0; a < dimension; a++) {
                    double xa = x[a];
                    int row = a * dimension;
                    for (int b = 0; b < dimension; b++) {
                        m[row + b] += xa * y[b];
                    }
                }
            }
            // argmin ||R x - y|| over orthogonal R is polar(M)^T
            double[] q = polarFactor(m);
            float[] next = new float[dimension * dimension];
            for (int a = 0; a < dimension; a++) {
                for (int b = 0; b < dimension; b++) {
                    next[b * dimension + a] = (float) q[a * dimension + b];
                }
            }
            matrix = next;
        }
        quantizer.train(rotateAll(sample));
    }

    long memoryBytes() {
        return (long) dimension * dimension * Float.BYTES;
    }

    void write(DataOutputStream out) throws IOException {
        out.writeInt(dimension);
        for (float v : matrix) {
            out.writeFloat(v);
        }
    }

    void read(DataInputStream in) throws IOException {
        int stored = in.readInt();
        if (stored != dimension) {
            throw new IOException("Rotation dimension mismatch: expected " + dimension + " but found " + stored);
        }
        float[] loaded = new float[dimension * dimension];
        for (int i = 0; i < loaded.length; i++) {
            loaded[i] = in.readFloat();
        }
        matrix = loaded;
    }

    private float[][] rotateAll(float[][] vectors) {
        float[][] out = new float[vectors.length][];
        for (int i = 0; i < vectors.length; i++) {
            out[i] = apply(vectors[i]);
        }
        return out;
    }

    private float[][] sample(float[][] vectors, long seed) {
        if (vectors.length <= MAX_TRAINING_ROWS) {
            return vectors;
        }
        Random random = new Random(seed);
        float[][] out = new float[MAX_TRAINING_ROWS][];
        for (int i = 0; i < MAX_TRAINING_ROWS; i++) {
            out[i] = vectors[random.nextInt(vectors.length)];
        }
        return out;
    }

    /**
     * Orthogonal polar factor of {@code m} via Newton-Schulz:
     * Z <- Z (3I - Z^T Z) / 2 starting from a Frobenius-scaled, ridge-regularized M.
     */
    private double[] polarFactor(double[] m) {
        int d = dimension;
        double frob = 0;
        for (double v : m) {
            frob += v * v;
        }
        frob = Math.sqrt(frob);
        if (frob == 0) {
            return toDouble(identity(d));
        }
        double[] z = new double[d * d];
        for (int i = 0; i < m.length; i++) {
            z[i] = m[i] / frob;
        }
        for (int i = 0; i < d; i++) {
            z[i * d + i] += RIDGE;
        }
        double scale = Math.sqrt(frobeniusSquared(z));
        for (int i = 0; i < z.length; i++) {
            z[i] /= scale;
        }

        for (int iter = 0; iter < POLAR_ITERATIONS; iter++) {
            double[] ztz = multiplyTransposeLeft(z, z, d);
            double residual = 0;
            for (int i = 0; i < d; i++) {
                for (int j = 0; j < d; j++) {
                    double target = i == j ? 1.0 : 0.0;
                    double diff = ztz[i * d + j] - target;
                    residual += diff * diff;
                    ztz[i * d + j] = (i == j ? 3.0 : 0.0) - ztz[i * d + j];
                }
            }
            if (residual < POLAR_TOLERANCE) {
                break;
            }
            double[] next = multiply(z, ztz, d);
            for (int i = 0; i < next.length; i++) {
                next[i] *= 0.5;
            }
            z = next;
        }
        return z;
    }

    private static double frobeniusSquared(double[] a) {
        double sum = 0;
        for (double v : a) {
            sum += v * v;
        }
        return sum;
    }

    private static double[] multiply(double[] a, double[] b, int d) {
        double[] out = new double[d * d];
        for (int i = 0; i < d; i++) {
            for (int k = 0; k < d; k++) {
                double aik = a[i * d + k];
                if (aik == 0) {
                    continue;
                }
                int rowB = k * d;
                int rowOut = i * d;
                for (int j = 0; j < d; j++) {
                    out[rowOut + j] += aik * b[rowB + j];
                }
            }
        }
        return out;
    }

    /** a^T * b */
    private static double[] multiplyTransposeLeft(double[] a, double[] b, int d) {
        double[] out = new double[d * d];
        for (int k = 0; k < d; k++) {
            int row = k * d;
            for (int i = 0; i < d; i++) {
                double aki = a[row + i];
                if (aki == 0) {
                    continue;
                }
                int rowOut = i * d;
                for (int j = 0; j < d; j++) {
                    out[rowOut + j] += aki * b[row + j];
                }
            }
        }
        return out;
    }

    private static float[] identity(int d) {
        float[] id = new float[d * d];
        for (int i = 0; i < d; i++) {
            id[i * d + i] = 1f;
        }
        return id;
    }

    private static double[] toDouble(float[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i];
        }
        return out;
    }
}
