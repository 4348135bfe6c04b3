package com.z254.argus.encoder;

/**
 * Vector helpers shared by the encoder, the search engine and the ranker.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static float dot(float[] a, float[] b) {
        requireSameLength(a, b);
        float sum = 0f;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static float norm(float[] v) {
        float sum = 0f;
        for (float x : v) {
            sum += x * x;
        }
        return (float) Math.sqrt(sum);
    }

    /**
     * L2-normalized copy of {@code v}; a zero vector is returned unchanged.
     */
    public static float[] normalize(float[] v) {
        float[] out = v.clone();
        float n = norm(v);
        if (n > 0f) {
            for (int i = 0; i < out.length; i++) {
                out[i] /= n;
            }
        }
        return out;
    }

    /**
     * Cosine similarity clipped to [0, 1]. Zero vectors have similarity 0.
     */
    public static float cosineSimilarity(float[] a, float[] b) {
        requireSameLength(a, b);
        float na = norm(a);
        float nb = norm(b);
        if (na == 0f || nb == 0f) {
            return 0f;
        }
        float cos = dot(a, b) / (na * nb);
        return Math.max(0f, Math.min(1f, cos));
    }

    public static float[] batchSimilarity(float[] query, float[][] candidates) {
        float[] out = new float[candidates.length];
        for (int i = 0; i < candidates.length; i++) {
            out[i] = cosineSimilarity(query, candidates[i]);
        }
        return out;
    }

    public static float squaredL2(float[] a, float[] b) {
        float sum = 0f;
        for (int i = 0; i < a.length; i++) {
            float d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    /**
     * Squared L2 over a slice of {@code a} starting at {@code offset} against all of {@code b}.
     */
    public static float squaredL2(float[] a, int offset, float[] b) {
        float sum = 0f;
        for (int i = 0; i < b.length; i++) {
            float d = a[offset + i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    private static void requireSameLength(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vector length mismatch: " + a.length + " vs " + b.length);
        }
    }
}
