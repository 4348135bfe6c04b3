package com.z254.argus.encoder;

import java.util.List;

/**
 * Turns text into fixed-length embeddings.
 * <p>
 * Implementations are deterministic for a given model version. Loading the
 * underlying model is explicit: {@link #initialize()} returns the ready
 * encoder and {@link #warmup()} pre-pays first-call latency. Calls to
 * {@code embed} on an uninitialized encoder initialize it first.
 */
public interface TextEncoder {

    /**
     * Load the underlying model if needed.
     *
     * @return this encoder, ready for use
     */
    TextEncoder initialize();

    /**
     * Run a throwaway encoding so the first real request is not slowed down.
     */
    void warmup();

    boolean isReady();

    int dimension();

    float[] embed(String text);

    List<float[]> embedBatch(List<String> texts);

    ModelInfo modelInfo();

    /**
     * Cosine similarity of two texts, clipped to [0, 1].
     */
    default float similarity(String a, String b) {
        return VectorMath.cosineSimilarity(embed(a), embed(b));
    }

    /**
     * Descriptive information about the loaded model.
     */
    record ModelInfo(String provider, String model, int dimension, int maxInputChars, boolean ready) {
    }
}
