package com.z254.argus.encoder;

import com.z254.argus.config.ArgusProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Encoder backed by the external embedding runtime.
 * <p>
 * {@link #initialize()} queries the runtime once to learn the embedding
 * dimension. Calls block on the runtime and must run off the event loop.
 */
@Slf4j
public class RemoteTextEncoder implements TextEncoder {

    private final EmbeddingRuntimeClient client;
    private final ArgusProperties.Encoder config;
    private final Duration blockTimeout;
    private volatile int dimension = -1;

    public RemoteTextEncoder(EmbeddingRuntimeClient client, ArgusProperties.Encoder config) {
        this.client = client;
        this.config = config;
        this.blockTimeout = config.getRemote().getTimeout().multipliedBy(3);
    }

    @Override
    public synchronized TextEncoder initialize() {
        if (dimension < 0) {
            float[] sample = request(List.of("dimension check")).get(0);
            dimension = sample.length;
            log.info("Remote text encoder ready: model={}, dimension={}",
                    config.getRemote().getModel(), dimension);
        }
        return this;
    }

    @Override
    public void warmup() {
        initialize();
        embed("warmup alert text");
    }

    @Override
    public boolean isReady() {
        return dimension > 0;
    }

    @Override
    public int dimension() {
        if (dimension < 0) {
            initialize();
        }
        return dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (!isReady()) {
            initialize();
        }
        List<String> cleaned = new ArrayList<>(texts.size());
        for (String text : texts) {
            cleaned.add(AlertText.clean(text, config.getMaxInputChars()));
        }
        List<float[]> vectors = request(cleaned);
        List<float[]> normalized = new ArrayList<>(vectors.size());
        for (float[] vector : vectors) {
            normalized.add(VectorMath.normalize(vector));
        }
        return normalized;
    }

    @Override
    public ModelInfo modelInfo() {
        return new ModelInfo("remote", config.getRemote().getModel(),
                Math.max(dimension, 0), config.getMaxInputChars(), isReady());
    }

    private List<float[]> request(List<String> texts) {
        List<float[]> vectors = client.embed(texts).block(blockTimeout);
        if (vectors == null || vectors.size() != texts.size()) {
            throw new EmbeddingRuntimeClient.EmbeddingUnavailableException(
                    "Embedding runtime returned " + (vectors == null ? 0 : vectors.size())
                            + " vectors for " + texts.size() + " inputs", null);
        }
        return vectors;
    }
}
