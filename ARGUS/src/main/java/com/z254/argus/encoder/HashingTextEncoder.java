package com.z254.argus.encoder;

import com.z254.argus.config.ArgusProperties;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * In-process encoder using signed feature hashing.
 * <p>
 * Tokens are word unigrams, word bigrams and character trigrams. Each token
 * is hashed into one of {@code dimension} buckets with a hash-derived sign,
 * and the result is L2-normalized. Output depends only on the input text,
 * the dimension and the model version.
 */
@Slf4j
public class HashingTextEncoder implements TextEncoder {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}_]+");
    private static final float UNIGRAM_WEIGHT = 1.0f;
    private static final float BIGRAM_WEIGHT = 0.7f;
    private static final float TRIGRAM_WEIGHT = 0.35f;

    private final int dimension;
    private final int maxInputChars;
    private final String modelVersion;
    private final int seed;
    private volatile boolean ready;

    public HashingTextEncoder(ArgusProperties.Encoder config) {
        this(config.getDimension(), config.getMaxInputChars(), config.getModelVersion());
    }

    public HashingTextEncoder(int dimension, int maxInputChars, String modelVersion) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        this.maxInputChars = maxInputChars;
        this.modelVersion = modelVersion;
        this.seed = murmurFinalize(modelVersion.hashCode());
    }

    @Override
    public TextEncoder initialize() {
        if (!ready) {
            ready = true;
            log.info("Hashing text encoder ready: dimension={}, version={}", dimension, modelVersion);
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
        return ready;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public float[] embed(String text) {
        initialize();
        String cleaned = AlertText.clean(text, maxInputChars).toLowerCase(Locale.ROOT);
        float[] vector = new float[dimension];
        if (cleaned.isEmpty()) {
            return vector;
        }

        List<String> words = new ArrayList<>();
        for (String token : TOKEN_SPLIT.split(cleaned)) {
            if (!token.isEmpty()) {
                words.add(token);
            }
        }

        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            accumulate(vector, "w:" + word, UNIGRAM_WEIGHT);
            if (i + 1 < words.size()) {
                accumulate(vector, "b:" + word + " " + words.get(i + 1), BIGRAM_WEIGHT);
            }
            String padded = "#" + word + "#";
            for (int j = 0; j + 3 <= padded.length(); j++) {
                accumulate(vector, "c:" + padded.substring(j, j + 3), TRIGRAM_WEIGHT);
            }
        }
        return VectorMath.normalize(vector);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String text : texts) {
            out.add(embed(text));
        }
        return out;
    }

    @Override
    public ModelInfo modelInfo() {
        return new ModelInfo("hashing", modelVersion, dimension, maxInputChars, ready);
    }

    private void accumulate(float[] vector, String token, float weight) {
        int h = hash(token);
        int bucket = Math.floorMod(h, dimension);
        float sign = ((h >>> 31) == 0) ? 1f : -1f;
        vector[bucket] += sign * weight;
    }

    private int hash(String token) {
        byte[] bytes = token.getBytes(StandardCharsets.UTF_8);
        int h = seed;
        for (byte b : bytes) {
            h ^= (b & 0xff);
            h *= 0x01000193;
        }
        return murmurFinalize(h);
    }

    private static int murmurFinalize(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
