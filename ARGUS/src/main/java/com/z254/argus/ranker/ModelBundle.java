package com.z254.argus.ranker;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Everything needed to score alerts, persisted as one JSON document: the
 * forest, the feature scaler fitted with it and the lexical vocabulary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelBundle {

    public static final int FORMAT_VERSION = 1;

    @Builder.Default
    private int formatVersion = FORMAT_VERSION;
    private Instant createdAt;
    private String encoderModel;
    private int embeddingDimension;
    private double noiseThreshold;
    private double falseNegativeTarget;
    private double trainingFalseNegativeRate;

    private TfidfVectorizer tfidf;
    private StandardScaler scaler;
    private RandomForestClassifier forest;

    /**
     * Check that all parts are present and agree on the feature layout.
     *
     * @param embeddingDimension dimension of the encoder the bundle will be used with
     * @throws ModelBundleException when a part is missing or inconsistent
     */
    public void validate(int embeddingDimension) {
        if (formatVersion != FORMAT_VERSION) {
            throw new ModelBundleException("Unsupported model bundle format " + formatVersion);
        }
        if (forest == null || forest.getTrees() == null || forest.getTrees().isEmpty()) {
            throw new ModelBundleException("Model bundle has no classifier");
        }
        if (scaler == null || scaler.getMean() == null || scaler.getScale() == null) {
            throw new ModelBundleException("Model bundle has no feature scaler");
        }
        if (tfidf == null || tfidf.getVocabulary() == null || tfidf.getIdf() == null
                || tfidf.getVocabulary().size() != tfidf.getIdf().length) {
            throw new ModelBundleException("Model bundle has no lexical vocabulary");
        }
        if (this.embeddingDimension != embeddingDimension) {
            throw new ModelBundleException("Model bundle was trained on " + this.embeddingDimension
                    + "-dimensional embeddings, encoder produces " + embeddingDimension);
        }
        int expected = embeddingDimension + tfidf.size() + FeatureExtractor.TEMPORAL_FEATURES
                + FeatureExtractor.HISTORICAL_FEATURES + FeatureExtractor.SERVICE_FEATURES;
        if (scaler.columns() != expected || forest.getFeatureCount() != expected) {
            throw new ModelBundleException("Model bundle feature width mismatch: expected " + expected
                    + ", scaler has " + scaler.columns() + ", classifier has " + forest.getFeatureCount());
        }
    }
}
