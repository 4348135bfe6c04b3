package com.z254.argus.ranker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.AlertFeatures;
import com.z254.argus.domain.model.HistoricalContext;
import com.z254.argus.domain.model.NoiseScore;
import com.z254.argus.encoder.AlertText;
import com.z254.argus.encoder.TextEncoder;
import com.z254.argus.encoder.VectorMath;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.observability.ArgusStructuredLogger;
import com.z254.argus.threshold.SuppressionOutcomeTracker;
import com.z254.argus.threshold.ThresholdService;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Scores alerts with the probability that they are noise.
 * <p>
 * The loaded model is an immutable {@link ModelBundle} swapped atomically on
 * {@link #train} or {@link #load}. Scores are cached per alert id for a short
 * TTL; the cache is cleared whenever the model changes.
 */
@Slf4j
@Service
public class NoiseRanker {

    private final FeatureExtractor featureExtractor;
    private final TextEncoder encoder;
    private final ThresholdService thresholdService;
    private final SuppressionOutcomeTracker outcomeTracker;
    private final ArgusProperties.Ranker config;
    private final ObjectMapper objectMapper;
    private final ArgusMetrics metrics;
    private final ArgusStructuredLogger structuredLogger;
    private final Clock clock;
    private final Cache<String, NoiseScore> scoreCache;

    private volatile ModelBundle model;

    public NoiseRanker(FeatureExtractor featureExtractor,
                       TextEncoder encoder,
                       ThresholdService thresholdService,
                       SuppressionOutcomeTracker outcomeTracker,
                       ArgusProperties argusProperties,
                       ObjectMapper objectMapper,
                       ArgusMetrics metrics,
                       ArgusStructuredLogger structuredLogger,
                       Clock clock) {
        this.featureExtractor = featureExtractor;
        this.encoder = encoder;
        this.thresholdService = thresholdService;
        this.outcomeTracker = outcomeTracker;
        this.config = argusProperties.getRanker();
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.scoreCache = Caffeine.newBuilder()
                .expireAfterWrite(config.getScoreCacheTtl())
                .maximumSize(config.getScoreCacheMaxSize())
                .build();
    }

    public boolean isModelLoaded() {
        return model != null;
    }

    public Optional<ModelBundle> currentModel() {
        return Optional.ofNullable(model);
    }

    public AlertFeatures extractFeatures(Alert alert, HistoricalContext historical) {
        return featureExtractor.extract(alert, historical, requireModel().getTfidf());
    }

    /**
     * Noise probability in [0, 1], served from the cache when the alert was
     * scored recently.
     *
     * @throws ModelNotReadyException when no model has been loaded yet
     */
    public double score(Alert alert, HistoricalContext historical) {
        ModelBundle bundle = requireModel();
        if (alert.getId() != null) {
            NoiseScore cached = scoreCache.getIfPresent(alert.getId());
            if (cached != null) {
                return cached.getScore();
            }
        }
        Timer.Sample sample = metrics.startScoringTimer();
        double score = predict(bundle, featureExtractor.extract(alert, historical, bundle.getTfidf()));
        metrics.recordScore(sample, score);
        if (alert.getId() != null) {
            cacheScore(bundle, new NoiseScore(alert.getId(), score, clock.instant()));
        }
        return score;
    }

    /**
     * Drop any cached score for the alert and score it again.
     */
    public double rescore(Alert alert, HistoricalContext historical) {
        if (alert.getId() != null) {
            scoreCache.invalidate(alert.getId());
        }
        return score(alert, historical);
    }

    public Optional<NoiseScore> cachedScore(String alertId) {
        return Optional.ofNullable(scoreCache.getIfPresent(alertId));
    }

    /**
     * Score a batch and order it most-likely-noise first. Ties keep input order.
     */
    public List<ScoredAlert> rank(List<Alert> alerts, Map<String, HistoricalContext> historicalById) {
        ModelBundle bundle = requireModel();
        double[] scores = new double[alerts.size()];
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < alerts.size(); i++) {
            String id = alerts.get(i).getId();
            NoiseScore cached = id == null ? null : scoreCache.getIfPresent(id);
            if (cached != null) {
                scores[i] = cached.getScore();
            } else {
                missing.add(i);
            }
        }

        List<Alert> unscored = missing.stream().map(alerts::get).collect(Collectors.toList());
        List<AlertFeatures> features = featureExtractor.extractBatch(unscored,
                unscored.stream()
                        .map(a -> a.getId() == null ? HistoricalContext.empty()
                                : historicalById.getOrDefault(a.getId(), HistoricalContext.empty()))
                        .collect(Collectors.toList()),
                bundle.getTfidf());
        Instant now = clock.instant();
        for (int j = 0; j < missing.size(); j++) {
            Alert alert = unscored.get(j);
            Timer.Sample sample = metrics.startScoringTimer();
            double score = predict(bundle, features.get(j));
            metrics.recordScore(sample, score);
            scores[missing.get(j)] = score;
            if (alert.getId() != null) {
                cacheScore(bundle, new NoiseScore(alert.getId(), score, now));
            }
        }

        List<ScoredAlert> ranked = new ArrayList<>(alerts.size());
        for (int i = 0; i < alerts.size(); i++) {
            ranked.add(new ScoredAlert(alerts.get(i), scores[i]));
        }
        ranked.sort(Comparator.comparingDouble(ScoredAlert::score).reversed());

        double threshold = effectiveThreshold();
        long suppressible = ranked.stream().filter(r -> r.score() > threshold).count();
        metrics.updateVolumeReduction(ranked.isEmpty() ? 0.0 : (double) suppressible / ranked.size());
        return ranked;
    }

    /**
     * Whether the alert should be suppressed under the current effective threshold.
     */
    public boolean shouldSuppress(Alert alert, HistoricalContext historical) {
        return score(alert, historical) > effectiveThreshold();
    }

    /**
     * The nominal noise threshold, raised by the configured boost (and capped)
     * while the observed false-negative rate is above target. Never lower than
     * the nominal threshold.
     */
    public double effectiveThreshold() {
        double nominal = thresholdService.get().getNoiseThreshold();
        double falseNegativeRate = outcomeTracker.falseNegativeRate();
        if (falseNegativeRate > falseNegativeTarget()) {
            return Math.max(nominal, Math.min(nominal + config.getThresholdBoost(), config.getMaxEffectiveThreshold()));
        }
        return nominal;
    }

    public double falseNegativeTarget() {
        ModelBundle bundle = model;
        return bundle != null && bundle.getFalseNegativeTarget() > 0
                ? bundle.getFalseNegativeTarget()
                : config.getFalseNegativeTarget();
    }

    /**
     * Candidates whose text is at least {@code threshold} similar to the alert,
     * most similar first. Does not need a trained model.
     */
    public List<ScoredAlert> findSimilar(Alert alert, List<Alert> candidates, double threshold) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        float[] query = encoder.embed(AlertText.of(alert));
        List<float[]> embeddings = encoder.embedBatch(candidates.stream()
                .map(AlertText::of)
                .collect(Collectors.toList()));
        float[] similarities = VectorMath.batchSimilarity(query, embeddings.toArray(new float[0][]));
        List<ScoredAlert> similar = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            if (similarities[i] >= threshold) {
                similar.add(new ScoredAlert(candidates.get(i), similarities[i]));
            }
        }
        similar.sort(Comparator.comparingDouble(ScoredAlert::score).reversed());
        return similar;
    }

    /**
     * Fit vocabulary, scaler and forest on labelled samples and install the result.
     *
     * @param noiseLabels {@code true} for noise, {@code false} for actionable signal
     */
    public TrainingReport train(List<TrainingSample> samples, List<Boolean> noiseLabels) {
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot train on an empty sample set");
        }
        if (samples.size() != noiseLabels.size()) {
            throw new IllegalArgumentException("Expected " + samples.size() + " labels, got " + noiseLabels.size());
        }
        Instant start = clock.instant();
        List<Alert> alerts = samples.stream().map(TrainingSample::alert).collect(Collectors.toList());
        List<HistoricalContext> history = samples.stream()
                .map(s -> s.historical() != null ? s.historical() : HistoricalContext.empty())
                .collect(Collectors.toList());

        TfidfVectorizer tfidf = TfidfVectorizer.fit(
                alerts.stream().map(AlertText::of).collect(Collectors.toList()),
                config.getMaxLexicalFeatures());
        List<AlertFeatures> features = featureExtractor.extractBatch(alerts, history, tfidf);
        double[][] rows = new double[features.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = features.get(i).concatenate();
        }
        StandardScaler scaler = StandardScaler.fit(rows);
        double[][] scaled = new double[rows.length][];
        boolean[] labels = new boolean[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scaled[i] = scaler.transform(rows[i]);
            labels[i] = Boolean.TRUE.equals(noiseLabels.get(i));
        }
        RandomForestClassifier forest = RandomForestClassifier.fit(scaled, labels, config.getForest());

        int signals = 0;
        int noise = 0;
        int signalsSuppressed = 0;
        int suppressions = 0;
        int wrongSuppressions = 0;
        int correct = 0;
        for (int i = 0; i < scaled.length; i++) {
            boolean predictedNoise = forest.predict(scaled[i]);
            if (labels[i]) {
                noise++;
            } else {
                signals++;
                if (predictedNoise) {
                    signalsSuppressed++;
                }
            }
            if (predictedNoise) {
                suppressions++;
                if (!labels[i]) {
                    wrongSuppressions++;
                }
            }
            if (predictedNoise == labels[i]) {
                correct++;
            }
        }
        double falseNegativeRate = signals == 0 ? 0.0 : (double) signalsSuppressed / signals;

        install(ModelBundle.builder()
                .createdAt(clock.instant())
                .encoderModel(encoder.modelInfo().model())
                .embeddingDimension(encoder.dimension())
                .noiseThreshold(thresholdService.get().getNoiseThreshold())
                .falseNegativeTarget(config.getFalseNegativeTarget())
                .trainingFalseNegativeRate(falseNegativeRate)
                .tfidf(tfidf)
                .scaler(scaler)
                .forest(forest)
                .build());

        TrainingReport report = TrainingReport.builder()
                .samples(samples.size())
                .noiseSamples(noise)
                .signalSamples(signals)
                .falseNegativeRate(falseNegativeRate)
                .falsePositiveRate(suppressions == 0 ? 0.0 : (double) wrongSuppressions / suppressions)
                .accuracy((double) correct / samples.size())
                .trees(forest.size())
                .featureCount(forest.getFeatureCount())
                .vocabularySize(tfidf.size())
                .trainingTime(Duration.between(start, clock.instant()))
                .build();
        structuredLogger.logControlEvent(ArgusStructuredLogger.ControlEventType.MODEL_TRAINED,
                "Noise ranker trained", Map.of(
                        "samples", report.getSamples(),
                        "falseNegativeRate", report.getFalseNegativeRate(),
                        "accuracy", report.getAccuracy(),
                        "features", report.getFeatureCount()));
        return report;
    }

    /**
     * Write the current model as a single JSON bundle.
     */
    public void save(Path path) {
        ModelBundle bundle = requireModel();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), bundle);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Saved noise ranker bundle to {}", path);
        } catch (IOException e) {
            throw new ModelBundleException("Failed to write model bundle to " + path, e);
        }
    }

    /**
     * Read, validate and install a model bundle. The previous model stays in
     * place when the bundle is unreadable or incomplete.
     *
     * @throws ModelBundleException when the bundle cannot be used
     */
    public ModelBundle load(Path path) {
        ModelBundle bundle;
        try {
            bundle = objectMapper.readValue(path.toFile(), ModelBundle.class);
        } catch (IOException e) {
            structuredLogger.logControlEvent(ArgusStructuredLogger.ControlEventType.MODEL_LOAD_FAILED,
                    "Model bundle unreadable", Map.of("path", path.toString(), "error", String.valueOf(e.getMessage())));
            throw new ModelBundleException("Failed to read model bundle " + path, e);
        }
        if (bundle == null) {
            throw new ModelBundleException("Model bundle " + path + " is empty");
        }
        try {
            bundle.validate(encoder.dimension());
        } catch (ModelBundleException e) {
            structuredLogger.logControlEvent(ArgusStructuredLogger.ControlEventType.MODEL_LOAD_FAILED,
                    "Model bundle rejected", Map.of("path", path.toString(), "error", e.getMessage()));
            throw e;
        }
        install(bundle);
        metrics.recordModelReload();
        structuredLogger.logControlEvent(ArgusStructuredLogger.ControlEventType.MODEL_LOADED,
                "Noise ranker model loaded", Map.of(
                        "path", path.toString(),
                        "trees", bundle.getForest().size(),
                        "createdAt", String.valueOf(bundle.getCreatedAt())));
        return bundle;
    }

    private void install(ModelBundle bundle) {
        model = bundle;
        scoreCache.invalidateAll();
    }

    /**
     * Caches a score computed with {@code bundle}. {@link #install} publishes the
     * new model before clearing the cache, so a score from a replaced model is
     * either cleared there or withdrawn here.
     */
    private void cacheScore(ModelBundle bundle, NoiseScore computed) {
        scoreCache.put(computed.getAlertId(), computed);
        if (model != bundle) {
            scoreCache.asMap().remove(computed.getAlertId(), computed);
        }
    }

    private ModelBundle requireModel() {
        ModelBundle bundle = model;
        if (bundle == null) {
            metrics.recordModelNotReady();
            throw new ModelNotReadyException("Noise ranker has no model loaded");
        }
        return bundle;
    }

    private static double predict(ModelBundle bundle, AlertFeatures features) {
        double[] row = bundle.getScaler().transform(features.concatenate());
        double probability = bundle.getForest().predictProbability(row);
        return Math.max(0.0, Math.min(1.0, probability));
    }

    /**
     * Scoring was requested before any model was trained or loaded. Callers
     * may retry once a model is available.
     */
    public static class ModelNotReadyException extends RuntimeException {
        public ModelNotReadyException(String message) {
            super(message);
        }
    }
}
