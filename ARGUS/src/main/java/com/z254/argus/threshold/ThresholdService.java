package com.z254.argus.threshold;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.PerformanceMetrics;
import com.z254.argus.domain.model.ThresholdConfig;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.observability.ArgusStructuredLogger;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the process-wide {@link ThresholdConfig}.
 * <p>
 * Readers get the current snapshot without locking; updates and calibration
 * swap in a new clamped snapshot and persist it. Writers are serialized and
 * always persist the latest snapshot, so the file never lags memory once they
 * return. Persistence failures are metered and logged, never raised.
 */
@Slf4j
@Service
public class ThresholdService {

    public static final String NOISE_THRESHOLD = "noise_threshold";
    public static final String CONFIDENCE_MIN = "confidence_min";
    public static final String BATCH_SIZE = "batch_size";
    public static final String LEARNING_RATE = "learning_rate";

    private static final Set<String> KEYS = Set.of(NOISE_THRESHOLD, CONFIDENCE_MIN, BATCH_SIZE, LEARNING_RATE);

    private final AtomicReference<ThresholdConfig> current = new AtomicReference<>(ThresholdConfig.defaults());
    private final ReentrantLock saveLock = new ReentrantLock();
    private final Path configPath;
    private final ObjectMapper objectMapper;
    private final ArgusMetrics metrics;
    private final ArgusStructuredLogger structuredLogger;

    public ThresholdService(ArgusProperties argusProperties,
                            ObjectMapper objectMapper,
                            ArgusMetrics metrics,
                            ArgusStructuredLogger structuredLogger) {
        this.configPath = Path.of(argusProperties.getThresholds().getConfigPath());
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Load the persisted thresholds, falling back to defaults when the file is
     * missing or unreadable.
     */
    @PostConstruct
    public void load() {
        ThresholdConfig loaded = ThresholdConfig.defaults();
        if (Files.exists(configPath)) {
            try {
                loaded = objectMapper.readValue(configPath.toFile(), ThresholdConfig.class).clamped();
                log.info("Loaded thresholds from {}: {}", configPath, loaded);
            } catch (IOException e) {
                log.warn("Unreadable threshold config at {}, using defaults: {}", configPath, e.getMessage());
            }
        } else {
            log.info("No threshold config at {}, using defaults", configPath);
        }
        current.set(loaded);
        publish(loaded);
    }

    public ThresholdConfig get() {
        return current.get();
    }

    /**
     * Apply a partial update keyed by snake_case field name.
     * <p>
     * Out-of-range values are clamped to the documented bounds.
     *
     * @throws InvalidThresholdUpdateException for unknown keys or non-numeric values
     */
    public ThresholdConfig update(Map<String, ?> updates) {
        Set<String> unknown = new LinkedHashSet<>(updates.keySet());
        unknown.removeAll(KEYS);
        if (!unknown.isEmpty()) {
            throw new InvalidThresholdUpdateException("Invalid threshold keys: " + unknown, unknown);
        }
        Map<String, Double> values = new LinkedHashMap<>();
        Set<String> nonNumeric = new LinkedHashSet<>();
        updates.forEach((key, value) -> {
            Double number = toNumber(value);
            if (number == null) {
                nonNumeric.add(key);
            } else {
                values.put(key, number);
            }
        });
        if (!nonNumeric.isEmpty()) {
            throw new InvalidThresholdUpdateException("Non-numeric threshold values for " + nonNumeric, nonNumeric);
        }

        ThresholdConfig updated = current.updateAndGet(config -> {
            ThresholdConfig.ThresholdConfigBuilder builder = config.toBuilder();
            values.forEach((key, value) -> {
                switch (key) {
                    case NOISE_THRESHOLD -> builder.noiseThreshold(value);
                    case CONFIDENCE_MIN -> builder.confidenceMin(value);
                    case BATCH_SIZE -> builder.batchSize((int) Math.round(Math.max(Integer.MIN_VALUE,
                            Math.min(Integer.MAX_VALUE, value))));
                    case LEARNING_RATE -> builder.learningRate(value);
                    default -> throw new IllegalStateException("Unhandled threshold key " + key);
                }
            });
            return builder.build().clamped();
        });

        metrics.recordThresholdAdjustment();
        publish(updated);
        structuredLogger.logControlEvent(ArgusStructuredLogger.ControlEventType.THRESHOLD_UPDATED,
                "Thresholds updated", details(updated, Map.of("requested", values.toString())));
        save();
        return updated;
    }

    /**
     * Nudge thresholds from observed suppression performance.
     * <p>
     * The noise threshold rises by 0.05 when the false-positive rate is above
     * 0.10 and falls by 0.02 when it is below 0.05. The confidence floor rises by
     * 0.02 when accuracy is below 0.90 and falls by 0.01 when it is above 0.95.
     */
    public ThresholdConfig optimize(PerformanceMetrics performance) {
        ThresholdConfig before = current.get();
        ThresholdConfig optimized = current.updateAndGet(config -> {
            double noise = config.getNoiseThreshold();
            double fpr = performance.getFalsePositiveRate();
            if (fpr > 0.10) {
                noise = Math.min(ThresholdConfig.NOISE_MAX, noise + 0.05);
            } else if (fpr < 0.05) {
                noise = Math.max(ThresholdConfig.NOISE_MIN, noise - 0.02);
            }

            double confidence = config.getConfidenceMin();
            double accuracy = performance.getAccuracy();
            if (accuracy < 0.90) {
                confidence = Math.min(ThresholdConfig.CONFIDENCE_MAX, confidence + 0.02);
            } else if (accuracy > 0.95) {
                confidence = Math.max(ThresholdConfig.CONFIDENCE_MIN, confidence - 0.01);
            }
            return config.toBuilder()
                    .noiseThreshold(noise)
                    .confidenceMin(confidence)
                    .build()
                    .clamped();
        });

        if (!optimized.equals(before)) {
            metrics.recordThresholdAdjustment();
        }
        publish(optimized);
        structuredLogger.logControlEvent(ArgusStructuredLogger.ControlEventType.THRESHOLD_OPTIMIZED,
                "Thresholds optimized", details(optimized, Map.of(
                        "falsePositiveRate", performance.getFalsePositiveRate(),
                        "accuracy", performance.getAccuracy(),
                        "samples", performance.getSampleCount())));
        save();
        return optimized;
    }

    public Path getConfigPath() {
        return configPath;
    }

    private void save() {
        saveLock.lock();
        try {
            ThresholdConfig config = current.get();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = configPath.resolveSibling(configPath.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), config);
            Files.move(tmp, configPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            metrics.recordThresholdSaveError();
            structuredLogger.logControlEvent(ArgusStructuredLogger.ControlEventType.SAVE_FAILED,
                    "Failed to persist thresholds", Map.of("path", configPath.toString(), "error", String.valueOf(e.getMessage())));
        } finally {
            saveLock.unlock();
        }
    }

    private void publish(ThresholdConfig config) {
        metrics.updateThresholds(config.getNoiseThreshold(), config.getConfidenceMin());
    }

    private static Map<String, Object> details(ThresholdConfig config, Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>(extra);
        details.put(NOISE_THRESHOLD, config.getNoiseThreshold());
        details.put(CONFIDENCE_MIN, config.getConfidenceMin());
        details.put(BATCH_SIZE, config.getBatchSize());
        details.put(LEARNING_RATE, config.getLearningRate());
        return details;
    }

    private static Double toNumber(Object value) {
        double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                number = Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(number) ? number : null;
    }
}
