package com.z254.argus.search;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.Alert;
import com.z254.argus.encoder.AlertText;
import com.z254.argus.encoder.TextEncoder;
import com.z254.argus.observability.ArgusMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Semantic alert lookup: encodes alerts, indexes them and finds similar history.
 */
@Slf4j
@Service
public class AlertSearchService {

    private final TextEncoder encoder;
    private final VectorSearchEngine engine;
    private final ArgusMetrics metrics;
    private final ArgusProperties.Search config;

    public AlertSearchService(TextEncoder encoder,
                              VectorSearchEngine engine,
                              ArgusMetrics metrics,
                              ArgusProperties argusProperties) {
        this.encoder = encoder;
        this.engine = engine;
        this.metrics = metrics;
        this.config = argusProperties.getSearch();
    }

    public void index(Alert alert) {
        index(List.of(alert));
    }

    public void index(List<Alert> alerts) {
        if (alerts.isEmpty()) {
            return;
        }
        List<float[]> embeddings = encoder.embedBatch(alerts.stream()
                .map(AlertText::of)
                .collect(Collectors.toList()));
        List<String> ids = new ArrayList<>(alerts.size());
        List<Map<String, Object>> meta = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            ids.add(alert.getId());
            meta.add(metadataFor(alert));
        }
        engine.add(embeddings, ids, meta);
        refreshGauges();
    }

    /**
     * Alerts similar to {@code alert}, excluding the alert itself.
     */
    public List<SearchResult> searchSimilar(Alert alert, int k, double threshold) {
        float[] query = encoder.embed(AlertText.of(alert));
        List<SearchResult> hits = timedSearch(query, k + 1, threshold);
        return hits.stream()
                .filter(hit -> !hit.getAlertId().equals(alert.getId()))
                .limit(k)
                .collect(Collectors.toList());
    }

    public List<SearchResult> searchSimilar(Alert alert) {
        return searchSimilar(alert, config.getDefaultK(), config.getSimilarityThreshold());
    }

    public List<SearchResult> searchSimilar(String text, int k, double threshold) {
        return timedSearch(encoder.embed(text), k, threshold);
    }

    public int remove(List<String> alertIds) {
        int removed = engine.remove(alertIds);
        refreshGauges();
        return removed;
    }

    public IndexStats stats() {
        return engine.stats();
    }

    void refreshGauges() {
        IndexStats stats = engine.stats();
        metrics.updateIndexSize(stats.getLiveVectors(), stats.getTombstonedVectors());
    }

    private List<SearchResult> timedSearch(float[] query, int k, double threshold) {
        long start = System.nanoTime();
        try {
            return engine.search(query, k, threshold);
        } finally {
            metrics.recordSearchLatency(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private static Map<String, Object> metadataFor(Alert alert) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("name", alert.getName());
        meta.put("severity", alert.getSeverity() != null ? alert.getSeverity().wireName() : null);
        meta.put("service", alert.effectiveService());
        meta.put("environment", alert.getEnvironment());
        meta.put("firedAt", alert.getFiredAt() != null ? alert.getFiredAt().toString() : null);
        return meta;
    }
}
