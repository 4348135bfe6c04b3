package com.z254.argus.search;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.observability.ArgusStructuredLogger;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Restores the index snapshot at startup, then periodically compacts and
 * snapshots it.
 */
@Slf4j
@Component
public class IndexMaintenanceJob {

    private final VectorSearchEngine engine;
    private final ArgusProperties.Search config;
    private final ArgusMetrics metrics;
    private final ArgusStructuredLogger structuredLogger;

    public IndexMaintenanceJob(VectorSearchEngine engine,
                               ArgusProperties argusProperties,
                               ArgusMetrics metrics,
                               ArgusStructuredLogger structuredLogger) {
        this.engine = engine;
        this.config = argusProperties.getSearch();
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    @PostConstruct
    public void restore() {
        Path base = Path.of(config.getSnapshotPath());
        if (!VectorSearchEngine.snapshotExists(base)) {
            log.info("No index snapshot at {}, starting with an empty {} index", base, engine.indexType());
            return;
        }
        try {
            engine.load(base);
            IndexStats stats = engine.stats();
            metrics.updateIndexSize(stats.getLiveVectors(), stats.getTombstonedVectors());
        } catch (IndexPersistenceException e) {
            metrics.recordIndexPersistenceError();
            log.error("Failed to restore index snapshot from {}, starting empty", base, e);
        }
    }

    @Scheduled(fixedDelayString = "${argus.search.maintenance-interval:PT10M}",
            initialDelayString = "${argus.search.maintenance-interval:PT10M}")
    public void maintain() {
        IndexStats before = engine.stats();
        if (before.tombstoneRatio() > config.getCompactionRatio()) {
            int dropped = engine.compact();
            structuredLogger.logControlEvent(ArgusStructuredLogger.ControlEventType.INDEX_COMPACTED,
                    "Vector index compacted", Map.of("dropped", dropped, "indexType", before.getIndexType()));
        }
        snapshot();
    }

    public void snapshot() {
        Path base = Path.of(config.getSnapshotPath());
        try {
            engine.save(base);
            IndexStats stats = engine.stats();
            metrics.updateIndexSize(stats.getLiveVectors(), stats.getTombstonedVectors());
            structuredLogger.logControlEvent(ArgusStructuredLogger.ControlEventType.INDEX_SNAPSHOT,
                    "Vector index snapshot written", Map.of(
                            "path", base.toString(),
                            "vectors", stats.getTotalVectors(),
                            "p99QueryMs", stats.getP99QueryMs()));
        } catch (IndexPersistenceException e) {
            metrics.recordIndexPersistenceError();
            log.error("Index snapshot failed: path={}", base, e);
        }
    }
}
