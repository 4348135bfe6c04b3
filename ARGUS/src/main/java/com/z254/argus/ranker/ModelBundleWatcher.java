package com.z254.argus.ranker;

import com.z254.argus.config.ArgusProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * Loads the ranker bundle at startup and reloads it whenever the file at
 * {@code argus.ranker.model-path} is replaced by a newer promotion.
 */
@Slf4j
@Component
public class ModelBundleWatcher {

    private final NoiseRanker ranker;
    private final Path modelPath;

    private volatile FileTime lastSeen;

    public ModelBundleWatcher(NoiseRanker ranker, ArgusProperties argusProperties) {
        this.ranker = ranker;
        this.modelPath = Path.of(argusProperties.getRanker().getModelPath());
    }

    @PostConstruct
    public void initialLoad() {
        if (!checkForUpdate()) {
            log.info("No noise ranker bundle at {}; scoring stays unavailable until one is promoted", modelPath);
        }
    }

    @Scheduled(fixedDelayString = "${argus.ranker.reload-check-interval:PT1M}",
            initialDelayString = "${argus.ranker.reload-check-interval:PT1M}")
    public void scheduledCheck() {
        checkForUpdate();
    }

    /**
     * Load the bundle if its modification time changed since the last attempt.
     *
     * @return true when a new bundle was installed
     */
    public boolean checkForUpdate() {
        if (!Files.isRegularFile(modelPath)) {
            return false;
        }
        FileTime modified;
        try {
            modified = Files.getLastModifiedTime(modelPath);
        } catch (IOException e) {
            log.warn("Cannot stat model bundle {}: {}", modelPath, e.getMessage());
            return false;
        }
        if (modified.equals(lastSeen)) {
            return false;
        }
        lastSeen = modified;
        try {
            ranker.load(modelPath);
            return true;
        } catch (ModelBundleException e) {
            log.warn("Keeping the current noise ranker model; bundle {} rejected: {}", modelPath, e.getMessage());
            return false;
        }
    }
}
