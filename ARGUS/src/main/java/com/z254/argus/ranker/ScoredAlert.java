package com.z254.argus.ranker;

import com.z254.argus.domain.model.Alert;

/**
 * An alert paired with a score: a noise probability from ranking or a
 * semantic similarity from {@link NoiseRanker#findSimilar}.
 */
public record ScoredAlert(Alert alert, double score) {
}
