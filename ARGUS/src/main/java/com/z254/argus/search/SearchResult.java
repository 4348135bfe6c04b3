package com.z254.argus.search;

import lombok.Value;

import java.util.Map;

/**
 * A similar alert returned by the search engine, with similarity in [0, 1].
 */
@Value
public class SearchResult {
    String alertId;
    double score;
    Map<String, Object> metadata;
}
