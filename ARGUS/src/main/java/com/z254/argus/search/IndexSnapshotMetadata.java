package com.z254.argus.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON sidecar written next to the binary index structure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexSnapshotMetadata {

    private int formatVersion;
    private IndexType indexType;
    private int dimension;
    private IndexParameters parameters;

    /** position -> alert id */
    @Builder.Default
    private List<String> alertIds = new ArrayList<>();

    /** position -> metadata, including the tombstone flag */
    @Builder.Default
    private List<Map<String, Object>> metadata = new ArrayList<>();

    private int nextPosition;
    private Instant savedAt;
}
