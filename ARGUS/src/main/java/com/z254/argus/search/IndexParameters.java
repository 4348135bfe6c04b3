package com.z254.argus.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.z254.argus.config.ArgusProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hyperparameters for every index strategy. Each strategy reads only the
 * fields it needs.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexParameters {

    /** HNSW graph degree */
    @Builder.Default
    private int m = 16;

    @Builder.Default
    private int efConstruction = 200;

    @Builder.Default
    private int efSearch = 64;

    /** IVF inverted lists */
    @Builder.Default
    private int nlist = 100;

    @Builder.Default
    private int nprobe = 10;

    /** LSH signature bits, 0 for twice the dimension */
    @Builder.Default
    private int nbits = 0;

    /** Product quantizer sub-vectors */
    @Builder.Default
    private int pqSubVectors = 16;

    /** Bits per product quantizer code */
    @Builder.Default
    private int pqBits = 8;

    @Builder.Default
    private int opqIterations = 5;

    @Builder.Default
    private long seed = 42L;

    public static IndexParameters from(ArgusProperties.Search search) {
        return IndexParameters.builder()
                .m(search.getHnsw().getM())
                .efConstruction(search.getHnsw().getEfConstruction())
                .efSearch(search.getHnsw().getEfSearch())
                .nlist(search.getIvf().getNlist())
                .nprobe(search.getIvf().getNprobe())
                .nbits(search.getLsh().getNbits())
                .pqSubVectors(search.getPq().getSubVectors())
                .pqBits(search.getPq().getBits())
                .opqIterations(search.getPq().getOpqIterations())
                .build();
    }
}
