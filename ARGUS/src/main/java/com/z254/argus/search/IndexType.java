package com.z254.argus.search;

/**
 * The closed set of index strategies.
 */
public enum IndexType {

    /** Exact scan */
    FLAT {
        @Override
        public VectorIndex create(int dimension, IndexParameters parameters) {
            return new FlatIndex(dimension);
        }
    },
    /** Inverted file over a k-means coarse quantizer; needs training */
    IVF {
        @Override
        public VectorIndex create(int dimension, IndexParameters parameters) {
            return new IvfIndex(dimension, parameters);
        }
    },
    /** Random-hyperplane locality-sensitive hashing */
    LSH {
        @Override
        public VectorIndex create(int dimension, IndexParameters parameters) {
            return new LshIndex(dimension, parameters);
        }
    },
    /** Hierarchical navigable small world graph */
    HNSW {
        @Override
        public VectorIndex create(int dimension, IndexParameters parameters) {
            return new HnswIndex(this, dimension, parameters, new FullPrecisionStorage(dimension));
        }
    },
    /** HNSW over OPQ-rotated, product-quantized vectors; needs training */
    OPQ_HNSW {
        @Override
        public VectorIndex create(int dimension, IndexParameters parameters) {
            return new HnswIndex(this, dimension, parameters, new QuantizedStorage(dimension, parameters));
        }
    };

    public abstract VectorIndex create(int dimension, IndexParameters parameters);
}
