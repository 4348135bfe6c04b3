package com.z254.argus.search;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Approximate nearest-neighbour structure over vectors addressed by
 * insertion position.
 * <p>
 * Implementations are not thread-safe; {@link VectorSearchEngine} serializes
 * writers and lets readers run concurrently only while no writer is active.
 */
public interface VectorIndex {

    IndexType type();

    int dimension();

    /**
     * Whether {@link #train(float[][])} must run before the first {@link #add(float[][])}.
     */
    boolean requiresTraining();

    boolean isTrained();

    void train(float[][] vectors);

    /**
     * Append vectors; the first gets position {@link #size()}.
     */
    void add(float[][] vectors);

    /**
     * Up to {@code k} nearest positions, nearest first.
     */
    List<Neighbor> search(float[] query, int k);

    int size();

    /**
     * Best available reconstruction of the vector stored at {@code position}.
     */
    float[] reconstruct(int position);

    long memoryBytes();

    void write(DataOutputStream out) throws IOException;

    /**
     * Restore state previously produced by {@link #write(DataOutputStream)} into this empty index.
     */
    void read(DataInputStream in) throws IOException;
}
