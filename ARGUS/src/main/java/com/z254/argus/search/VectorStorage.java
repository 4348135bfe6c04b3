package com.z254.argus.search;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Vector payload behind a graph index: either full precision or quantized codes.
 */
interface VectorStorage {

    boolean requiresTraining();

    boolean isTrained();

    void train(float[][] vectors);

    /**
     * Store a vector and return its position.
     */
    int add(float[] vector);

    /**
     * Distance function from a query to stored positions.
     */
    QueryDistance distanceTo(float[] query);

    /**
     * Distance between two stored positions.
     */
    float distance(int a, int b);

    float[] reconstruct(int position);

    int size();

    long memoryBytes();

    void write(DataOutputStream out) throws IOException;

    void read(DataInputStream in) throws IOException;

    @FunctionalInterface
    interface QueryDistance {
        float to(int position);
    }
}
