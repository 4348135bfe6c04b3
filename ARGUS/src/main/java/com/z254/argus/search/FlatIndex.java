package com.z254.argus.search;

import com.z254.argus.encoder.VectorMath;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Exact squared-L2 scan over contiguously stored vectors.
 */
class FlatIndex implements VectorIndex {

    private final int dimension;
    private float[] data = new float[0];
    private int size;

    FlatIndex(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public IndexType type() {
        return IndexType.FLAT;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public boolean requiresTraining() {
        return false;
    }

    @Override
    public boolean isTrained() {
        return true;
    }

    @Override
    public void train(float[][] vectors) {
        // nothing to learn
    }

    @Override
    public void add(float[][] vectors) {
        ensureCapacity(size + vectors.length);
        for (float[] vector : vectors) {
            System.arraycopy(vector, 0, data, size * dimension, dimension);
            size++;
        }
    }

    @Override
    public List<Neighbor> search(float[] query, int k) {
        TopK top = new TopK(k);
        for (int i = 0; i < size; i++) {
            top.offer(i, VectorMath.squaredL2(data, i * dimension, query));
        }
        return top.toSortedList();
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public float[] reconstruct(int position) {
        return Arrays.copyOfRange(data, position * dimension, (position + 1) * dimension);
    }

    @Override
    public long memoryBytes() {
        return (long) size * dimension * Float.BYTES;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        out.writeInt(size);
        for (int i = 0; i < size * dimension; i++) {
            out.writeFloat(data[i]);
        }
    }

    @Override
    public void read(DataInputStream in) throws IOException {
        int count = in.readInt();
        ensureCapacity(count);
        for (int i = 0; i < count * dimension; i++) {
            data[i] = in.readFloat();
        }
        size = count;
    }

    private void ensureCapacity(int vectors) {
        int needed = vectors * dimension;
        if (needed > data.length) {
            data = Arrays.copyOf(data, Math.max(needed, data.length * 2));
        }
    }
}
