package com.z254.argus.search;

import com.z254.argus.encoder.VectorMath;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;

/**
 * Raw float vectors stored contiguously.
 */
class FullPrecisionStorage implements VectorStorage {

    private final int dimension;
    private float[] data = new float[0];
    private int size;

    FullPrecisionStorage(int dimension) {
        this.dimension = dimension;
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
    public int add(float[] vector) {
        if ((size + 1) * dimension > data.length) {
            data = Arrays.copyOf(data, Math.max((size + 1) * dimension, data.length * 2));
        }
        System.arraycopy(vector, 0, data, size * dimension, dimension);
        return size++;
    }

    @Override
    public QueryDistance distanceTo(float[] query) {
        return position -> VectorMath.squaredL2(data, position * dimension, query);
    }

    @Override
    public float distance(int a, int b) {
        int oa = a * dimension;
        int ob = b * dimension;
        float sum = 0f;
        for (int d = 0; d < dimension; d++) {
            float diff = data[oa + d] - data[ob + d];
            sum += diff * diff;
        }
        return sum;
    }

    @Override
    public float[] reconstruct(int position) {
        return Arrays.copyOfRange(data, position * dimension, (position + 1) * dimension);
    }

    @Override
    public int size() {
        return size;
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
        data = new float[count * dimension];
        for (int i = 0; i < count * dimension; i++) {
            data[i] = in.readFloat();
        }
        size = count;
    }
}
