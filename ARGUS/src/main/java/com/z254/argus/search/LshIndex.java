package com.z254.argus.search;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Random-hyperplane LSH. Each vector is reduced to an {@code nbits}-bit
 * signature and queries rank by Hamming distance between signatures.
 * <p>
 * Source vectors are retained so the engine can rebuild during compaction.
 */
class LshIndex implements VectorIndex {

    private final int dimension;
    private final int nbits;
    private final int words;
    private final float[][] hyperplanes;

    private long[] signatures = new long[0];
    private final List<float[]> vectors = new ArrayList<>();
    private int size;

    LshIndex(int dimension, IndexParameters parameters) {
        this.dimension = dimension;
        this.nbits = parameters.getNbits() > 0 ? parameters.getNbits() : dimension * 2;
        this.words = (nbits + 63) / 64;
        this.hyperplanes = new float[nbits][dimension];
        Random random = new Random(parameters.getSeed());
        for (int b = 0; b < nbits; b++) {
            for (int d = 0; d < dimension; d++) {
                hyperplanes[b][d] = (float) random.nextGaussian();
            }
        }
    }

    @Override
    public IndexType type() {
        return IndexType.LSH;
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
        // hyperplanes are fixed by the seed
    }

    @Override
    public void add(float[][] batch) {
        if ((size + batch.length) * words > signatures.length) {
            signatures = Arrays.copyOf(signatures, Math.max((size + batch.length) * words, signatures.length * 2));
        }
        for (float[] vector : batch) {
            long[] signature = signature(vector);
            System.arraycopy(signature, 0, signatures, size * words, words);
            vectors.add(vector.clone());
            size++;
        }
    }

    @Override
    public List<Neighbor> search(float[] query, int k) {
        long[] q = signature(query);
        TopK top = new TopK(k);
        for (int i = 0; i < size; i++) {
            int distance = 0;
            int base = i * words;
            for (int w = 0; w < words; w++) {
                distance += Long.bitCount(signatures[base + w] ^ q[w]);
            }
            top.offer(i, distance);
        }
        return top.toSortedList();
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public float[] reconstruct(int position) {
        return vectors.get(position).clone();
    }

    @Override
    public long memoryBytes() {
        return (long) size * words * Long.BYTES + (long) nbits * dimension * Float.BYTES;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        out.writeInt(nbits);
        out.writeInt(size);
        for (float[] vector : vectors) {
            for (float v : vector) {
                out.writeFloat(v);
            }
        }
    }

    @Override
    public void read(DataInputStream in) throws IOException {
        int storedBits = in.readInt();
        if (storedBits != nbits) {
            throw new IOException("LSH signature width mismatch: expected " + nbits + " but found " + storedBits);
        }
        int count = in.readInt();
        float[][] batch = new float[count][dimension];
        for (int i = 0; i < count; i++) {
            for (int d = 0; d < dimension; d++) {
                batch[i][d] = in.readFloat();
            }
        }
        add(batch);
    }

    private long[] signature(float[] vector) {
        long[] signature = new long[words];
        for (int b = 0; b < nbits; b++) {
            float[] plane = hyperplanes[b];
            float dot = 0f;
            for (int d = 0; d < dimension; d++) {
                dot += plane[d] * vector[d];
            }
            if (dot >= 0f) {
                signature[b >>> 6] |= 1L << (b & 63);
            }
        }
        return signature;
    }
}
