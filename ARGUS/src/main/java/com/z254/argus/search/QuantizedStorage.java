package com.z254.argus.search;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;

/**
 * OPQ-rotated product-quantized codes. Queries use asymmetric distances
 * against the codes; stored-to-stored distances use precomputed centroid tables.
 */
class QuantizedStorage implements VectorStorage {

    private final int opqIterations;
    private final long seed;
    private final OpqRotation rotation;
    private final ProductQuantizer quantizer;
    private final int codeSize;

    private byte[] codes = new byte[0];
    private int size;
    private boolean trained;

    QuantizedStorage(int dimension, IndexParameters parameters) {
        this.opqIterations = Math.max(0, parameters.getOpqIterations());
        this.seed = parameters.getSeed();
        this.rotation = new OpqRotation(dimension);
        this.quantizer = new ProductQuantizer(dimension, parameters.getPqSubVectors(),
                parameters.getPqBits(), parameters.getSeed());
        this.codeSize = quantizer.subVectors();
    }

    @Override
    public boolean requiresTraining() {
        return true;
    }

    @Override
    public boolean isTrained() {
        return trained;
    }

    @Override
    public void train(float[][] vectors) {
        if (size > 0) {
            throw new IllegalStateException("Quantized storage already holds " + size + " codes");
        }
        rotation.train(vectors, quantizer, opqIterations, seed);
        trained = true;
    }

    @Override
    public int add(float[] vector) {
        if (!trained) {
            throw new IllegalStateException("Quantized storage must be trained before vectors are added");
        }
        if ((size + 1) * codeSize > codes.length) {
            codes = Arrays.copyOf(codes, Math.max((size + 1) * codeSize, codes.length * 2));
        }
        byte[] encoded = quantizer.encode(rotation.apply(vector));
        System.arraycopy(encoded, 0, codes, size * codeSize, codeSize);
        return size++;
    }

    @Override
    public QueryDistance distanceTo(float[] query) {
        float[] table = quantizer.distanceTable(rotation.apply(query));
        return position -> quantizer.asymmetricDistance(table, codes, position * codeSize);
    }

    @Override
    public float distance(int a, int b) {
        return quantizer.symmetricDistance(codes, a * codeSize, b * codeSize);
    }

    @Override
    public float[] reconstruct(int position) {
        return rotation.invert(quantizer.decode(codes, position * codeSize));
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public long memoryBytes() {
        return (long) size * codeSize + quantizer.memoryBytes() + rotation.memoryBytes();
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        out.writeBoolean(trained);
        if (!trained) {
            return;
        }
        rotation.write(out);
        quantizer.write(out);
        out.writeInt(size);
        out.write(codes, 0, size * codeSize);
    }

    @Override
    public void read(DataInputStream in) throws IOException {
        trained = in.readBoolean();
        if (!trained) {
            return;
        }
        rotation.read(in);
        quantizer.read(in);
        size = in.readInt();
        codes = new byte[size * codeSize];
        in.readFully(codes);
    }
}
