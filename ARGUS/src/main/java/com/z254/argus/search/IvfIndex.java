package com.z254.argus.search;

import com.z254.argus.encoder.VectorMath;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Inverted-file index: vectors are bucketed by their nearest coarse centroid
 * and a query scans the {@code nprobe} closest buckets exactly.
 */
class IvfIndex implements VectorIndex {

    private final int dimension;
    private final int nlist;
    private final int nprobe;
    private final long seed;

    private float[][] centroids;
    private final List<InvertedList> lists = new ArrayList<>();
    /** position -> list index, offset within list */
    private int[] listOf = new int[0];
    private int[] offsetOf = new int[0];
    private int size;

    IvfIndex(int dimension, IndexParameters parameters) {
        this.dimension = dimension;
        this.nlist = Math.max(1, parameters.getNlist());
        this.nprobe = Math.max(1, parameters.getNprobe());
        this.seed = parameters.getSeed();
    }

    @Override
    public IndexType type() {
        return IndexType.IVF;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public boolean requiresTraining() {
        return true;
    }

    @Override
    public boolean isTrained() {
        return centroids != null;
    }

    @Override
    public void train(float[][] vectors) {
        if (size > 0) {
            throw new IllegalStateException("IVF index already holds " + size + " vectors");
        }
        centroids = KMeans.train(vectors, nlist, seed);
        lists.clear();
        for (int i = 0; i < centroids.length; i++) {
            lists.add(new InvertedList(dimension));
        }
    }

    @Override
    public void add(float[][] vectors) {
        if (!isTrained()) {
            throw new IllegalStateException("IVF index must be trained before vectors are added");
        }
        ensureCapacity(size + vectors.length);
        for (float[] vector : vectors) {
            int list = KMeans.nearest(centroids, vector);
            listOf[size] = list;
            offsetOf[size] = lists.get(list).add(size, vector);
            size++;
        }
    }

    @Override
    public List<Neighbor> search(float[] query, int k) {
        if (!isTrained() || size == 0) {
            return List.of();
        }
        int visited = Math.min(nprobe, centroids.length);
        TopK nearestLists = new TopK(visited);
        for (int c = 0; c < centroids.length; c++) {
            nearestLists.offer(c, VectorMath.squaredL2(query, centroids[c]));
        }

        TopK top = new TopK(k);
        for (Neighbor nearest : nearestLists.toSortedList()) {
            InvertedList list = lists.get(nearest.position());
            for (int i = 0; i < list.count; i++) {
                top.offer(list.positions[i], VectorMath.squaredL2(list.vectors, i * dimension, query));
            }
        }
        return top.toSortedList();
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public float[] reconstruct(int position) {
        InvertedList list = lists.get(listOf[position]);
        int offset = offsetOf[position];
        return Arrays.copyOfRange(list.vectors, offset * dimension, (offset + 1) * dimension);
    }

    @Override
    public long memoryBytes() {
        long centroidBytes = centroids == null ? 0 : (long) centroids.length * dimension * Float.BYTES;
        return centroidBytes + (long) size * (dimension * Float.BYTES + 3L * Integer.BYTES);
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        out.writeInt(centroids == null ? 0 : centroids.length);
        if (centroids != null) {
            for (float[] centroid : centroids) {
                for (float v : centroid) {
                    out.writeFloat(v);
                }
            }
        }
        out.writeInt(size);
        for (int position = 0; position < size; position++) {
            for (float v : reconstruct(position)) {
                out.writeFloat(v);
            }
        }
    }

    @Override
    public void read(DataInputStream in) throws IOException {
        int count = in.readInt();
        if (count > 0) {
            centroids = new float[count][dimension];
            lists.clear();
            for (int c = 0; c < count; c++) {
                for (int d = 0; d < dimension; d++) {
                    centroids[c][d] = in.readFloat();
                }
                lists.add(new InvertedList(dimension));
            }
        }
        int vectors = in.readInt();
        float[][] batch = new float[vectors][dimension];
        for (int i = 0; i < vectors; i++) {
            for (int d = 0; d < dimension; d++) {
                batch[i][d] = in.readFloat();
            }
        }
        if (vectors > 0) {
            add(batch);
        }
    }

    int effectiveLists() {
        return centroids == null ? 0 : centroids.length;
    }

    private void ensureCapacity(int n) {
        if (n > listOf.length) {
            int capacity = Math.max(n, listOf.length * 2);
            listOf = Arrays.copyOf(listOf, capacity);
            offsetOf = Arrays.copyOf(offsetOf, capacity);
        }
    }

    private static final class InvertedList {
        private final int dimension;
        private float[] vectors = new float[0];
        private int[] positions = new int[0];
        private int count;

        InvertedList(int dimension) {
            this.dimension = dimension;
        }

        int add(int position, float[] vector) {
            if (count == positions.length) {
                int capacity = Math.max(8, positions.length * 2);
                positions = Arrays.copyOf(positions, capacity);
                vectors = Arrays.copyOf(vectors, capacity * dimension);
            }
            positions[count] = position;
            System.arraycopy(vector, 0, vectors, count * dimension, dimension);
            return count++;
        }
    }
}
