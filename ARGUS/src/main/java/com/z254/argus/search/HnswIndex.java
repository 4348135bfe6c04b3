package com.z254.argus.search;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Random;

/**
 * Hierarchical navigable small world graph.
 * <p>
 * Layer 0 keeps up to {@code 2 * m} links per node, upper layers {@code m}.
 * Neighbours are chosen with the diversity heuristic, padded with the closest
 * pruned candidates. The vector payload is delegated to a {@link VectorStorage}
 * so the same graph serves full-precision and quantized variants.
 */
class HnswIndex implements VectorIndex {

    private final IndexType type;
    private final int dimension;
    private final int m;
    private final int maxM0;
    private final int efConstruction;
    private final double levelMultiplier;
    private final VectorStorage storage;
    private Random random;
    private volatile int efSearch;

    /** node -> level -> neighbour positions */
    private final List<int[][]> links = new ArrayList<>();
    private int entryPoint = -1;
    private int maxLevel = -1;
    private long linkCount;

    HnswIndex(IndexType type, int dimension, IndexParameters parameters, VectorStorage storage) {
        this.type = type;
        this.dimension = dimension;
        this.m = Math.max(2, parameters.getM());
        this.maxM0 = this.m * 2;
        this.efConstruction = Math.max(this.m, parameters.getEfConstruction());
        this.efSearch = Math.max(1, parameters.getEfSearch());
        this.levelMultiplier = 1.0 / Math.log(this.m);
        this.storage = storage;
        this.random = new Random(parameters.getSeed());
    }

    @Override
    public IndexType type() {
        return type;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public boolean requiresTraining() {
        return storage.requiresTraining();
    }

    @Override
    public boolean isTrained() {
        return storage.isTrained();
    }

    @Override
    public void train(float[][] vectors) {
        storage.train(vectors);
    }

    void setEfSearch(int efSearch) {
        this.efSearch = Math.max(1, efSearch);
    }

    @Override
    public void add(float[][] vectors) {
        for (float[] vector : vectors) {
            int node = storage.add(vector);
            insert(node, vector);
        }
    }

    @Override
    public List<Neighbor> search(float[] query, int k) {
        if (entryPoint < 0 || k <= 0) {
            return List.of();
        }
        VectorStorage.QueryDistance distance = storage.distanceTo(query);
        Neighbor entry = new Neighbor(entryPoint, distance.to(entryPoint));
        for (int level = maxLevel; level > 0; level--) {
            entry = greedy(distance, entry, level);
        }
        List<Neighbor> found = searchLayer(distance, List.of(entry), Math.max(efSearch, k), 0);
        return found.size() > k ? List.copyOf(found.subList(0, k)) : found;
    }

    @Override
    public int size() {
        return storage.size();
    }

    @Override
    public float[] reconstruct(int position) {
        return storage.reconstruct(position);
    }

    @Override
    public long memoryBytes() {
        return storage.memoryBytes() + linkCount * Integer.BYTES + (long) links.size() * 16;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        storage.write(out);
        out.writeInt(entryPoint);
        out.writeInt(maxLevel);
        out.writeInt(links.size());
        for (int[][] nodeLinks : links) {
            out.writeInt(nodeLinks.length);
            for (int[] level : nodeLinks) {
                out.writeInt(level.length);
                for (int neighbour : level) {
                    out.writeInt(neighbour);
                }
            }
        }
    }

    @Override
    public void read(DataInputStream in) throws IOException {
        storage.read(in);
        entryPoint = in.readInt();
        maxLevel = in.readInt();
        int nodes = in.readInt();
        if (nodes != storage.size()) {
            throw new IOException("Graph has " + nodes + " nodes but storage holds " + storage.size());
        }
        links.clear();
        linkCount = 0;
        for (int n = 0; n < nodes; n++) {
            int levels = in.readInt();
            int[][] nodeLinks = new int[levels][];
            for (int l = 0; l < levels; l++) {
                int count = in.readInt();
                nodeLinks[l] = new int[count];
                for (int i = 0; i < count; i++) {
                    nodeLinks[l][i] = in.readInt();
                }
                linkCount += count;
            }
            links.add(nodeLinks);
        }
        random = new Random(nodes * 31L + dimension);
    }

    private void insert(int node, float[] vector) {
        int level = randomLevel();
        int[][] nodeLinks = new int[level + 1][];
        for (int l = 0; l <= level; l++) {
            nodeLinks[l] = new int[0];
        }
        links.add(nodeLinks);

        if (entryPoint < 0) {
            entryPoint = node;
            maxLevel = level;
            return;
        }

        VectorStorage.QueryDistance distance = storage.distanceTo(vector);
        Neighbor entry = new Neighbor(entryPoint, distance.to(entryPoint));
        for (int l = maxLevel; l > level; l--) {
            entry = greedy(distance, entry, l);
        }

        List<Neighbor> entries = List.of(entry);
        for (int l = Math.min(level, maxLevel); l >= 0; l--) {
            List<Neighbor> candidates = searchLayer(distance, entries, efConstruction, l);
            List<Neighbor> selected = selectNeighbours(candidates, m);
            int[] chosen = new int[selected.size()];
            for (int i = 0; i < chosen.length; i++) {
                chosen[i] = selected.get(i).position();
            }
            nodeLinks[l] = chosen;
            linkCount += chosen.length;
            for (Neighbor neighbour : selected) {
                connect(neighbour.position(), node, neighbour.distance(), l);
            }
            entries = candidates;
        }

        if (level > maxLevel) {
            maxLevel = level;
            entryPoint = node;
        }
    }

    private void connect(int from, int to, float distance, int level) {
        int[] current = links.get(from)[level];
        int capacity = level == 0 ? maxM0 : m;
        if (current.length < capacity) {
            int[] grown = new int[current.length + 1];
            System.arraycopy(current, 0, grown, 0, current.length);
            grown[current.length] = to;
            links.get(from)[level] = grown;
            linkCount++;
            return;
        }

        List<Neighbor> candidates = new ArrayList<>(current.length + 1);
        for (int existing : current) {
            candidates.add(new Neighbor(existing, storage.distance(from, existing)));
        }
        candidates.add(new Neighbor(to, distance));
        candidates.sort(TopK.nearestFirst());
        List<Neighbor> kept = selectNeighbours(candidates, capacity);
        int[] pruned = new int[kept.size()];
        for (int i = 0; i < pruned.length; i++) {
            pruned[i] = kept.get(i).position();
        }
        linkCount += pruned.length - current.length;
        links.get(from)[level] = pruned;
    }

    /**
     * Diversity heuristic: keep a candidate only if it is closer to the base
     * than to every neighbour already kept, then pad with the closest rejects.
     * {@code candidates} must be sorted nearest first.
     */
    private List<Neighbor> selectNeighbours(List<Neighbor> candidates, int limit) {
        if (candidates.size() <= limit) {
            return candidates;
        }
        List<Neighbor> kept = new ArrayList<>(limit);
        List<Neighbor> rejected = new ArrayList<>();
        for (Neighbor candidate : candidates) {
            if (kept.size() >= limit) {
                break;
            }
            boolean diverse = true;
            for (Neighbor selected : kept) {
                if (storage.distance(candidate.position(), selected.position()) < candidate.distance()) {
                    diverse = false;
                    break;
                }
            }
            if (diverse) {
                kept.add(candidate);
            } else {
                rejected.add(candidate);
            }
        }
        for (int i = 0; i < rejected.size() && kept.size() < limit; i++) {
            kept.add(rejected.get(i));
        }
        kept.sort(TopK.nearestFirst());
        return kept;
    }

    private Neighbor greedy(VectorStorage.QueryDistance distance, Neighbor start, int level) {
        Neighbor current = start;
        boolean improved = true;
        while (improved) {
            improved = false;
            int[][] nodeLinks = links.get(current.position());
            if (level >= nodeLinks.length) {
                break;
            }
            for (int neighbour : nodeLinks[level]) {
                float d = distance.to(neighbour);
                if (d < current.distance()) {
                    current = new Neighbor(neighbour, d);
                    improved = true;
                }
            }
        }
        return current;
    }

    /**
     * Best-first search within one layer; result sorted nearest first, at most {@code ef} long.
     */
    private List<Neighbor> searchLayer(VectorStorage.QueryDistance distance, List<Neighbor> entries,
                                       int ef, int level) {
        BitSet visited = new BitSet(links.size());
        PriorityQueue<Neighbor> candidates = new PriorityQueue<>(TopK.nearestFirst());
        PriorityQueue<Neighbor> results = new PriorityQueue<>(TopK.nearestFirst().reversed());

        for (Neighbor entry : entries) {
            if (!visited.get(entry.position())) {
                visited.set(entry.position());
                candidates.add(entry);
                results.add(entry);
                if (results.size() > ef) {
                    results.poll();
                }
            }
        }

        while (!candidates.isEmpty()) {
            Neighbor closest = candidates.poll();
            Neighbor furthest = results.peek();
            if (results.size() >= ef && closest.distance() > furthest.distance()) {
                break;
            }
            int[][] nodeLinks = links.get(closest.position());
            if (level >= nodeLinks.length) {
                continue;
            }
            for (int neighbour : nodeLinks[level]) {
                if (visited.get(neighbour)) {
                    continue;
                }
                visited.set(neighbour);
                float d = distance.to(neighbour);
                if (results.size() < ef || d < results.peek().distance()) {
                    Neighbor next = new Neighbor(neighbour, d);
                    candidates.add(next);
                    results.add(next);
                    if (results.size() > ef) {
                        results.poll();
                    }
                }
            }
        }

        List<Neighbor> sorted = new ArrayList<>(results);
        sorted.sort(TopK.nearestFirst());
        return sorted;
    }

    private int randomLevel() {
        double u = 1.0 - random.nextDouble();
        return (int) Math.floor(-Math.log(u) * levelMultiplier);
    }
}
