package com.z254.argus.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.argus.encoder.VectorMath;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe facade over a {@link VectorIndex} that maps positions to alert
 * ids and metadata.
 * <p>
 * Searches run concurrently under a read lock; inserts, removals, compaction
 * and loads take the write lock. Removal only tombstones an entry (flag
 * {@value #DELETED_KEY} in its metadata); {@link #compact()} rebuilds the index
 * without tombstoned entries. Native distances are mapped to a similarity in
 * [0, 1] with {@code 1 / (1 + distance)}.
 * <p>
 * Indexes that need training (IVF, OPQ_HNSW) are not trained on whatever
 * arrives first. Inserts are held in an exact side buffer until
 * {@link #trainingSize()} vectors are available, then the index is trained on
 * all of them and the buffer is migrated into it.
 */
@Slf4j
public class VectorSearchEngine {

    public static final String DELETED_KEY = "deleted";
    public static final String INDEX_SUFFIX = ".index";
    public static final String META_SUFFIX = ".meta";

    private static final int MAGIC = 0x41524758;
    private static final int FORMAT_VERSION = 2;
    private static final int TRAINING_VECTORS_PER_CENTROID = 4;
    private static final int LATENCY_WINDOW = 1024;

    private final ObjectMapper objectMapper;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    /** Serializes snapshot writers, which share temp file names */
    private final ReentrantLock saveLock = new ReentrantLock();

    private IndexType indexType;
    private int dimension;
    private IndexParameters parameters;
    private VectorIndex index;
    /** Positions 0..n-1 while the index is still waiting for enough training data */
    private final List<float[]> pending = new ArrayList<>();

    private final List<String> alertIds = new ArrayList<>();
    private final List<Map<String, Object>> metadata = new ArrayList<>();
    private final Map<String, Integer> livePositions = new HashMap<>();
    private final BitSet tombstones = new BitSet();

    private final double[] latencies = new double[LATENCY_WINDOW];
    private long queryCount;

    public VectorSearchEngine(IndexType indexType, int dimension, IndexParameters parameters,
                              ObjectMapper objectMapper) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Index dimension must be positive: " + dimension);
        }
        this.indexType = indexType;
        this.dimension = dimension;
        this.parameters = parameters;
        this.objectMapper = objectMapper;
        this.index = indexType.create(dimension, parameters);
    }

    // ========== Write Operations ==========

    /**
     * Train the underlying index explicitly, then migrate any buffered inserts
     * into it. Indexes that need training are otherwise trained once
     * {@link #trainingSize()} vectors have been inserted.
     *
     * @throws IllegalStateException when the index already holds vectors; use
     *                               {@link #compact()} to rebuild it
     */
    public void train(List<float[]> sample) {
        float[][] vectors = validated(sample, "training vector");
        if (vectors.length == 0) {
            throw new IllegalArgumentException("Training sample is empty");
        }
        lock.writeLock().lock();
        try {
            if (index.size() > 0) {
                throw new IllegalStateException(indexType + " index already holds " + index.size()
                        + " vectors and cannot be retrained in place");
            }
            index.train(vectors);
            flushPending();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Number of inserted vectors an index that needs training waits for
     * before training on them; 0 for indexes that need none.
     */
    public int trainingSize() {
        switch (indexType) {
            case IVF:
                return Math.max(1, parameters.getNlist()) * TRAINING_VECTORS_PER_CENTROID;
            case OPQ_HNSW:
                return (1 << parameters.getPqBits()) * TRAINING_VECTORS_PER_CENTROID;
            default:
                return 0;
        }
    }

    /**
     * Insert embeddings for alerts. Re-adding an alert id tombstones its older vector.
     *
     * @param meta per-alert metadata, may be {@code null}
     */
    public void add(List<float[]> embeddings, List<String> ids, List<Map<String, Object>> meta) {
        if (embeddings.size() != ids.size()) {
            throw new VectorShapeException("Alert id count for embedding batch", embeddings.size(), ids.size());
        }
        if (meta != null && meta.size() != ids.size()) {
            throw new VectorShapeException("Metadata count for embedding batch", ids.size(), meta.size());
        }
        if (embeddings.isEmpty()) {
            return;
        }
        float[][] vectors = validated(embeddings, "embedding");

        lock.writeLock().lock();
        try {
            int first = storedCount();
            insert(vectors);
            for (int i = 0; i < ids.size(); i++) {
                String id = ids.get(i);
                Integer previous = livePositions.put(id, first + i);
                if (previous != null) {
                    markDeleted(previous);
                }
                alertIds.add(id);
                Map<String, Object> entry = new LinkedHashMap<>();
                if (meta != null && meta.get(i) != null) {
                    entry.putAll(meta.get(i));
                }
                entry.put(DELETED_KEY, false);
                metadata.add(entry);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Tombstone the given alerts.
     *
     * @return number of live entries removed
     */
    public int remove(List<String> ids) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            for (String id : ids) {
                Integer position = livePositions.remove(id);
                if (position != null) {
                    markDeleted(position);
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rebuild the index from live entries only.
     *
     * @return number of tombstones dropped
     */
    public int compact() {
        lock.writeLock().lock();
        try {
            int dropped = tombstones.cardinality();
            if (dropped == 0) {
                return 0;
            }
            List<float[]> liveVectors = new ArrayList<>();
            List<String> liveIds = new ArrayList<>();
            List<Map<String, Object>> liveMeta = new ArrayList<>();
            for (int position = 0; position < alertIds.size(); position++) {
                if (!tombstones.get(position)) {
                    liveVectors.add(vectorAt(position));
                    liveIds.add(alertIds.get(position));
                    liveMeta.add(metadata.get(position));
                }
            }

            index = indexType.create(dimension, parameters);
            pending.clear();
            float[][] vectors = liveVectors.toArray(new float[0][]);
            if (vectors.length > 0) {
                insert(vectors);
            }

            alertIds.clear();
            metadata.clear();
            livePositions.clear();
            tombstones.clear();
            for (int i = 0; i < liveIds.size(); i++) {
                alertIds.add(liveIds.get(i));
                metadata.add(liveMeta.get(i));
                livePositions.put(liveIds.get(i), i);
            }
            log.info("Compacted {} index: dropped={}, live={}", indexType, dropped, liveIds.size());
            return dropped;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========== Read Operations ==========

    /**
     * Up to {@code k} live alerts with similarity at least {@code threshold}, best first.
     */
    public List<SearchResult> search(float[] query, int k, double threshold) {
        requireDimension(query, "query");
        long start = System.nanoTime();
        lock.readLock().lock();
        try {
            int stored = storedCount();
            if (k <= 0 || stored == 0) {
                return List.of();
            }
            int fetch = Math.min(stored, k + tombstones.cardinality());
            List<Neighbor> neighbours = pending.isEmpty() ? index.search(query, fetch) : searchPending(query, fetch);
            List<SearchResult> results = new ArrayList<>(Math.min(k, neighbours.size()));
            for (Neighbor neighbour : neighbours) {
                if (tombstones.get(neighbour.position())) {
                    continue;
                }
                double score = 1.0 / (1.0 + Math.max(0f, neighbour.distance()));
                if (score < threshold) {
                    continue;
                }
                results.add(new SearchResult(alertIds.get(neighbour.position()), score,
                        Map.copyOf(withoutNulls(metadata.get(neighbour.position())))));
                if (results.size() == k) {
                    break;
                }
            }
            return results;
        } finally {
            lock.readLock().unlock();
            recordLatency((System.nanoTime() - start) / 1_000_000.0);
        }
    }

    public List<List<SearchResult>> batchSearch(List<float[]> queries, int k, double threshold) {
        List<List<SearchResult>> out = new ArrayList<>(queries.size());
        for (float[] query : queries) {
            out.add(search(query, k, threshold));
        }
        return out;
    }

    public boolean contains(String alertId) {
        lock.readLock().lock();
        try {
            return livePositions.containsKey(alertId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public IndexStats stats() {
        lock.readLock().lock();
        try {
            double[] window;
            long queries;
            synchronized (latencies) {
                queries = queryCount;
                int n = (int) Math.min(queryCount, LATENCY_WINDOW);
                window = Arrays.copyOf(latencies, n);
            }
            Arrays.sort(window);
            double avg = window.length == 0 ? 0.0 : Arrays.stream(window).average().orElse(0.0);
            double p99 = window.length == 0 ? 0.0 : window[(int) Math.ceil(0.99 * window.length) - 1];
            int total = alertIds.size();
            int tombstoned = tombstones.cardinality();
            return IndexStats.builder()
                    .indexType(indexType)
                    .dimension(dimension)
                    .totalVectors(total)
                    .liveVectors(total - tombstoned)
                    .tombstonedVectors(tombstoned)
                    .memoryBytes(index.memoryBytes() + (long) pending.size() * dimension * Float.BYTES)
                    .avgQueryMs(avg)
                    .p99QueryMs(p99)
                    .queries(queries)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int dimension() {
        return dimension;
    }

    public IndexType indexType() {
        return indexType;
    }

    // ========== Persistence ==========

    /**
     * Write {@code base.index} and {@code base.meta}. Inserts wait until both
     * are written; concurrent saves run one at a time.
     */
    public void save(Path base) {
        Path indexFile = Path.of(base + INDEX_SUFFIX);
        Path metaFile = Path.of(base + META_SUFFIX);
        saveLock.lock();
        lock.readLock().lock();
        try {
            Path parent = indexFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path indexTmp = Path.of(indexFile + ".tmp");
            Path metaTmp = Path.of(metaFile + ".tmp");

            try (OutputStream raw = Files.newOutputStream(indexTmp);
                 DataOutputStream out = new DataOutputStream(new BufferedOutputStream(raw))) {
                out.writeInt(MAGIC);
                out.writeInt(FORMAT_VERSION);
                out.writeUTF(indexType.name());
                out.writeInt(dimension);
                out.writeInt(storedCount());
                out.writeInt(pending.size());
                for (float[] vector : pending) {
                    for (float v : vector) {
                        out.writeFloat(v);
                    }
                }
                index.write(out);
            }

            IndexSnapshotMetadata snapshot = IndexSnapshotMetadata.builder()
                    .formatVersion(FORMAT_VERSION)
                    .indexType(indexType)
                    .dimension(dimension)
                    .parameters(parameters)
                    .alertIds(new ArrayList<>(alertIds))
                    .metadata(new ArrayList<>(metadata))
                    .nextPosition(storedCount())
                    .savedAt(Instant.now())
                    .build();
            objectMapper.writeValue(metaTmp.toFile(), snapshot);

            move(indexTmp, indexFile);
            move(metaTmp, metaFile);
            log.info("Saved {} index snapshot: path={}, vectors={}", indexType, base, storedCount());
        } catch (IOException e) {
            throw new IndexPersistenceException("Failed to save index snapshot to " + base, e);
        } finally {
            lock.readLock().unlock();
            saveLock.unlock();
        }
    }

    /**
     * Replace the engine's content with the snapshot at {@code base}. Both
     * artifacts must exist and agree with each other.
     */
    public void load(Path base) {
        Path indexFile = Path.of(base + INDEX_SUFFIX);
        Path metaFile = Path.of(base + META_SUFFIX);
        if (!Files.exists(indexFile) || !Files.exists(metaFile)) {
            throw new IndexPersistenceException("Index snapshot incomplete at " + base
                    + ": index=" + Files.exists(indexFile) + ", meta=" + Files.exists(metaFile));
        }

        lock.writeLock().lock();
        try {
            IndexSnapshotMetadata snapshot = objectMapper.readValue(metaFile.toFile(), IndexSnapshotMetadata.class);
            if (snapshot.getIndexType() == null || snapshot.getParameters() == null) {
                throw new IndexPersistenceException("Index metadata at " + metaFile + " is missing type or parameters");
            }
            if (snapshot.getAlertIds().size() != snapshot.getMetadata().size()) {
                throw new IndexPersistenceException("Index metadata at " + metaFile + " has "
                        + snapshot.getAlertIds().size() + " ids but " + snapshot.getMetadata().size() + " entries");
            }

            VectorIndex loaded;
            List<float[]> loadedPending = new ArrayList<>();
            try (InputStream raw = Files.newInputStream(indexFile);
                 DataInputStream in = new DataInputStream(new BufferedInputStream(raw))) {
                if (in.readInt() != MAGIC) {
                    throw new IndexPersistenceException("Not an index snapshot: " + indexFile);
                }
                int version = in.readInt();
                if (version != FORMAT_VERSION) {
                    throw new IndexPersistenceException("Unsupported index format version " + version);
                }
                IndexType storedType = IndexType.valueOf(in.readUTF());
                int storedDimension = in.readInt();
                int storedCount = in.readInt();
                if (storedType != snapshot.getIndexType() || storedDimension != snapshot.getDimension()
                        || storedCount != snapshot.getAlertIds().size()) {
                    throw new IndexPersistenceException("Index structure and metadata disagree at " + base
                            + ": structure=" + storedType + "/" + storedDimension + "/" + storedCount
                            + ", metadata=" + snapshot.getIndexType() + "/" + snapshot.getDimension()
                            + "/" + snapshot.getAlertIds().size());
                }
                int buffered = in.readInt();
                if (buffered < 0 || buffered > storedCount) {
                    throw new IndexPersistenceException("Index snapshot at " + indexFile
                            + " claims " + buffered + " buffered vectors of " + storedCount);
                }
                for (int i = 0; i < buffered; i++) {
                    float[] vector = new float[storedDimension];
                    for (int d = 0; d < storedDimension; d++) {
                        vector[d] = in.readFloat();
                    }
                    loadedPending.add(vector);
                }
                loaded = storedType.create(storedDimension, snapshot.getParameters());
                loaded.read(in);
                if (loaded.size() + buffered != storedCount) {
                    throw new IndexPersistenceException("Index structure at " + indexFile + " holds "
                            + (loaded.size() + buffered) + " vectors but the header declares " + storedCount);
                }
            }

            indexType = snapshot.getIndexType();
            dimension = snapshot.getDimension();
            parameters = snapshot.getParameters();
            index = loaded;
            pending.clear();
            pending.addAll(loadedPending);
            alertIds.clear();
            metadata.clear();
            livePositions.clear();
            tombstones.clear();
            for (int position = 0; position < snapshot.getAlertIds().size(); position++) {
                String id = snapshot.getAlertIds().get(position);
                Map<String, Object> entry = new LinkedHashMap<>(snapshot.getMetadata().get(position));
                alertIds.add(id);
                metadata.add(entry);
                if (Boolean.TRUE.equals(entry.get(DELETED_KEY))) {
                    tombstones.set(position);
                } else {
                    livePositions.put(id, position);
                }
            }
            log.info("Loaded {} index snapshot: path={}, vectors={}, tombstones={}",
                    indexType, base, alertIds.size(), tombstones.cardinality());
        } catch (IOException | IllegalArgumentException e) {
            throw new IndexPersistenceException("Failed to load index snapshot from " + base, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public static boolean snapshotExists(Path base) {
        return Files.exists(Path.of(base + INDEX_SUFFIX)) && Files.exists(Path.of(base + META_SUFFIX));
    }

    // ========== Internals ==========

    private int storedCount() {
        return index.size() + pending.size();
    }

    private void insert(float[][] vectors) {
        if (!index.requiresTraining() || index.isTrained()) {
            index.add(vectors);
            return;
        }
        pending.addAll(Arrays.asList(vectors));
        if (pending.size() >= trainingSize()) {
            log.info("Training {} index on {} buffered vectors", indexType, pending.size());
            index.train(pending.toArray(new float[0][]));
            flushPending();
        }
    }

    private void flushPending() {
        if (!pending.isEmpty()) {
            index.add(pending.toArray(new float[0][]));
            pending.clear();
        }
    }

    private List<Neighbor> searchPending(float[] query, int k) {
        TopK top = new TopK(k);
        for (int position = 0; position < pending.size(); position++) {
            top.offer(position, VectorMath.squaredL2(query, pending.get(position)));
        }
        return top.toSortedList();
    }

    private float[] vectorAt(int position) {
        return pending.isEmpty() ? index.reconstruct(position) : pending.get(position);
    }

    private void markDeleted(int position) {
        tombstones.set(position);
        metadata.get(position).put(DELETED_KEY, true);
    }

    private float[][] validated(List<float[]> vectors, String what) {
        float[][] out = new float[vectors.size()][];
        for (int i = 0; i < out.length; i++) {
            float[] vector = vectors.get(i);
            requireDimension(vector, what + " #" + i);
            out[i] = vector;
        }
        return out;
    }

    private void requireDimension(float[] vector, String what) {
        if (vector == null) {
            throw new VectorShapeException("Dimension of " + what, dimension, 0);
        }
        if (vector.length != dimension) {
            throw new VectorShapeException("Dimension of " + what, dimension, vector.length);
        }
    }

    private void recordLatency(double millis) {
        synchronized (latencies) {
            latencies[(int) (queryCount % LATENCY_WINDOW)] = millis;
            queryCount++;
        }
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value != null) {
                out.put(key, value);
            }
        });
        return out;
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
