package com.folderrag.ingest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.folderrag.error.InvalidConfigurationException;

/**
 * Brute-force cosine search over an append-only list of chunks. Lives only as long as
 * the process; nothing is persisted.
 */
public class InMemoryVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);
    static final double EPSILON = 1e-10;

    private final List<DocumentChunk> chunks = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean mismatchReported = new AtomicBoolean();
    private final DimensionMismatchPolicy mismatchPolicy;

    public InMemoryVectorIndex() {
        this(DimensionMismatchPolicy.TRUNCATE);
    }

    public InMemoryVectorIndex(DimensionMismatchPolicy mismatchPolicy) {
        this.mismatchPolicy = mismatchPolicy;
    }

    @Override
    public void append(DocumentChunk chunk) {
        lock.writeLock().lock();
        try {
            if (!chunks.isEmpty()) {
                checkDimension(chunks.get(0).dimension(), chunk.dimension(), "append");
            }
            chunks.add(chunk);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            chunks.clear();
            mismatchReported.set(false);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return chunks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SearchResult> search(float[] queryEmbedding, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            List<SearchResult> scored = new ArrayList<>(chunks.size());
            for (DocumentChunk chunk : chunks) {
                checkDimension(queryEmbedding.length, chunk.dimension(), "search");
                scored.add(new SearchResult(chunk, (float) chunk.similarityTo(queryEmbedding)));
            }
            // List.sort is stable, so ties stay in insertion order.
            scored.sort(Comparator.comparingDouble(SearchResult::score).reversed());
            return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
        } finally {
            lock.readLock().unlock();
        }
    }

    public DimensionMismatchPolicy mismatchPolicy() {
        return mismatchPolicy;
    }

    /**
     * Cosine similarity over the common prefix of both vectors, with a small epsilon in the
     * denominator so an all-zero vector scores 0 instead of NaN.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length == 0 || b.length == 0) {
            return 0.0;
        }
        int len = Math.min(a.length, b.length);
        double dot = 0.0;
        double aNorm = 0.0;
        double bNorm = 0.0;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        return dot / (Math.sqrt(aNorm) * Math.sqrt(bNorm) + EPSILON);
    }

    private void checkDimension(int expected, int actual, String operation) {
        if (expected == actual) {
            return;
        }
        if (mismatchPolicy == DimensionMismatchPolicy.REJECT) {
            throw new InvalidConfigurationException("Embedding dimension mismatch during " + operation
                    + ": expected " + expected + " but got " + actual
                    + "; re-index after changing the embedding model");
        }
        if (mismatchReported.compareAndSet(false, true)) {
            log.warn("index.dimension-mismatch operation={} expected={} actual={} comparing over shorter length",
                    operation, expected, actual);
        }
    }
}
