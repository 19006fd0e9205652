package com.folderrag.ingest;

import java.util.List;

public interface VectorIndex {
    void append(DocumentChunk chunk);

    void clear();

    int size();

    /**
     * Returns at most {@code topK} chunks ordered by descending similarity to {@code queryEmbedding};
     * equal scores keep insertion order.
     */
    List<SearchResult> search(float[] queryEmbedding, int topK);

    default boolean isEmpty() {
        return size() == 0;
    }
}
