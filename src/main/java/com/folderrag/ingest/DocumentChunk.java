package com.folderrag.ingest;

import java.util.Arrays;
import java.util.Objects;

/**
 * One indexed span of document text with its embedding and the name of the file it came from.
 */
public record DocumentChunk(float[] embedding, String text, String source) {
    public DocumentChunk {
        if (embedding == null) {
            throw new IllegalArgumentException("embedding must not be null");
        }
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        embedding = embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }

    double similarityTo(float[] queryEmbedding) {
        return InMemoryVectorIndex.cosineSimilarity(queryEmbedding, embedding);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DocumentChunk chunk)) {
            return false;
        }
        return Arrays.equals(embedding, chunk.embedding) && text.equals(chunk.text) && source.equals(chunk.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(embedding), text, source);
    }

    @Override
    public String toString() {
        return "DocumentChunk[source=" + source + ", dimension=" + embedding.length + ", text=" + text + "]";
    }
}
