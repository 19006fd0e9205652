package com.folderrag.ingest;

import java.util.Locale;

import com.folderrag.runtime.CancellationToken;

/**
 * Signed feature-hashing embedding for offline dry runs. Terms are the same
 * whitespace-separated words the {@link Chunker} windows over, with leading and trailing
 * punctuation trimmed, so a query term matches the word as it appears inside a chunk.
 * The model name is ignored.
 */
public class HashingEmbeddingService implements EmbeddingService {
    private static final int SIGN_MIX = 0x9E3779B9;

    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text, String model, CancellationToken cancellation) {
        cancellation.throwIfCancelled("embed");
        double[] counts = new double[dimension];
        for (String word : Chunker.words(text)) {
            String term = term(word);
            if (term.isEmpty()) {
                continue;
            }
            int hash = term.hashCode();
            // sign comes from the mixed hash, so colliding terms may cancel
            counts[Math.floorMod(hash, dimension)] += (hash * SIGN_MIX) < 0 ? -1.0 : 1.0;
        }
        return normalize(counts);
    }

    public int dimension() {
        return dimension;
    }

    static String term(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && !Character.isLetterOrDigit(word.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(word.charAt(end - 1))) {
            end--;
        }
        return word.substring(start, end).toLowerCase(Locale.ROOT);
    }

    private static float[] normalize(double[] counts) {
        double squares = 0.0;
        for (double count : counts) {
            squares += count * count;
        }
        float[] vector = new float[counts.length];
        if (squares == 0.0) {
            return vector;
        }
        double norm = Math.sqrt(squares);
        for (int i = 0; i < counts.length; i++) {
            vector[i] = (float) (counts[i] / norm);
        }
        return vector;
    }
}
