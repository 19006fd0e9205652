package com.folderrag.ingest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import com.folderrag.error.InvalidConfigurationException;

/**
 * Splits text into windows of {@code chunkSizeWords} whitespace-separated words, each window
 * starting {@code chunkSizeWords - overlapWords} words after the previous one.
 */
public class Chunker {
    public static final int DEFAULT_CHUNK_SIZE_WORDS = 200;
    public static final int DEFAULT_OVERLAP_WORDS = 20;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int chunkSizeWords;
    private final int overlapWords;

    public Chunker() {
        this(DEFAULT_CHUNK_SIZE_WORDS, DEFAULT_OVERLAP_WORDS);
    }

    public Chunker(int chunkSizeWords, int overlapWords) {
        if (overlapWords < 0) {
            throw new InvalidConfigurationException("overlapWords must be >= 0 but was " + overlapWords);
        }
        if (chunkSizeWords <= overlapWords) {
            throw new InvalidConfigurationException("chunkSizeWords (" + chunkSizeWords
                    + ") must be greater than overlapWords (" + overlapWords + ")");
        }
        this.chunkSizeWords = chunkSizeWords;
        this.overlapWords = overlapWords;
    }

    public int chunkSizeWords() {
        return chunkSizeWords;
    }

    public int overlapWords() {
        return overlapWords;
    }

    public int stride() {
        return chunkSizeWords - overlapWords;
    }

    public List<String> chunk(String text) {
        String[] words = words(text);
        List<String> chunks = new ArrayList<>();
        // The tail keeps stepping until the start passes the last word, so a short final
        // window already covered by its predecessor is still emitted.
        for (int start = 0; start < words.length; start += stride()) {
            int endExclusive = Math.min(words.length, start + chunkSizeWords);
            chunks.add(String.join(" ", Arrays.copyOfRange(words, start, endExclusive)));
        }
        return chunks;
    }

    static String[] words(String text) {
        if (text == null) {
            return new String[0];
        }
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return new String[0];
        }
        return WHITESPACE.split(stripped);
    }
}
