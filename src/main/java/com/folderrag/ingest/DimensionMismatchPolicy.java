package com.folderrag.ingest;

/**
 * What the index does when two embeddings being compared have different lengths,
 * typically because the embedding model changed without re-indexing.
 */
public enum DimensionMismatchPolicy {
    /** Compare over the shorter length and log a warning. */
    TRUNCATE,
    /** Fail with {@link com.folderrag.error.InvalidConfigurationException}. */
    REJECT
}
