package com.folderrag.ingest;

public record SearchResult(DocumentChunk chunk, float score) {
}
