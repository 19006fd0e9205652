package com.folderrag.ingest;

public record IndexingReport(int discoveredFiles, int indexedFiles, int chunks) {
}
