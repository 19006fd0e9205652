package com.folderrag.runtime;

import java.nio.file.Path;
import java.util.Map;

/**
 * Immutable snapshot of the settings one operation runs with. The caller owns it
 * and hands it to the core on every call.
 */
public record SessionConfig(
        String baseUrl,
        String embeddingModel,
        String generationModel,
        Path documentsFolder,
        int topK,
        int chunkSizeWords,
        int overlapWords) {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";
    public static final String DEFAULT_EMBEDDING_MODEL = "nomic-embed-text";
    public static final String DEFAULT_GENERATION_MODEL = "llama3.2";

    public SessionConfig {
        baseUrl = normalizeBaseUrl(baseUrl);
    }

    public static SessionConfig fromConfig(AppConfig config, Map<String, String> environment) {
        AppConfig.ServiceConfig service = config.getService();
        AppConfig.IndexingConfig indexing = config.getIndexing();
        String folder = indexing.getDocumentsFolder();
        return new SessionConfig(
                environment.getOrDefault("FOLDERRAG_BASE_URL", service.getBaseUrl()),
                environment.getOrDefault("FOLDERRAG_EMBEDDING_MODEL", service.getEmbeddingModel()),
                environment.getOrDefault("FOLDERRAG_GENERATION_MODEL", service.getGenerationModel()),
                folder == null || folder.isBlank() ? null : Path.of(folder),
                config.getRetrieval().getTopK(),
                indexing.getChunkSizeWords(),
                indexing.getOverlapWords());
    }

    public SessionConfig withDocumentsFolder(Path folder) {
        return new SessionConfig(baseUrl, embeddingModel, generationModel, folder, topK, chunkSizeWords, overlapWords);
    }

    static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return DEFAULT_BASE_URL;
        }
        String trimmed = baseUrl.strip();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
