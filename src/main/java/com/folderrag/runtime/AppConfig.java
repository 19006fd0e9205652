package com.folderrag.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.folderrag.ingest.DimensionMismatchPolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ServiceConfig service = new ServiceConfig();
    private IndexingConfig indexing = new IndexingConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private RetryConfig retry = new RetryConfig();

    public ServiceConfig getService() {
        return service;
    }

    public void setService(ServiceConfig service) {
        this.service = service == null ? new ServiceConfig() : service;
    }

    public IndexingConfig getIndexing() {
        return indexing;
    }

    public void setIndexing(IndexingConfig indexing) {
        this.indexing = indexing == null ? new IndexingConfig() : indexing;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry == null ? new RetryConfig() : retry;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServiceConfig {
        private String baseUrl = SessionConfig.DEFAULT_BASE_URL;
        private String embeddingModel = SessionConfig.DEFAULT_EMBEDDING_MODEL;
        private String generationModel = SessionConfig.DEFAULT_GENERATION_MODEL;
        private long timeoutMs = 300_000;
        private long connectTimeoutMs = 10_000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getEmbeddingModel() {
            return embeddingModel;
        }

        public void setEmbeddingModel(String embeddingModel) {
            this.embeddingModel = embeddingModel;
        }

        public String getGenerationModel() {
            return generationModel;
        }

        public void setGenerationModel(String generationModel) {
            this.generationModel = generationModel;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexingConfig {
        private String documentsFolder;
        private int chunkSizeWords = 200;
        private int overlapWords = 20;
        private List<String> extensions = List.of(".txt", ".md", ".csv");
        private int embeddingConcurrency = 1;

        public String getDocumentsFolder() {
            return documentsFolder;
        }

        public void setDocumentsFolder(String documentsFolder) {
            this.documentsFolder = documentsFolder;
        }

        public int getChunkSizeWords() {
            return chunkSizeWords;
        }

        public void setChunkSizeWords(int chunkSizeWords) {
            this.chunkSizeWords = chunkSizeWords;
        }

        public int getOverlapWords() {
            return overlapWords;
        }

        public void setOverlapWords(int overlapWords) {
            this.overlapWords = overlapWords;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions == null || extensions.isEmpty() ? List.of(".txt", ".md", ".csv") : extensions;
        }

        public int getEmbeddingConcurrency() {
            return embeddingConcurrency;
        }

        public void setEmbeddingConcurrency(int embeddingConcurrency) {
            this.embeddingConcurrency = embeddingConcurrency;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int topK = 3;
        private DimensionMismatchPolicy dimensionMismatch = DimensionMismatchPolicy.TRUNCATE;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public DimensionMismatchPolicy getDimensionMismatch() {
            return dimensionMismatch;
        }

        public void setDimensionMismatch(DimensionMismatchPolicy dimensionMismatch) {
            this.dimensionMismatch = dimensionMismatch == null ? DimensionMismatchPolicy.TRUNCATE : dimensionMismatch;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private int maxAttempts = 1;
        private long initialBackoffMs = 500;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 10_000;
        private boolean retryServerErrors = true;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public boolean isRetryServerErrors() {
            return retryServerErrors;
        }

        public void setRetryServerErrors(boolean retryServerErrors) {
            this.retryServerErrors = retryServerErrors;
        }
    }
}
