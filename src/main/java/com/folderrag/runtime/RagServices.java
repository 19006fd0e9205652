package com.folderrag.runtime;

import java.nio.file.Path;
import java.util.function.Function;

import com.folderrag.error.InvalidConfigurationException;
import com.folderrag.inference.OllamaGenerationService;
import com.folderrag.inference.QueryService;
import com.folderrag.inference.RagAnswer;
import com.folderrag.ingest.Chunker;
import com.folderrag.ingest.EmbeddingService;
import com.folderrag.ingest.HashingEmbeddingService;
import com.folderrag.ingest.InMemoryVectorIndex;
import com.folderrag.ingest.IndexingReport;
import com.folderrag.ingest.IndexingService;
import com.folderrag.ingest.OllamaEmbeddingService;
import com.folderrag.ingest.PlainTextDocumentReader;
import com.folderrag.ingest.ProgressSink;
import com.folderrag.ingest.VectorIndex;
import com.folderrag.transport.JsonTransport;
import com.folderrag.transport.OkHttpJsonTransport;
import com.folderrag.transport.RetryPolicy;

import okhttp3.OkHttpClient;

/**
 * Owns one vector index and wires the indexing and query services around it. Every
 * operation takes the {@link SessionConfig} it should run with, so nothing depends on
 * an earlier configuration call.
 */
public class RagServices {
    static final int OFFLINE_EMBEDDING_DIMENSION = 384;

    private final AppConfig config;
    private final VectorIndex index;
    private final Function<SessionConfig, JsonTransport> transportFactory;
    private final Function<JsonTransport, EmbeddingService> embeddingFactory;

    RagServices(AppConfig config,
            VectorIndex index,
            Function<SessionConfig, JsonTransport> transportFactory,
            Function<JsonTransport, EmbeddingService> embeddingFactory) {
        this.config = config;
        this.index = index;
        this.transportFactory = transportFactory;
        this.embeddingFactory = embeddingFactory;
    }

    public static RagServices create(AppConfig config, OkHttpClient httpClient, boolean offlineEmbeddings) {
        RetryPolicy retryPolicy = RetryPolicy.fromConfig(config.getRetry());
        Function<JsonTransport, EmbeddingService> embeddings = offlineEmbeddings
                ? transport -> new HashingEmbeddingService(OFFLINE_EMBEDDING_DIMENSION)
                : transport -> new OllamaEmbeddingService(transport, retryPolicy);
        return new RagServices(
                config,
                new InMemoryVectorIndex(config.getRetrieval().getDimensionMismatch()),
                session -> new OkHttpJsonTransport(httpClient, session.baseUrl()),
                embeddings);
    }

    public boolean ping(SessionConfig session) {
        return transportFactory.apply(session).ping();
    }

    public IndexingReport index(SessionConfig session, ProgressSink progress, CancellationToken cancellation) {
        Path folder = session.documentsFolder();
        if (folder == null) {
            throw new InvalidConfigurationException("No documents folder configured");
        }
        Chunker chunker = new Chunker(session.chunkSizeWords(), session.overlapWords());
        IndexingService indexingService = new IndexingService(
                index,
                embeddingFactory.apply(transportFactory.apply(session)),
                new PlainTextDocumentReader(config.getIndexing().getExtensions()),
                chunker,
                config.getIndexing().getEmbeddingConcurrency());
        return indexingService.index(folder, session.embeddingModel(), progress, cancellation);
    }

    public RagAnswer ask(SessionConfig session, String question, CancellationToken cancellation) {
        JsonTransport transport = transportFactory.apply(session);
        QueryService queryService = new QueryService(
                index,
                embeddingFactory.apply(transport),
                new OllamaGenerationService(transport, RetryPolicy.fromConfig(config.getRetry())));
        return queryService.ask(question, session.generationModel(), session.embeddingModel(), session.topK(), cancellation);
    }

    public void clear() {
        index.clear();
    }

    public int size() {
        return index.size();
    }

    public VectorIndex index() {
        return index;
    }
}
