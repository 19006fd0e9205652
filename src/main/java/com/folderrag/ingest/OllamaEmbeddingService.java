package com.folderrag.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.folderrag.error.MalformedResponseException;
import com.folderrag.runtime.CancellationToken;
import com.folderrag.transport.JsonTransport;
import com.folderrag.transport.RetryPolicy;

/**
 * One {@code POST /api/embeddings} per call; no batching.
 */
public class OllamaEmbeddingService implements EmbeddingService {
    static final String EMBEDDINGS_PATH = "/api/embeddings";

    private final JsonTransport transport;
    private final RetryPolicy retryPolicy;

    public OllamaEmbeddingService(JsonTransport transport) {
        this(transport, RetryPolicy.none());
    }

    public OllamaEmbeddingService(JsonTransport transport, RetryPolicy retryPolicy) {
        this.transport = transport;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public float[] embed(String text, String model, CancellationToken cancellation) {
        EmbeddingRequest payload = new EmbeddingRequest(model, text);
        JsonNode root = retryPolicy.execute("embed", cancellation,
                () -> transport.postJson(EMBEDDINGS_PATH, payload));
        return parseEmbedding(root);
    }

    static float[] parseEmbedding(JsonNode root) {
        JsonNode vectorNode = root.path("embedding");
        if (!vectorNode.isArray()) {
            throw new MalformedResponseException("Embedding response has no 'embedding' array");
        }
        if (vectorNode.isEmpty()) {
            throw new MalformedResponseException("Embedding response carries an empty 'embedding' array");
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            JsonNode value = vectorNode.get(i);
            if (!value.isNumber()) {
                throw new MalformedResponseException("Embedding element " + i + " is not a number: " + value);
            }
            out[i] = (float) value.asDouble();
        }
        return out;
    }

    record EmbeddingRequest(String model, String prompt) {
    }
}
