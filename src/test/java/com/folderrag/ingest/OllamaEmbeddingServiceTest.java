package com.folderrag.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.ConnectException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.folderrag.error.MalformedResponseException;
import com.folderrag.error.ServiceException;
import com.folderrag.error.TransportException;
import com.folderrag.transport.FakeModelServer;
import com.folderrag.transport.RetryPolicy;

class OllamaEmbeddingServiceTest {

    @Test
    void shouldSendModelAndPromptAndParseVector() {
        FakeModelServer server = new FakeModelServer().onJson("/api/embeddings", "{\"embedding\":[0.5,-1,2.25]}");

        float[] vector = new OllamaEmbeddingService(server.transport()).embed("hello \"world\"", "nomic-embed-text");

        assertArrayEquals(new float[] { 0.5f, -1f, 2.25f }, vector);
        JsonNode body = server.requests().get(0).body();
        assertEquals("nomic-embed-text", body.path("model").asText());
        assertEquals("hello \"world\"", body.path("prompt").asText());
    }

    @Test
    void shouldRejectResponseWithoutEmbeddingArray() {
        FakeModelServer server = new FakeModelServer().onJson("/api/embeddings", "{\"error\":\"nothing\"}");

        assertThrows(MalformedResponseException.class,
                () -> new OllamaEmbeddingService(server.transport()).embed("text", "m"));
    }

    @Test
    void shouldRejectEmptyOrNonNumericEmbedding() {
        FakeModelServer empty = new FakeModelServer().onJson("/api/embeddings", "{\"embedding\":[]}");
        FakeModelServer text = new FakeModelServer().onJson("/api/embeddings", "{\"embedding\":[0.1,\"x\"]}");

        assertThrows(MalformedResponseException.class, () -> new OllamaEmbeddingService(empty.transport()).embed("t", "m"));
        assertThrows(MalformedResponseException.class, () -> new OllamaEmbeddingService(text.transport()).embed("t", "m"));
    }

    @Test
    void shouldSurfaceNonSuccessStatusAsServiceException() {
        FakeModelServer server = new FakeModelServer()
                .on("/api/embeddings", body -> FakeModelServer.Reply.status(404, "{\"error\":\"model 'x' not found\"}"));

        ServiceException error = assertThrows(ServiceException.class,
                () -> new OllamaEmbeddingService(server.transport()).embed("t", "x"));
        assertEquals(404, error.statusCode());
    }

    @Test
    void shouldNotRetryByDefault() {
        FakeModelServer server = new FakeModelServer()
                .on("/api/embeddings", body -> FakeModelServer.Reply.fail(new ConnectException("refused")));

        assertThrows(TransportException.class, () -> new OllamaEmbeddingService(server.transport()).embed("t", "m"));
        assertEquals(1, server.requestCount("/api/embeddings"));
    }

    @Test
    void shouldRetryTransientFailuresWithPolicy() {
        AtomicInteger attempts = new AtomicInteger();
        FakeModelServer server = new FakeModelServer().on("/api/embeddings", body -> attempts.incrementAndGet() == 1
                ? FakeModelServer.Reply.fail(new ConnectException("refused"))
                : FakeModelServer.Reply.ok("{\"embedding\":[1,0]}"));
        RetryPolicy retry = new RetryPolicy(3, 10, 2.0, 100, true, millis -> {
        });

        float[] vector = new OllamaEmbeddingService(server.transport(), retry).embed("t", "m");

        assertArrayEquals(new float[] { 1f, 0f }, vector);
        assertEquals(2, server.requestCount("/api/embeddings"));
    }
}
