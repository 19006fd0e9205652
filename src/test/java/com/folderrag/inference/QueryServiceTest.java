package com.folderrag.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.folderrag.error.InvalidConfigurationException;
import com.folderrag.error.OperationCancelledException;
import com.folderrag.ingest.DocumentChunk;
import com.folderrag.ingest.HashingEmbeddingService;
import com.folderrag.ingest.InMemoryVectorIndex;
import com.folderrag.ingest.OllamaEmbeddingService;
import com.folderrag.runtime.CancellationToken;
import com.folderrag.transport.FakeModelServer;
import com.folderrag.transport.JsonTransport;

class QueryServiceTest {

    private final HashingEmbeddingService hashing = new HashingEmbeddingService(64);

    private DocumentChunk chunk(String text, String source) {
        return new DocumentChunk(hashing.embed(text, "m"), text, source);
    }

    @Test
    void shouldAdviseIndexingWithoutAnyNetworkCall() {
        FakeModelServer server = new FakeModelServer().withHashedEmbeddings(64).onJson("/api/generate", "{\"response\":\"x\"}");
        JsonTransport transport = server.transport();
        QueryService service = new QueryService(new InMemoryVectorIndex(),
                new OllamaEmbeddingService(transport), new OllamaGenerationService(transport));

        String answer = service.answer("What is in my documents?", "llama3.2", "nomic-embed-text");

        assertEquals(QueryService.NO_DOCUMENTS_MESSAGE, answer);
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void shouldEmbedRetrieveAndGenerateFromTopSources() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.append(chunk("the cat sat on the mat", "cats.txt"));
        index.append(chunk("quarterly revenue grew strongly", "finance.md"));
        index.append(chunk("dogs chase the cat around", "dogs.txt"));
        AtomicReference<String> prompt = new AtomicReference<>();
        FakeModelServer server = new FakeModelServer().withHashedEmbeddings(64).on("/api/generate", body -> {
            prompt.set(body.path("prompt").asText());
            return FakeModelServer.Reply.ok("{\"response\":\"The cat sat on the mat.\"}");
        });
        JsonTransport transport = server.transport();
        QueryService service = new QueryService(index,
                new OllamaEmbeddingService(transport), new OllamaGenerationService(transport));

        RagAnswer answer = service.ask("where did the cat sit", "llama3.2", "nomic-embed-text", 2, CancellationToken.none());

        assertEquals("The cat sat on the mat.", answer.text());
        assertEquals(2, answer.sources().size());
        assertEquals("cats.txt", answer.sources().get(0).chunk().source());
        assertEquals(1, server.requestCount("/api/embeddings"));
        assertEquals(1, server.requestCount("/api/generate"));
        assertEquals("nomic-embed-text", server.requests().get(0).body().path("model").asText());
        assertEquals("llama3.2", server.requests().get(1).body().path("model").asText());
        assertTrue(prompt.get().contains("[Source: cats.txt]\nthe cat sat on the mat"));
        assertTrue(prompt.get().indexOf("[Source: cats.txt]") < prompt.get().indexOf("[Source: " + answer.sources().get(1).chunk().source() + "]"));
        assertFalse(prompt.get().contains("finance.md"));
        assertTrue(prompt.get().endsWith("Question: where did the cat sit\n\nAnswer:"));
    }

    @Test
    void shouldPassGeneratedTextThroughVerbatim() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.append(chunk("alpha", "a.txt"));
        GenerationService generation = (model, prompt, cancellation) -> "  spaced\nanswer  ";
        QueryService service = new QueryService(index, hashing, generation);

        assertEquals("  spaced\nanswer  ", service.answer("alpha?", "m", "e"));
    }

    @Test
    void shouldRejectNonPositiveTopK() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.append(chunk("alpha", "a.txt"));
        QueryService service = new QueryService(index, hashing, (model, prompt, cancellation) -> "x");

        assertThrows(InvalidConfigurationException.class, () -> service.answer("q", "m", "e", 0));
    }

    @Test
    void shouldAdviseIndexingOnEmptyIndexWhateverTheTopK() {
        List<String> calls = new ArrayList<>();
        QueryService service = new QueryService(new InMemoryVectorIndex(),
                (text, model, token) -> {
                    calls.add("embed");
                    return hashing.embed(text, model);
                },
                (model, prompt, token) -> {
                    calls.add("generate");
                    return "x";
                });

        assertEquals(QueryService.NO_DOCUMENTS_MESSAGE, service.answer("q", "m", "e", 0));
        assertTrue(calls.isEmpty());
    }

    @Test
    void shouldNotCallGenerationOnceCancelled() {
        InMemoryVectorIndex index = new InMemoryVectorIndex();
        index.append(chunk("alpha", "a.txt"));
        CancellationToken cancellation = new CancellationToken();
        List<String> generated = new ArrayList<>();
        QueryService service = new QueryService(index,
                (text, model, token) -> {
                    cancellation.cancel();
                    return hashing.embed(text, model);
                },
                (model, prompt, token) -> {
                    generated.add(prompt);
                    return "x";
                });

        assertThrows(OperationCancelledException.class, () -> service.ask("alpha", "m", "e", 3, cancellation));
        assertTrue(generated.isEmpty());
    }
}
