package com.folderrag.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.folderrag.error.MalformedResponseException;
import com.folderrag.runtime.CancellationToken;
import com.folderrag.transport.JsonTransport;
import com.folderrag.transport.RetryPolicy;

/**
 * Single non-streaming {@code POST /api/generate}.
 */
public class OllamaGenerationService implements GenerationService {
    static final String GENERATE_PATH = "/api/generate";
    public static final String NO_RESPONSE_MESSAGE = "No response received.";

    private final JsonTransport transport;
    private final RetryPolicy retryPolicy;

    public OllamaGenerationService(JsonTransport transport) {
        this(transport, RetryPolicy.none());
    }

    public OllamaGenerationService(JsonTransport transport, RetryPolicy retryPolicy) {
        this.transport = transport;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String generate(String model, String prompt, CancellationToken cancellation) {
        GenerateRequest payload = new GenerateRequest(model, prompt, false);
        JsonNode root = retryPolicy.execute("generate", cancellation,
                () -> transport.postJson(GENERATE_PATH, payload));
        return parseResponse(root);
    }

    static String parseResponse(JsonNode root) {
        JsonNode response = root.path("response");
        if (response.isMissingNode() || response.isNull()) {
            return NO_RESPONSE_MESSAGE;
        }
        if (!response.isTextual()) {
            throw new MalformedResponseException("Generation response field 'response' is not a string: " + response.getNodeType());
        }
        return response.asText();
    }

    record GenerateRequest(String model, String prompt, boolean stream) {
    }
}
