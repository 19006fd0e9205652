package com.folderrag.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request/response channel to the model server. Implementations raise
 * {@link com.folderrag.error.TransportException} when no response arrives,
 * {@link com.folderrag.error.ServiceException} on a non-2xx status and
 * {@link com.folderrag.error.MalformedResponseException} when the body is not JSON.
 */
public interface JsonTransport {
    JsonNode postJson(String path, Object payload);

    /**
     * Probes the status endpoint. Never throws.
     */
    boolean ping();

    String baseUrl();
}
