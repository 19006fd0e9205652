package com.folderrag.transport;

import java.io.IOException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.folderrag.error.MalformedResponseException;
import com.folderrag.error.ServiceException;
import com.folderrag.error.TransportException;
import com.folderrag.runtime.AppConfig;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OkHttpJsonTransport implements JsonTransport {
    private static final Logger log = LoggerFactory.getLogger(OkHttpJsonTransport.class);
    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    static final String STATUS_PATH = "/api/tags";
    private static final int MAX_ERROR_BODY_CHARS = 300;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public OkHttpJsonTransport(OkHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.mapper = JsonMapper.builder().build();
        this.baseUrl = baseUrl;
    }

    public static OkHttpClient httpClient(AppConfig.ServiceConfig serviceConfig) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(serviceConfig.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(serviceConfig.getTimeoutMs()))
                .callTimeout(Duration.ofMillis(serviceConfig.getTimeoutMs()))
                .build();
    }

    @Override
    public JsonNode postJson(String path, Object payload) {
        String url = baseUrl + path;
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize request for " + url, e);
        }

        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(json, JSON))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid service URL: " + url, e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new ServiceException(url, response.code(), abbreviate(text));
            }
            if (text.isBlank()) {
                throw new MalformedResponseException("Empty response body from " + url);
            }
            return readTree(url, text);
        } catch (IOException e) {
            throw new TransportException("Request to " + url + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean ping() {
        String url = baseUrl + STATUS_PATH;
        try {
            Request request = new Request.Builder().url(url).get().build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.debug("ping.failed url={} status={}", url, response.code());
                }
                return response.isSuccessful();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("ping.failed url={} reason={}", url, e.toString());
            return false;
        }
    }

    @Override
    public String baseUrl() {
        return baseUrl;
    }

    private JsonNode readTree(String url, String text) {
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response from " + url + " is not valid JSON", e);
        }
    }

    private static String abbreviate(String text) {
        String flat = text.strip().replaceAll("\\s+", " ");
        if (flat.length() <= MAX_ERROR_BODY_CHARS) {
            return flat;
        }
        return flat.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
