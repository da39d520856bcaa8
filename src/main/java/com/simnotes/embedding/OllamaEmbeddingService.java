package com.simnotes.embedding;

import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OllamaEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingService.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl endpoint;
    private final String model;
    private final int dimension;

    public OllamaEmbeddingService(OkHttpClient httpClient, String host, String model, int dimension) {
        HttpUrl base = HttpUrl.parse(host);
        if (base == null) {
            throw new IllegalArgumentException("Invalid embedding host: " + host);
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Embedding model must not be blank");
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = base.newBuilder().addPathSegments("api/embeddings").build();
        this.model = model;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        Request request;
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "prompt", text == null ? "" : text));
            request = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON))
                    .build();
        } catch (IOException e) {
            throw new EmbeddingServiceException("Unable to encode embedding request", e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new EmbeddingServiceException("Failed to get embedding: HTTP %d %s from %s"
                        .formatted(response.code(), response.message(), endpoint));
            }
            JsonNode vectorNode = mapper.readTree(body.string()).path("embedding");
            if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                throw new EmbeddingServiceException("Embedding response from " + endpoint + " has no embedding array");
            }
            float[] out = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                out[i] = (float) vectorNode.get(i).asDouble();
            }
            log.debug("embedding.ok model={} dimension={} chars={}", model, out.length, text == null ? 0 : text.length());
            return out;
        } catch (IOException e) {
            throw new EmbeddingServiceException("Embedding service unreachable at " + endpoint + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "ollama-" + model;
    }

    @Override
    public String toString() {
        return "OllamaEmbeddingService{" +
                "endpoint=" + endpoint +
                ", model='" + model + '\'' +
                ", dimension=" + dimension +
                '}';
    }
}
