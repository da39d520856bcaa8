package com.simnotes.store;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class QdrantVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStore.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int MAX_ERROR_BODY_CHARS = 300;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String apiKey;

    public QdrantVectorStore(OkHttpClient httpClient, String host, String apiKey) {
        HttpUrl parsed = HttpUrl.parse(host);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid vector store host: " + host);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.baseUrl = parsed;
        this.apiKey = apiKey;
    }

    @Override
    public boolean ensureCollection(String collection, int dimension, Distance distance) {
        HttpUrl url = collectionUrl(collection).build();
        try (Response response = httpClient.newCall(request(url).get().build()).execute()) {
            if (response.isSuccessful()) {
                warnOnDimensionMismatch(collection, dimension, response.body());
                log.debug("Collection {} already exists", collection);
                return false;
            }
            if (response.code() != 404) {
                throw new StoreInitException("Unexpected response checking collection %s: %s"
                        .formatted(collection, describe(response)));
            }
        } catch (IOException e) {
            throw new StoreInitException("Vector store unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }

        Map<String, Object> body = Map.of("vectors", Map.of("size", dimension, "distance", distance.wireName()));
        try (Response response = httpClient.newCall(request(url).put(json(body)).build()).execute()) {
            if (response.code() == 409) {
                log.info("Collection {} was created concurrently", collection);
                return false;
            }
            if (!response.isSuccessful()) {
                throw new StoreInitException("Failed to create collection %s: %s".formatted(collection, describe(response)));
            }
            log.info("Created Qdrant collection: {} size={} distance={}", collection, dimension, distance.wireName());
            return true;
        } catch (IOException e) {
            throw new StoreInitException("Failed to create collection " + collection + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void upsert(String collection, Point point) {
        Map<String, Object> wirePoint = new LinkedHashMap<>();
        wirePoint.put("id", point.id().value());
        wirePoint.put("payload", point.payload());
        wirePoint.put("vector", point.vector());
        HttpUrl url = collectionUrl(collection)
                .addPathSegment("points")
                .addQueryParameter("wait", "true")
                .build();
        try (Response response = httpClient.newCall(request(url).put(json(Map.of("points", List.of(wirePoint)))).build()).execute()) {
            if (!response.isSuccessful()) {
                throw new StoreWriteException("Failed to store embedding %s: %s".formatted(point.id(), describe(response)));
            }
        } catch (IOException e) {
            throw new StoreWriteException("Failed to store embedding " + point.id() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String collection, PointId id) {
        HttpUrl url = collectionUrl(collection)
                .addPathSegments("points/delete")
                .addQueryParameter("wait", "true")
                .build();
        try (Response response = httpClient.newCall(request(url).post(json(Map.of("points", List.of(id.value())))).build()).execute()) {
            if (response.code() == 404) {
                log.debug("Collection {} absent while deleting {}, nothing to delete", collection, id);
                return;
            }
            if (!response.isSuccessful()) {
                throw new StoreWriteException("Failed to delete embedding %s: %s".formatted(id, describe(response)));
            }
        } catch (IOException e) {
            throw new StoreWriteException("Failed to delete embedding " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ScoredPoint> search(String collection, float[] vector, int limit, double scoreThreshold) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vector", vector);
        body.put("limit", limit);
        body.put("with_payload", true);
        body.put("score_threshold", scoreThreshold);
        HttpUrl url = collectionUrl(collection).addPathSegments("points/search").build();
        try (Response response = httpClient.newCall(request(url).post(json(body)).build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new StoreQueryException("Failed to search similar notes: " + describe(response));
            }
            JsonNode result = mapper.readTree(responseBody.string()).path("result");
            if (!result.isArray()) {
                throw new StoreQueryException("Search response from " + url + " has no result array");
            }
            List<ScoredPoint> points = new ArrayList<>(result.size());
            for (JsonNode node : result) {
                Map<String, Object> payload = node.path("payload").isObject()
                        ? mapper.convertValue(node.path("payload"), new TypeReference<Map<String, Object>>() {
                        })
                        : Map.of();
                points.add(new ScoredPoint(PointId.of(node.path("id").asText()), (float) node.path("score").asDouble(), payload));
            }
            return points;
        } catch (IOException | IllegalArgumentException e) {
            throw new StoreQueryException("Failed to search similar notes: " + e.getMessage(), e);
        }
    }

    @Override
    public String location() {
        return baseUrl.toString();
    }

    private HttpUrl.Builder collectionUrl(String collection) {
        return baseUrl.newBuilder()
                .addPathSegment("collections")
                .addPathSegment(collection);
    }

    private Request.Builder request(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
        return builder;
    }

    private RequestBody json(Object body) throws IOException {
        return RequestBody.create(mapper.writeValueAsString(body), JSON);
    }

    private void warnOnDimensionMismatch(String collection, int dimension, ResponseBody body) throws IOException {
        if (body == null) {
            return;
        }
        JsonNode size = mapper.readTree(body.string()).path("result").path("config").path("params").path("vectors").path("size");
        if (size.isInt() && size.asInt() != dimension) {
            log.warn("Collection {} has vector size {} but embeddings are configured for {}; upserts will be rejected",
                    collection, size.asInt(), dimension);
        }
    }

    private static String describe(Response response) {
        String detail = "";
        try {
            ResponseBody body = response.body();
            if (body != null) {
                detail = body.string().strip();
            }
        } catch (IOException e) {
            detail = "<unreadable body: " + e.getMessage() + ">";
        }
        if (detail.length() > MAX_ERROR_BODY_CHARS) {
            detail = detail.substring(0, MAX_ERROR_BODY_CHARS) + "...";
        }
        return "HTTP %d %s %s".formatted(response.code(), response.message(), detail).strip();
    }

    @Override
    public String toString() {
        return "QdrantVectorStore{" +
                "baseUrl=" + baseUrl +
                ", apiKey=" + (apiKey == null || apiKey.isBlank() ? "none" : "****") +
                '}';
    }
}
