package com.simnotes.support;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simnotes.embedding.HashingEmbeddingService;

import okhttp3.HttpUrl;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

/**
 * Answers the subset of the Ollama and Qdrant HTTP APIs the clients use, backed by in-memory state.
 */
public class FakeVectorBackend extends Dispatcher {
    private final ObjectMapper mapper = new ObjectMapper();
    private final HashingEmbeddingService defaultEmbeddings;
    private final Map<String, float[]> embeddings = new ConcurrentHashMap<>();
    private final Set<String> failingTexts = ConcurrentHashMap.newKeySet();
    private final Map<String, Integer> forcedStatus = new ConcurrentHashMap<>();
    private final Map<String, FakeCollection> collections = new ConcurrentHashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final List<String> apiKeys = new CopyOnWriteArrayList<>();

    public FakeVectorBackend(int dimension) {
        this.defaultEmbeddings = new HashingEmbeddingService(dimension);
    }

    public FakeVectorBackend embedding(String text, float... vector) {
        embeddings.put(text, vector);
        return this;
    }

    public FakeVectorBackend failEmbeddingFor(String text) {
        failingTexts.add(text);
        return this;
    }

    public FakeVectorBackend respondWith(String methodAndPathPrefix, int status) {
        forcedStatus.put(methodAndPathPrefix, status);
        return this;
    }

    public void clearForcedResponses() {
        forcedStatus.clear();
    }

    public List<String> requests() {
        return List.copyOf(requests);
    }

    public long countRequests(String methodAndPath) {
        return requests.stream().filter(methodAndPath::equals).count();
    }

    public List<String> bodies() {
        return List.copyOf(bodies);
    }

    public List<String> apiKeys() {
        return List.copyOf(apiKeys);
    }

    public void dropCollection(String name) {
        collections.remove(name);
    }

    public boolean hasCollection(String name) {
        return collections.containsKey(name);
    }

    public int pointCount(String collection) {
        FakeCollection target = collections.get(collection);
        return target == null ? 0 : target.points.size();
    }

    public List<String> storedPaths(String collection) {
        FakeCollection target = collections.get(collection);
        if (target == null) {
            return List.of();
        }
        return target.points.values().stream()
                .map(point -> String.valueOf(point.payload().get("path")))
                .sorted()
                .toList();
    }

    @Override
    public MockResponse dispatch(RecordedRequest request) {
        HttpUrl url = request.getRequestUrl();
        String method = request.getMethod();
        String path = url == null ? "" : url.encodedPath();
        String body = request.getBody().readUtf8();
        requests.add(method + " " + path);
        bodies.add(body);
        String apiKey = request.getHeader("api-key");
        if (apiKey != null) {
            apiKeys.add(apiKey);
        }

        for (Map.Entry<String, Integer> forced : forcedStatus.entrySet()) {
            if ((method + " " + path).startsWith(forced.getKey())) {
                return json(forced.getValue(), "{\"status\":{\"error\":\"forced\"}}");
            }
        }

        try {
            if ("/api/embeddings".equals(path)) {
                return embed(body);
            }
            List<String> segments = url == null ? List.of() : url.pathSegments();
            if (segments.size() < 2 || !"collections".equals(segments.get(0))) {
                return json(404, "{\"status\":{\"error\":\"Not found\"}}");
            }
            String name = segments.get(1);
            String rest = String.join("/", segments.subList(2, segments.size()));
            return switch (method + " " + rest) {
                case "GET " -> getCollection(name);
                case "PUT " -> createCollection(name, body);
                case "PUT points" -> upsert(name, body);
                case "POST points/delete" -> delete(name, body);
                case "POST points/search" -> search(name, body);
                default -> json(404, "{\"status\":{\"error\":\"Not found\"}}");
            };
        } catch (IOException e) {
            return json(400, "{\"status\":{\"error\":\"bad json\"}}");
        }
    }

    private MockResponse embed(String body) throws IOException {
        String prompt = mapper.readTree(body).path("prompt").asText();
        if (failingTexts.contains(prompt)) {
            return json(500, "{\"error\":\"model crashed\"}");
        }
        float[] vector = embeddings.getOrDefault(prompt, defaultEmbeddings.embed(prompt));
        return json(200, mapper.writeValueAsString(Map.of("embedding", vector)));
    }

    private MockResponse getCollection(String name) throws IOException {
        FakeCollection collection = collections.get(name);
        if (collection == null) {
            return json(404, "{\"status\":{\"error\":\"Collection `" + name + "` doesn't exist!\"}}");
        }
        Map<String, Object> vectors = Map.of("size", collection.size, "distance", collection.distance);
        return json(200, mapper.writeValueAsString(Map.of(
                "result", Map.of("status", "green", "config", Map.of("params", Map.of("vectors", vectors))),
                "status", "ok")));
    }

    private MockResponse createCollection(String name, String body) throws IOException {
        if (collections.containsKey(name)) {
            return json(409, "{\"status\":{\"error\":\"Collection `" + name + "` already exists!\"}}");
        }
        JsonNode vectors = mapper.readTree(body).path("vectors");
        collections.put(name, new FakeCollection(vectors.path("size").asInt(), vectors.path("distance").asText()));
        return json(200, "{\"result\":true,\"status\":\"ok\"}");
    }

    private MockResponse upsert(String name, String body) throws IOException {
        FakeCollection collection = collections.get(name);
        if (collection == null) {
            return json(404, "{\"status\":{\"error\":\"Not found\"}}");
        }
        for (JsonNode point : mapper.readTree(body).path("points")) {
            float[] vector = mapper.convertValue(point.path("vector"), float[].class);
            if (vector.length != collection.size) {
                return json(400, "{\"status\":{\"error\":\"Wrong input: Vector dimension error\"}}");
            }
            Map<String, Object> payload = mapper.convertValue(point.path("payload"), new TypeReference<Map<String, Object>>() {
            });
            collection.points.put(point.path("id").asText(), new FakePoint(vector, payload));
        }
        return json(200, "{\"result\":{\"operation_id\":1,\"status\":\"completed\"},\"status\":\"ok\"}");
    }

    private MockResponse delete(String name, String body) throws IOException {
        FakeCollection collection = collections.get(name);
        if (collection == null) {
            return json(404, "{\"status\":{\"error\":\"Not found\"}}");
        }
        for (JsonNode id : mapper.readTree(body).path("points")) {
            collection.points.remove(id.asText());
        }
        return json(200, "{\"result\":{\"operation_id\":2,\"status\":\"completed\"},\"status\":\"ok\"}");
    }

    private MockResponse search(String name, String body) throws IOException {
        FakeCollection collection = collections.get(name);
        if (collection == null) {
            return json(404, "{\"status\":{\"error\":\"Not found\"}}");
        }
        JsonNode request = mapper.readTree(body);
        float[] query = mapper.convertValue(request.path("vector"), float[].class);
        int limit = request.path("limit").asInt(10);
        double threshold = request.path("score_threshold").asDouble(0.0);
        List<Map<String, Object>> result = new ArrayList<>();
        collection.points.entrySet().stream()
                .map(entry -> Map.entry(entry, cosine(query, entry.getValue().vector())))
                .filter(scored -> scored.getValue() >= threshold)
                .sorted(Map.Entry.<Map.Entry<String, FakePoint>, Float>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .forEach(scored -> {
                    Map<String, Object> hit = new LinkedHashMap<>();
                    hit.put("id", scored.getKey().getKey());
                    hit.put("version", 0);
                    hit.put("score", scored.getValue());
                    hit.put("payload", scored.getKey().getValue().payload());
                    result.add(hit);
                });
        return json(200, mapper.writeValueAsString(Map.of("result", result, "status", "ok", "time", 0.001)));
    }

    private static float cosine(float[] a, float[] b) {
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    private static final class FakeCollection {
        private final int size;
        private final String distance;
        private final Map<String, FakePoint> points = new ConcurrentHashMap<>();

        private FakeCollection(int size, String distance) {
            this.size = size;
            this.distance = distance;
        }
    }

    private record FakePoint(float[] vector, Map<String, Object> payload) {
    }
}
