package com.simnotes.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * In-process vector store persisted as a single JSON file. Scores are computed locally, so only
 * {@link Distance#COSINE} and {@link Distance#DOT} collections are supported.
 */
public class LocalJsonVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorStore.class);
    private static final AtomicInteger IN_MEMORY_STORES = new AtomicInteger();

    private final Map<String, StoredCollection> collections = new HashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path file;
    private final int memoryId = IN_MEMORY_STORES.incrementAndGet();

    public LocalJsonVectorStore() {
        this.file = null;
    }

    private LocalJsonVectorStore(Path file) {
        this.file = file;
    }

    public static LocalJsonVectorStore open(Path file) throws IOException {
        LocalJsonVectorStore store = new LocalJsonVectorStore(file);
        if (!Files.exists(file) || Files.size(file) == 0L) {
            return store;
        }
        Map<String, StoredCollection> loaded = store.objectMapper.readValue(file.toFile(),
                new TypeReference<Map<String, StoredCollection>>() {
                });
        loaded.forEach((name, collection) -> store.collections.put(name,
                new StoredCollection(collection.dimension(), collection.distance(), new LinkedHashMap<>(collection.points()))));
        log.debug("Loaded {} collections from {}", loaded.size(), file);
        return store;
    }

    @Override
    public synchronized boolean ensureCollection(String collection, int dimension, Distance distance) {
        if (distance == Distance.EUCLID) {
            throw new StoreInitException("Local vector store supports only Cosine and Dot collections");
        }
        StoredCollection existing = collections.get(collection);
        if (existing != null) {
            if (existing.dimension() != dimension) {
                log.warn("Collection {} has vector size {} but embeddings are configured for {}; upserts will be rejected",
                        collection, existing.dimension(), dimension);
            }
            return false;
        }
        collections.put(collection, new StoredCollection(dimension, distance, new LinkedHashMap<>()));
        try {
            persist();
        } catch (IOException e) {
            collections.remove(collection);
            throw new StoreInitException("Failed to create collection " + collection + ": " + e.getMessage(), e);
        }
        log.info("Created local collection: {} size={} distance={}", collection, dimension, distance.wireName());
        return true;
    }

    @Override
    public String location() {
        return file == null ? "memory:" + memoryId : file.toAbsolutePath().normalize().toString();
    }

    @Override
    public synchronized void upsert(String collection, Point point) {
        StoredCollection target = collections.get(collection);
        if (target == null) {
            throw new StoreWriteException("Collection " + collection + " not found");
        }
        if (point.vector().length != target.dimension()) {
            throw new StoreWriteException("Wrong vector dimension for %s: expected %d, got %d"
                    .formatted(point.id(), target.dimension(), point.vector().length));
        }
        StoredPoint previous = target.points().put(point.id().value(),
                new StoredPoint(point.id().value(), point.vector().clone(), point.payload()));
        try {
            persist();
        } catch (IOException e) {
            restore(target, point.id().value(), previous);
            throw new StoreWriteException("Failed to store embedding " + point.id() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void delete(String collection, PointId id) {
        StoredCollection target = collections.get(collection);
        if (target == null) {
            return;
        }
        StoredPoint previous = target.points().remove(id.value());
        if (previous == null) {
            return;
        }
        try {
            persist();
        } catch (IOException e) {
            target.points().put(id.value(), previous);
            throw new StoreWriteException("Failed to delete embedding " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized List<ScoredPoint> search(String collection, float[] vector, int limit, double scoreThreshold) {
        StoredCollection target = collections.get(collection);
        if (target == null) {
            throw new StoreQueryException("Collection " + collection + " not found");
        }
        if (vector.length != target.dimension()) {
            throw new StoreQueryException("Wrong query vector dimension: expected %d, got %d"
                    .formatted(target.dimension(), vector.length));
        }
        float threshold = (float) scoreThreshold;
        return target.points().values().stream()
                .map(stored -> new ScoredPoint(PointId.of(stored.id()), score(target.distance(), vector, stored.vector()), stored.payload()))
                .filter(scored -> scored.score() >= threshold)
                .sorted(Comparator.comparing(ScoredPoint::score).reversed())
                .limit(limit)
                .toList();
    }

    public synchronized int size(String collection) {
        StoredCollection target = collections.get(collection);
        return target == null ? 0 : target.points().size();
    }

    private void restore(StoredCollection target, String id, StoredPoint previous) {
        if (previous == null) {
            target.points().remove(id);
        } else {
            target.points().put(id, previous);
        }
    }

    private void persist() throws IOException {
        if (file == null) {
            return;
        }
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), collections);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static float score(Distance distance, float[] a, float[] b) {
        return distance == Distance.DOT ? dot(a, b) : cosine(a, b);
    }

    private static float dot(float[] a, float[] b) {
        float dot = 0f;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            dot += a[i] * b[i];
        }
        return dot;
    }

    private static float cosine(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    public record StoredCollection(int dimension, Distance distance, Map<String, StoredPoint> points) {
    }

    public record StoredPoint(String id, float[] vector, Map<String, Object> payload) {
    }
}
