package com.simnotes.store;

import java.util.List;

public interface VectorStore {
    /**
     * Creates the collection when it does not exist yet. Safe to call on every start.
     *
     * @return true if this call created the collection, false if it already existed
     */
    boolean ensureCollection(String collection, int dimension, Distance distance);

    /**
     * Identifies the backing store, so index bookkeeping can tell one store's collections from another's.
     */
    String location();

    void upsert(String collection, Point point);

    /**
     * Removes the point if present. A missing point is not an error.
     */
    void delete(String collection, PointId id);

    List<ScoredPoint> search(String collection, float[] vector, int limit, double scoreThreshold);
}
