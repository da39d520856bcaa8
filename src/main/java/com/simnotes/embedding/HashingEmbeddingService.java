package com.simnotes.embedding;

import java.util.Locale;

public class HashingEmbeddingService implements EmbeddingService {
    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String[] tokens = text.toLowerCase(Locale.ROOT).split("\\W+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            if (token.length() >= 4) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
        }

        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "hashing-" + dimension;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    private static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
