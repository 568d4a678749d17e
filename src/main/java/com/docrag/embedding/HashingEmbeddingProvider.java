package com.docrag.embedding;

import java.util.Locale;

/**
 * Deterministic offline embeddings built from hashed tokens and character trigrams. Useful for
 * local runs without a model server; similarity is lexical rather than semantic.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {
    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String model, String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            for (int i = 0; i + 3 <= token.length(); i++) {
                addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
            }
        }

        float norm = 0f;
        for (float v : vector) {
            norm += v * v;
        }
        norm = (float) Math.sqrt(norm);
        if (norm > 0f) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    public int dimension() {
        return dimension;
    }

    private void addHashed(float[] vector, String key, float weight) {
        vector[Math.floorMod(key.hashCode(), vector.length)] += weight;
    }
}
