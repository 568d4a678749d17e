package com.docrag.embedding;

/**
 * Turns text into a fixed-dimension vector using the named model.
 */
public interface EmbeddingProvider {
    float[] embed(String model, String text) throws EmbeddingProviderException;
}
