package com.javis.memory;

/**
 * Turns text into a fixed-length vector. Every vector returned by one provider
 * has exactly {@link #dimension()} components.
 */
public interface EmbeddingProvider {
    int dimension();
    float[] embed(String text);
}
