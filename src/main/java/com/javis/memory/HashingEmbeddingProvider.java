package com.javis.memory;

import com.javis.shared.text.TextAnalyzer;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Deterministic offline embedder: signed feature hashing of analyzed unigrams
 * and bigrams into a fixed number of buckets, L2-normalized. Texts sharing
 * stemmed terms get a positive cosine; it carries no semantics beyond that.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;
    private final TextAnalyzer analyzer;

    public HashingEmbeddingProvider(int dimension) {
        this(dimension, new TextAnalyzer());
    }

    public HashingEmbeddingProvider(int dimension, TextAnalyzer analyzer) {
        if (dimension < 1) throw new IllegalArgumentException("dimension must be >= 1");
        this.dimension = dimension;
        this.analyzer = analyzer;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public float[] embed(String text) {
        var vec = new float[dimension];
        var tokens = analyzer.tokens(text);
        for (int i = 0; i < tokens.size(); i++) {
            add(vec, tokens.get(i), 1.0f);
            if (i > 0) add(vec, tokens.get(i - 1) + "_" + tokens.get(i), 0.5f);
        }
        VectorMath.normalize(vec);
        return vec;
    }

    private void add(float[] vec, String feature, float weight) {
        var crc = new CRC32();
        crc.update(feature.getBytes(StandardCharsets.UTF_8));
        long h = crc.getValue();
        int bucket = (int) (h % dimension);
        vec[bucket] += ((h >>> 31) & 1L) == 0 ? weight : -weight;
    }
}
