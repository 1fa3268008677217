package com.javis.memory;

import java.time.Instant;
import java.util.Map;

/**
 * An immutable (text, embedding, metadata) entry. The vector is copied on the
 * way in and on the way out.
 */
public record MemoryRecord(String id, String text, float[] vector,
                           Map<String, Object> metadata, Instant createdAt) {

    public MemoryRecord {
        vector = vector.clone();
        metadata = Map.copyOf(metadata);
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    float[] vectorView() {
        return vector;
    }
}
