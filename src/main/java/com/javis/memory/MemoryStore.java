package com.javis.memory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic similarity index over text. Knows nothing about tasks.
 */
public interface MemoryStore extends AutoCloseable {

    /** Embeds and stores {@code text}; non-scalar metadata values are stored as strings. */
    String add(String text, Map<String, ?> metadata);

    /**
     * Top-{@code k} records by cosine similarity to {@code query}, most similar
     * first; equal scores put the more recent record first. Only records whose
     * metadata matches every {@code filter} entry are considered.
     */
    List<MemoryResult> search(String query, int k, Map<String, ?> filter);

    default List<MemoryResult> search(String query, int k) {
        return search(query, k, Map.of());
    }

    Optional<MemoryRecord> get(String id);

    /** @return true if a record was removed */
    boolean delete(String id);

    int size();

    @Override
    default void close() {}
}
