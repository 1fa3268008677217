package com.javis.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Brute-force cosine index held in memory. Records are immutable and published
 * under the write lock only after their vector has been computed, so readers
 * never see a half-built entry.
 */
public class InMemoryMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryStore.class);

    private final EmbeddingProvider embeddingProvider;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private long sequence;

    private record Entry(MemoryRecord record, long sequence) {}

    public InMemoryMemoryStore(EmbeddingProvider embeddingProvider) {
        this.embeddingProvider = embeddingProvider;
    }

    @Override
    public String add(String text, Map<String, ?> metadata) {
        var vector = embeddingProvider.embed(text);
        Ranking.checkDimension(vector, embeddingProvider);
        var record = new MemoryRecord(UUID.randomUUID().toString(), text, vector,
                MetadataValues.normalize(metadata), Instant.now());

        lock.writeLock().lock();
        try {
            entries.put(record.id(), new Entry(record, sequence++));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Stored memory {} ({} chars)", record.id(), text.length());
        return record.id();
    }

    @Override
    public List<MemoryResult> search(String query, int k, Map<String, ?> filter) {
        Ranking.checkK(k);
        if (k == 0) return List.of();

        List<Entry> snapshot;
        lock.readLock().lock();
        try {
            if (entries.isEmpty()) return List.of();
            snapshot = new ArrayList<>(entries.values());
        } finally {
            lock.readLock().unlock();
        }

        var queryVector = embeddingProvider.embed(query);
        Ranking.checkDimension(queryVector, embeddingProvider);

        var candidates = new ArrayList<Ranking.Candidate>();
        for (var entry : snapshot) {
            var record = entry.record();
            if (!MetadataValues.matches(record.metadata(), filter)) continue;
            var score = VectorMath.cosine(queryVector, record.vectorView());
            candidates.add(new Ranking.Candidate(record, score, entry.sequence()));
        }
        return Ranking.topK(candidates, k);
    }

    @Override
    public Optional<MemoryRecord> get(String id) {
        lock.readLock().lock();
        try {
            var entry = entries.get(id);
            return entry == null ? Optional.empty() : Optional.of(entry.record());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        lock.writeLock().lock();
        try {
            return entries.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
