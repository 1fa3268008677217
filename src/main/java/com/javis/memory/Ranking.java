package com.javis.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Ordering shared by the store implementations. */
final class Ranking {

    /** {@code sequence} breaks ties between records created in the same instant. */
    record Candidate(MemoryRecord record, double score, long sequence) {}

    static final Comparator<Candidate> ORDER = Comparator
            .comparingDouble(Candidate::score).reversed()
            .thenComparing((Candidate c) -> c.record().createdAt(), Comparator.reverseOrder())
            .thenComparing(Candidate::sequence, Comparator.reverseOrder());

    private Ranking() {}

    static List<MemoryResult> topK(List<Candidate> candidates, int k) {
        var sorted = new ArrayList<>(candidates);
        sorted.sort(ORDER);
        var out = new ArrayList<MemoryResult>(Math.min(k, sorted.size()));
        for (int i = 0; i < sorted.size() && i < k; i++) {
            var c = sorted.get(i);
            out.add(new MemoryResult(c.record(), c.score()));
        }
        return out;
    }

    static void checkK(int k) {
        if (k < 0) throw new IllegalArgumentException("k must be >= 0, got " + k);
    }

    static void checkDimension(float[] vector, EmbeddingProvider provider) {
        if (vector == null || vector.length != provider.dimension()) {
            throw new IllegalStateException("Embedding provider returned "
                    + (vector == null ? "no vector" : vector.length + " components")
                    + ", expected " + provider.dimension());
        }
    }
}
