package com.javis.shared.config;

/**
 * @param confidenceThreshold model confidence below which the pattern fallback is consulted
 * @param fallbackConfidence  confidence reported for a fallback match, always below the threshold
 * @param contextHits         memory hits handed to the classifier for slot filling
 * @param catalogPath         intent catalog file; null means the bundled catalog
 */
public record ClassifierConfig(
    double confidenceThreshold,
    double fallbackConfidence,
    int contextHits,
    String catalogPath
) {
    public ClassifierConfig {
        if (confidenceThreshold <= 0 || confidenceThreshold > 1) {
            throw new IllegalArgumentException("confidence-threshold must be in (0, 1]");
        }
        if (fallbackConfidence < 0 || fallbackConfidence >= confidenceThreshold) {
            throw new IllegalArgumentException("fallback-confidence must be in [0, confidence-threshold)");
        }
        if (contextHits < 0) throw new IllegalArgumentException("context-hits must be >= 0");
    }

    public static ClassifierConfig defaults() {
        return new ClassifierConfig(0.7, 0.6, 3, null);
    }
}
