package com.javis.intent;

import com.javis.shared.text.TextAnalyzer;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Multinomial naive Bayes over analyzed tokens with add-one smoothing.
 * Confidence is the posterior probability of the winning label. Tokens never
 * seen in training carry no evidence; a text made only of such tokens scores 0.
 */
public class NaiveBayesIntentModel implements IntentModel {

    private final TextAnalyzer analyzer;
    private final Map<String, Map<String, Integer>> tokenCounts = new LinkedHashMap<>();
    private final Map<String, Integer> tokenTotals = new HashMap<>();
    private final Map<String, Integer> exampleCounts = new HashMap<>();
    private final Set<String> vocabulary = new HashSet<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private int totalExamples;

    public NaiveBayesIntentModel(TextAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /** Builds a model trained on every example of the catalog. */
    public static NaiveBayesIntentModel trainedOn(IntentCatalog catalog, TextAnalyzer analyzer) {
        var model = new NaiveBayesIntentModel(analyzer);
        for (var def : catalog.definitions()) {
            for (var example : def.examples()) {
                model.train(example, def.label());
            }
        }
        return model;
    }

    @Override
    public void train(String text, String label) {
        var tokens = analyzer.tokens(text);
        if (tokens.isEmpty()) return;
        lock.writeLock().lock();
        try {
            var counts = tokenCounts.computeIfAbsent(label, k -> new HashMap<>());
            for (var token : tokens) {
                counts.merge(token, 1, Integer::sum);
                vocabulary.add(token);
            }
            tokenTotals.merge(label, tokens.size(), Integer::sum);
            exampleCounts.merge(label, 1, Integer::sum);
            totalExamples++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Prediction predict(String text) {
        var tokens = analyzer.tokens(text);
        lock.readLock().lock();
        try {
            if (tokenCounts.isEmpty()) {
                throw new IllegalStateException("Intent model has not been trained");
            }
            var known = tokens.stream().filter(vocabulary::contains).toList();
            if (known.isEmpty()) return Prediction.none();

            int labelCount = tokenCounts.size();
            int vocabSize = vocabulary.size();
            var logScores = new LinkedHashMap<String, Double>();
            for (var entry : tokenCounts.entrySet()) {
                var label = entry.getKey();
                var counts = entry.getValue();
                double denominator = tokenTotals.get(label) + vocabSize;
                double score = Math.log((exampleCounts.get(label) + 1.0) / (totalExamples + labelCount));
                for (var token : known) {
                    score += Math.log((counts.getOrDefault(token, 0) + 1.0) / denominator);
                }
                logScores.put(label, score);
            }

            String best = null;
            double max = Double.NEGATIVE_INFINITY;
            for (var entry : logScores.entrySet()) {
                if (entry.getValue() > max) {
                    max = entry.getValue();
                    best = entry.getKey();
                }
            }
            double sum = 0;
            for (var score : logScores.values()) sum += Math.exp(score - max);
            return new Prediction(best, 1.0 / sum);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> labels() {
        lock.readLock().lock();
        try {
            return Set.copyOf(tokenCounts.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }
}
