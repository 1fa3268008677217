package com.javis.intent;

import com.javis.memory.MemoryResult;
import com.javis.shared.config.ClassifierConfig;
import com.javis.shared.model.Intent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Maps instruction text to an {@link Intent}.
 *
 * <p>The statistical model decides first. Below the confidence threshold the
 * pattern fallback may override its label, reported at the fixed fallback
 * confidence; with no fallback match the label is {@code unknown}. Recent
 * context only ever contributes slot values, so the same text always gets the
 * same label regardless of history. Classification never throws.
 */
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private final IntentModel model;
    private final PatternFallback fallback;
    private final SlotExtractor slotExtractor;
    private final ClassifierConfig config;

    public IntentClassifier(IntentModel model, IntentCatalog catalog, ClassifierConfig config) {
        this(model, new PatternFallback(catalog), new SlotExtractor(catalog), config);
    }

    public IntentClassifier(IntentModel model, PatternFallback fallback,
                            SlotExtractor slotExtractor, ClassifierConfig config) {
        this.model = model;
        this.fallback = fallback;
        this.slotExtractor = slotExtractor;
        this.config = config;
    }

    public Intent classify(String text) {
        return classify(text, List.of());
    }

    public Intent classify(String text, List<MemoryResult> recentContext) {
        if (text == null || text.isBlank()) return Intent.unknown();
        var input = text.trim();

        var prediction = predict(input);
        var label = prediction.label();
        var confidence = prediction.confidence();

        if (label == null || confidence < config.confidenceThreshold()) {
            var matched = fallback.match(input);
            if (matched.isPresent()) {
                log.debug("Model unsure ({} @ {}), fallback matched {}", label, confidence, matched.get());
                label = matched.get();
                confidence = config.fallbackConfidence();
            } else {
                log.debug("Ambiguous instruction, model said {} @ {}", label, confidence);
                return new Intent(Intent.UNKNOWN, confidence, Map.of());
            }
        }

        var slots = slotExtractor.extract(label, input, recentContext);
        return new Intent(label, confidence, slots);
    }

    /** Feeds a confirmed (text, label) pair back into the model. */
    public void learn(String text, String label) {
        if (text == null || text.isBlank() || label == null || Intent.UNKNOWN.equals(label)) return;
        model.train(text.trim(), label);
    }

    private Prediction predict(String input) {
        try {
            var prediction = model.predict(input);
            return prediction != null ? prediction : Prediction.none();
        } catch (RuntimeException e) {
            log.warn("Intent model failed, using pattern fallback: {}", e.getMessage());
            return Prediction.none();
        }
    }
}
