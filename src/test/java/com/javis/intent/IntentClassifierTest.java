package com.javis.intent;

import com.javis.memory.MemoryRecord;
import com.javis.memory.MemoryResult;
import com.javis.shared.config.ClassifierConfig;
import com.javis.shared.model.ErrorKind;
import com.javis.shared.model.Intent;
import com.javis.shared.text.TextAnalyzer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class IntentClassifierTest {

    private static final ClassifierConfig CONFIG = ClassifierConfig.defaults();
    private static IntentCatalog catalog;
    private static TextAnalyzer analyzer;

    @BeforeAll
    static void loadCatalog() {
        catalog = IntentCatalogLoader.loadDefault();
        analyzer = new TextAnalyzer();
    }

    @AfterAll
    static void closeAnalyzer() {
        analyzer.close();
    }

    private IntentClassifier withModel(IntentModel model) {
        return new IntentClassifier(model, catalog, CONFIG);
    }

    private static MemoryResult hit(Map<String, Object> metadata) {
        return new MemoryResult(new MemoryRecord("m1", "Q: scan ports\nA: done", new float[] {1f},
                metadata, Instant.now()), 0.9);
    }

    @Test
    void blankTextIsUnknown() {
        var classifier = withModel(NaiveBayesIntentModel.trainedOn(catalog, analyzer));
        for (var text : new String[] {"", "   ", "\t\n", null}) {
            var intent = classifier.classify(text);
            assertTrue(intent.isUnknown());
            assertEquals(0.0, intent.confidence());
            assertTrue(intent.slots().isEmpty());
        }
    }

    @Test
    void trainedModelRoutesPortScanAndExtractsSlots() {
        var classifier = withModel(NaiveBayesIntentModel.trainedOn(catalog, analyzer));
        var intent = classifier.classify("scan ports 22,80 on 192.168.1.10");
        assertEquals("port_scan", intent.label());
        assertEquals("192.168.1.10", intent.slot("target"));
        assertEquals("22,80", intent.slot("ports"));
    }

    @Test
    void confidentModelWinsOverPatterns() {
        var model = mock(IntentModel.class);
        when(model.predict(anyString())).thenReturn(new Prediction("docker", 0.9));
        var intent = withModel(model).classify("check open ports");
        assertEquals("docker", intent.label());
        assertEquals(0.9, intent.confidence(), 1e-9);
    }

    @Test
    void lowConfidenceFallsBackToPatternAtFixedConfidence() {
        var model = mock(IntentModel.class);
        when(model.predict(anyString())).thenReturn(new Prediction("greeting", 0.3));
        var intent = withModel(model).classify("check open ports");
        assertEquals("port_scan", intent.label());
        assertEquals(CONFIG.fallbackConfidence(), intent.confidence(), 1e-9);
        assertTrue(intent.confidence() < CONFIG.confidenceThreshold());
    }

    @Test
    void lowConfidenceWithoutPatternIsAmbiguous() {
        var model = mock(IntentModel.class);
        when(model.predict(anyString())).thenReturn(new Prediction("weather", 0.4));
        var intent = withModel(model).classify("blorf zzz qux");
        assertTrue(intent.isUnknown());
        assertEquals(ErrorKind.CLASSIFICATION_AMBIGUOUS, intent.errorKind());
        assertEquals(0.4, intent.confidence(), 1e-9);
        assertTrue(intent.slots().isEmpty());
    }

    @Test
    void modelFailureDegradesToFallback() {
        var model = mock(IntentModel.class);
        when(model.predict(anyString())).thenThrow(new IllegalStateException("not trained"));
        var classifier = withModel(model);
        assertEquals("docker", classifier.classify("restart the docker container web").label());
        var unknown = classifier.classify("blorf");
        assertTrue(unknown.isUnknown());
        assertEquals(0.0, unknown.confidence());
    }

    @Test
    void contextFillsMissingSlotOnAnaphora() {
        var model = mock(IntentModel.class);
        when(model.predict(anyString())).thenReturn(new Prediction("port_scan", 0.95));
        var classifier = withModel(model);
        var context = List.of(hit(Map.of("target", "10.0.0.5", "type", "task")));

        var filled = classifier.classify("scan it again", context);
        assertEquals("10.0.0.5", filled.slot("target"));

        var noReference = classifier.classify("scan ports again", context);
        assertNull(noReference.slot("target"));
    }

    @Test
    void contextNeverChangesLabelOrConfidence() {
        var classifier = withModel(NaiveBayesIntentModel.trainedOn(catalog, analyzer));
        var context = List.of(hit(Map.of("target", "10.0.0.5")), hit(Map.of("city", "Paris")));
        for (var text : List.of("scan that host", "what is the weather there", "hello", "blorf it")) {
            var plain = classifier.classify(text);
            var withContext = classifier.classify(text, context);
            assertEquals(plain.label(), withContext.label());
            assertEquals(plain.confidence(), withContext.confidence(), 1e-12);
        }
    }

    @Test
    void extractedSlotBeatsContext() {
        var model = mock(IntentModel.class);
        when(model.predict(anyString())).thenReturn(new Prediction("port_scan", 0.95));
        var intent = withModel(model).classify("scan it on 10.1.1.1", List.of(hit(Map.of("target", "10.0.0.5"))));
        assertEquals("10.1.1.1", intent.slot("target"));
    }

    @Test
    void confidenceAlwaysWithinBounds() {
        var classifier = withModel(NaiveBayesIntentModel.trainedOn(catalog, analyzer));
        var random = new Random(42);
        var words = "scan port docker weather remind me the it of cpu hello zzz 10.0.0.1 ? !".split(" ");
        for (int i = 0; i < 200; i++) {
            var sb = new StringBuilder();
            int n = random.nextInt(8);
            for (int j = 0; j < n; j++) sb.append(words[random.nextInt(words.length)]).append(' ');
            Intent intent = classifier.classify(sb.toString());
            assertTrue(intent.confidence() >= 0.0 && intent.confidence() <= 1.0);
            assertNotNull(intent.label());
        }
    }

    @Test
    void learnFeedsModel() {
        var model = mock(IntentModel.class);
        var classifier = withModel(model);
        classifier.learn("  frobnicate the widget ", "docker");
        classifier.learn("whatever", Intent.UNKNOWN);
        classifier.learn(" ", "docker");
        verify(model).train("frobnicate the widget", "docker");
        verifyNoMoreInteractions(model);
    }
}
