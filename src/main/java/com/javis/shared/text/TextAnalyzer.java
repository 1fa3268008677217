package com.javis.shared.text;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lucene-backed tokenizer shared by the intent model and the hashing embedder:
 * lower-cases, drops English stop words and applies Porter stemming.
 * Analyzer instances are thread-safe, so one instance can be shared.
 */
public class TextAnalyzer implements AutoCloseable {

    private final Analyzer analyzer;

    public TextAnalyzer() {
        this(new EnglishAnalyzer());
    }

    public TextAnalyzer(Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    public List<String> tokens(String text) {
        var tokens = new ArrayList<String>();
        if (text == null || text.isBlank()) return tokens;
        try (var stream = analyzer.tokenStream("text", text)) {
            var term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to analyze text", e);
        }
        return tokens;
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
