package com.javis.intent;

import java.util.Optional;

/** Keyword/regex matcher consulted when the model is not confident enough. */
public class PatternFallback {

    private final IntentCatalog catalog;

    public PatternFallback(IntentCatalog catalog) {
        this.catalog = catalog;
    }

    /** First catalog intent, in declaration order, with a pattern found in {@code text}. */
    public Optional<String> match(String text) {
        for (var def : catalog.definitions()) {
            for (var pattern : def.patterns()) {
                if (pattern.matcher(text).find()) return Optional.of(def.label());
            }
        }
        return Optional.empty();
    }
}
