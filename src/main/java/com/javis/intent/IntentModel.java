package com.javis.intent;

import java.util.Set;

/** Statistical text classifier behind {@link IntentClassifier}. */
public interface IntentModel {

    Prediction predict(String text);

    /** Adds one labelled example; implementations may update incrementally. */
    void train(String text, String label);

    Set<String> labels();
}
