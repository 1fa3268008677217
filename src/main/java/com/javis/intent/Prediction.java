package com.javis.intent;

public record Prediction(String label, double confidence) {

    public static Prediction none() {
        return new Prediction(null, 0.0);
    }
}
