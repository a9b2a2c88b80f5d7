package com.jay.stfunnel.model.enums;

public enum SentimentLabel {
    VERY_BULLISH(90),
    BULLISH(70),
    NEUTRAL(50),
    BEARISH(30),
    VERY_BEARISH(10);

    private final double score;

    SentimentLabel(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }
}
