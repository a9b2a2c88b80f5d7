package com.jay.stfunnel.model.enums;

/**
 * Conviction buckets with their position-size bands (percent of portfolio).
 * Lower bounds are inclusive; there is no hysteresis between buckets.
 */
public enum ConvictionLevel {
    VERY_HIGH(80, 8, 10),
    HIGH(65, 6, 8),
    MODERATE(50, 4, 6),
    LOW(35, 2, 4),
    VERY_LOW(0, 0, 2);

    private final double minScore;
    private final double suggestedWeight;
    private final double maxWeight;

    ConvictionLevel(double minScore, double suggestedWeight, double maxWeight) {
        this.minScore = minScore;
        this.suggestedWeight = suggestedWeight;
        this.maxWeight = maxWeight;
    }

    public double minScore()        { return minScore; }
    public double suggestedWeight() { return suggestedWeight; }
    public double maxWeight()       { return maxWeight; }

    public static ConvictionLevel of(double conviction) {
        for (ConvictionLevel level : values()) {
            if (conviction >= level.minScore) return level;
        }
        return VERY_LOW;
    }
}
