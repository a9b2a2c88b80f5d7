package com.jay.stfunnel.model.enums;

import com.jay.stfunnel.model.ConvictionWeights;
import com.jay.stfunnel.model.ScoringWeights;

import java.util.Locale;

/**
 * Investment style driving both the Tier 1 factor weights and the Tier 3 conviction weights.
 */
public enum Strategy {
    VALUE(new ScoringWeights(40, 30, 15, 10, 5),
          new ConvictionWeights(35, 10, 20, 15, 20)),
    GROWTH(new ScoringWeights(15, 20, 10, 40, 15),
           new ConvictionWeights(20, 15, 15, 25, 25)),
    BALANCED(new ScoringWeights(25, 25, 20, 20, 10),
             new ConvictionWeights(25, 15, 20, 20, 20));

    private final ScoringWeights scoringWeights;
    private final ConvictionWeights convictionWeights;

    Strategy(ScoringWeights scoringWeights, ConvictionWeights convictionWeights) {
        this.scoringWeights = scoringWeights;
        this.convictionWeights = convictionWeights;
    }

    public ScoringWeights scoringWeights()       { return scoringWeights; }
    public ConvictionWeights convictionWeights() { return convictionWeights; }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup; returns null for blank input. */
    public static Strategy parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        return Strategy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
