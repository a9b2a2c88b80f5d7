package com.jay.stfunnel.model;

/** Tier 1 factor weights, in percent, over value/quality/risk/growth/momentum. */
public record ScoringWeights(double value, double quality, double risk, double growth, double momentum) {

    public double sum() {
        return value + quality + risk + growth + momentum;
    }
}
