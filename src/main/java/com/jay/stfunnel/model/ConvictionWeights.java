package com.jay.stfunnel.model;

/** Tier 3 component weights, in percent, over valuation/sentiment/risk/earnings/quality. */
public record ConvictionWeights(double valuation, double sentiment, double risk, double earnings, double quality) {

    public double sum() {
        return valuation + sentiment + risk + earnings + quality;
    }
}
