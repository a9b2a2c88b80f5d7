package com.jay.stfunnel.model;

/**
 * Tier 1 output for one ticker: five 0-100 factor scores and their strategy-weighted total.
 */
public record ScoreResult(Candidate candidate,
                          int valueScore,
                          int qualityScore,
                          int riskScore,
                          int growthScore,
                          int momentumScore,
                          int totalScore) {

    public String ticker()      { return candidate.getTicker(); }
    public String companyName() { return candidate.getCompanyName(); }
    public String sector()      { return candidate.getSector(); }

    public String breakdownString() {
        return String.format("V:%d Q:%d R:%d G:%d M:%d = %d",
            valueScore, qualityScore, riskScore, growthScore, momentumScore, totalScore);
    }
}
