package com.jay.stfunnel.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Qualitative check bundle consumed by the triage rules. Null fields mean the check
 * could not be run and produce no flag.
 */
@Value
@Builder
public class TriageChecks {
    String ticker;
    String companyName;
    Double price;

    // Latest analyst recommendation trend
    int strongBuy;
    int buy;
    int hold;
    int sell;
    int strongSell;
    Double targetMeanPrice;

    Double shortPercentOfFloat;  // %
    Double beta;

    // Most recent quarter first
    @Builder.Default
    List<EarningsQuarter> earningsHistory = List.of();

    // Analyst actions over the last 90 days
    int recentUpgrades;
    int recentDowngrades;

    public record EarningsQuarter(Double epsActual, Double epsEstimate) {
        public boolean isMiss() {
            return epsActual != null && epsEstimate != null && epsActual < epsEstimate;
        }
    }

    public int analystCount() {
        return strongBuy + buy + hold + sell + strongSell;
    }
}
