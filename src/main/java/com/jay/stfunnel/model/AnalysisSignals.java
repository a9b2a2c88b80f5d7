package com.jay.stfunnel.model;

import com.jay.stfunnel.model.enums.GuidanceChange;
import com.jay.stfunnel.model.enums.SentimentLabel;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Numeric and semantic signals pulled out of the qualitative analyses.
 * This is the whole contract between signal extraction and conviction scoring.
 */
@Value
@Builder
public class AnalysisSignals {
    // Valuation
    Double dcfUpside;
    Double peerUpside;
    Double intrinsicValue;
    Double impliedValue;

    // Sentiment
    SentimentLabel sentimentLabel;
    boolean strongBuyMentioned;
    boolean sellMentioned;
    boolean insiderBuyingMentioned;

    // Risk
    Double rawRiskScore;
    @Builder.Default List<String> riskMentions = List.of();

    // Earnings
    boolean earningsBeat;
    boolean earningsMiss;
    @Builder.Default GuidanceChange guidance = GuidanceChange.NONE;
    boolean growthMentioned;

    public static AnalysisSignals none() {
        return AnalysisSignals.builder().build();
    }
}
