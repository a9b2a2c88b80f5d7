package com.jay.stfunnel.model;

import com.jay.stfunnel.model.enums.ConvictionLevel;
import com.jay.stfunnel.model.enums.TriageDecision;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class ConvictionResult {
    String ticker;
    String companyName;
    String sector;
    Double price;
    double tier1Score;
    TriageDecision tier2Decision;

    // ── Component scores (0-100, rounded) ─────────────────────────────────────
    int valuationScore;
    int sentimentScore;
    int riskScore;
    int earningsScore;
    int qualityScore;

    // ── Upside ────────────────────────────────────────────────────────────────
    Double dcfUpside;
    Double peerUpside;
    Double compositeUpside;
    Double intrinsicValue;
    Double impliedValue;
    Double rawRiskScore;

    // ── Result ────────────────────────────────────────────────────────────────
    int convictionScore;
    ConvictionLevel convictionLevel;
    double suggestedWeight;
    double maxWeight;

    @Builder.Default List<String> bullFactors = List.of();
    @Builder.Default List<String> bearFactors = List.of();
    @Builder.Default List<String> keyRisks = List.of();
    String reasoning;

    // True when synthesis fell back to the Tier 1 score
    boolean fallback;
    @Builder.Default List<String> analysesRun = List.of();

    public String upsideString() {
        return compositeUpside == null ? "N/A" : String.format("%.1f%%", compositeUpside);
    }
}
