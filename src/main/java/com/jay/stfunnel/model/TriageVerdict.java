package com.jay.stfunnel.model;

import com.jay.stfunnel.model.enums.TriageDecision;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class TriageVerdict {
    String ticker;
    String companyName;
    String sector;
    Double price;
    int tier1Score;
    TriageDecision decision;
    String reasoning;

    @Builder.Default List<String> redFlags = List.of();
    @Builder.Default List<String> greenFlags = List.of();

    // Check details, kept for the audit log
    String analystConsensus;
    Double targetUpside;
    Double shortInterestPct;
    Double lastEarningsSurprise;
    String earningsSentiment;
    Double beta;

    public TriageVerdict withDecision(TriageDecision newDecision, String newReasoning) {
        return toBuilder().decision(newDecision).reasoning(newReasoning).build();
    }
}
