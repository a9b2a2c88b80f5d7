package com.jay.stfunnel.model;

import com.jay.stfunnel.model.enums.TriageDecision;

/** Everything the conviction synthesizer needs for one ticker. */
public record ConvictionInput(String ticker,
                              String companyName,
                              String sector,
                              Double price,
                              double tier1Score,
                              TriageDecision tier2Decision,
                              AnalysisTexts texts) {
}
