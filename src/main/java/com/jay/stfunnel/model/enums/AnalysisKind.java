package com.jay.stfunnel.model.enums;

/** The five qualitative analyses requested per Tier 3 candidate. */
public enum AnalysisKind {
    DCF,
    COMPARABLE,
    SENTIMENT,
    RISK,
    EARNINGS
}
