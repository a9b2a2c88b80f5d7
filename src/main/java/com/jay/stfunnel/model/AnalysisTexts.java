package com.jay.stfunnel.model;

import com.jay.stfunnel.model.enums.AnalysisKind;

import java.util.EnumMap;
import java.util.Map;

/** Free-form analysis texts for one ticker; any of them may be null. */
public record AnalysisTexts(String dcf, String comparable, String sentiment, String risk, String earnings) {

    public static AnalysisTexts empty() {
        return new AnalysisTexts(null, null, null, null, null);
    }

    public static AnalysisTexts of(Map<AnalysisKind, String> byKind) {
        return new AnalysisTexts(
            byKind.get(AnalysisKind.DCF),
            byKind.get(AnalysisKind.COMPARABLE),
            byKind.get(AnalysisKind.SENTIMENT),
            byKind.get(AnalysisKind.RISK),
            byKind.get(AnalysisKind.EARNINGS));
    }

    public String get(AnalysisKind kind) {
        return switch (kind) {
            case DCF -> dcf;
            case COMPARABLE -> comparable;
            case SENTIMENT -> sentiment;
            case RISK -> risk;
            case EARNINGS -> earnings;
        };
    }

    public Map<AnalysisKind, Boolean> presence() {
        Map<AnalysisKind, Boolean> present = new EnumMap<>(AnalysisKind.class);
        for (AnalysisKind kind : AnalysisKind.values()) {
            String text = get(kind);
            present.put(kind, text != null && !text.isBlank());
        }
        return present;
    }

    public int availableCount() {
        return (int) presence().values().stream().filter(Boolean::booleanValue).count();
    }
}
