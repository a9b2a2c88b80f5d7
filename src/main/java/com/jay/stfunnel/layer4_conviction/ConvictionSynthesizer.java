package com.jay.stfunnel.layer4_conviction;

import com.jay.stfunnel.model.AnalysisSignals;
import com.jay.stfunnel.model.ConvictionInput;
import com.jay.stfunnel.model.ConvictionResult;
import com.jay.stfunnel.model.ConvictionWeights;
import com.jay.stfunnel.model.enums.AnalysisKind;
import com.jay.stfunnel.model.enums.ConvictionLevel;
import com.jay.stfunnel.model.enums.GuidanceChange;
import com.jay.stfunnel.model.enums.SentimentLabel;
import com.jay.stfunnel.model.enums.Strategy;
import com.jay.stfunnel.model.enums.TriageDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Layer 4: Tier 3 conviction synthesis.
 * Combines the signals extracted from the five qualitative analyses with the Tier 1 score
 * into five component scores, a weighted 0-100 conviction, its level and a position size.
 *
 * Components (50 is neutral for every one of them):
 *   valuation  DCF upside over [-50%, +50%], blended 60/40 with peer upside
 *   sentiment  label score adjusted for strong-buy, sell and insider-buy mentions
 *   risk       inverted 1-10 risk figure
 *   earnings   beat/miss, guidance change, growth mention
 *   quality    Tier 1 score, plus 10 for a Tier 2 fast-track
 *
 * The reasoning text is built here from the numbers, never taken from the analysis prose.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConvictionSynthesizer {

    private static final double HIGH_RISK_RAW = 7;
    private static final double LOW_RISK_RAW = 3;

    private final AnalysisSignalExtractor extractor;

    /** Never throws: any failure during extraction or scoring yields the fallback result. */
    public ConvictionResult synthesize(ConvictionInput input, Strategy strategy) {
        try {
            AnalysisSignals signals = extractor.extract(input.texts());
            return score(input, signals, strategy);
        } catch (Exception e) {
            log.warn("Conviction synthesis failed for {}: {}", input.ticker(), e.getMessage());
            return fallback(input, strategy, e.getMessage());
        }
    }

    public ConvictionResult score(ConvictionInput input, AnalysisSignals signals, Strategy strategy) {
        List<String> bull = new ArrayList<>();
        List<String> bear = new ArrayList<>();
        List<String> keyRisks = new ArrayList<>();

        // ── Valuation ─────────────────────────────────────────────────────────
        Double dcf = signals.getDcfUpside();
        Double peer = signals.getPeerUpside();
        double valuation = 50;
        if (dcf != null) {
            valuation = normalize(dcf, -50, 50, false);
            if (dcf > 20) bull.add(String.format("Strong DCF upside (%.0f%%)", dcf));
            else if (dcf < -10) bear.add(String.format("DCF shows overvaluation (%.0f%%)", dcf));
        }
        if (peer != null) {
            valuation = valuation * 0.6 + normalize(peer, -50, 50, false) * 0.4;
            if (peer > 15) bull.add(String.format("Trading below peers (%.0f%% discount)", peer));
            else if (peer < -15) bear.add(String.format("Trading above peers (%.0f%% premium)", Math.abs(peer)));
        }
        Double composite = compositeUpside(dcf, peer);

        // ── Sentiment ─────────────────────────────────────────────────────────
        double sentiment = sentimentScore(signals, bull, bear, keyRisks);

        // ── Risk ──────────────────────────────────────────────────────────────
        Double rawRisk = signals.getRawRiskScore();
        double risk = 50;
        if (rawRisk != null) {
            risk = normalize(rawRisk, 1, 10, true);
            if (rawRisk <= LOW_RISK_RAW) {
                bull.add("Low risk profile");
            } else if (rawRisk >= HIGH_RISK_RAW) {
                bear.add("High risk profile");
                keyRisks.add(String.format("High overall risk score (%s/10)", formatNumber(rawRisk)));
            }
        }
        keyRisks.addAll(signals.getRiskMentions());

        // ── Earnings ──────────────────────────────────────────────────────────
        double earnings = earningsScore(signals, bull, bear, keyRisks);

        // ── Quality ───────────────────────────────────────────────────────────
        double quality = input.tier1Score();
        if (input.tier2Decision() == TriageDecision.FAST_TRACK) {
            quality = Math.min(100, quality + 10);
            bull.add("Fast-tracked in Tier 2 triage");
        }

        ConvictionWeights w = strategy.convictionWeights();
        int conviction = (int) Math.round((valuation * w.valuation() + sentiment * w.sentiment()
            + risk * w.risk() + earnings * w.earnings() + quality * w.quality()) / 100);
        ConvictionLevel level = ConvictionLevel.of(conviction);

        double suggested = level.suggestedWeight();
        double max = level.maxWeight();
        if (rawRisk != null && rawRisk >= HIGH_RISK_RAW) {
            suggested = Math.max(0, suggested - 2);
            max = Math.max(2, max - 2);
        }

        String reasoning = reasoning(conviction, level, strategy, composite,
            valuation, sentiment, risk, earnings, quality, bull, bear);

        return ConvictionResult.builder()
            .ticker(input.ticker())
            .companyName(input.companyName())
            .sector(input.sector())
            .price(input.price())
            .tier1Score(input.tier1Score())
            .tier2Decision(input.tier2Decision())
            .valuationScore((int) Math.round(valuation))
            .sentimentScore((int) Math.round(sentiment))
            .riskScore((int) Math.round(risk))
            .earningsScore((int) Math.round(earnings))
            .qualityScore((int) Math.round(quality))
            .dcfUpside(dcf)
            .peerUpside(peer)
            .compositeUpside(composite)
            .intrinsicValue(signals.getIntrinsicValue())
            .impliedValue(signals.getImpliedValue())
            .rawRiskScore(rawRisk)
            .convictionScore(conviction)
            .convictionLevel(level)
            .suggestedWeight(suggested)
            .maxWeight(max)
            .bullFactors(List.copyOf(bull))
            .bearFactors(List.copyOf(bear))
            .keyRisks(List.copyOf(keyRisks))
            .reasoning(reasoning)
            .analysesRun(analysesRun(input))
            .build();
    }

    /** Neutral result built from the Tier 1 score alone. */
    public ConvictionResult fallback(ConvictionInput input, Strategy strategy, String reason) {
        int conviction = (int) Math.round(input.tier1Score());
        return ConvictionResult.builder()
            .ticker(input.ticker())
            .companyName(input.companyName())
            .sector(input.sector())
            .price(input.price())
            .tier1Score(input.tier1Score())
            .tier2Decision(input.tier2Decision())
            .valuationScore(50)
            .sentimentScore(50)
            .riskScore(50)
            .earningsScore(50)
            .qualityScore(conviction)
            .convictionScore(conviction)
            .convictionLevel(ConvictionLevel.MODERATE)
            .suggestedWeight(ConvictionLevel.MODERATE.suggestedWeight())
            .maxWeight(ConvictionLevel.MODERATE.maxWeight())
            .bearFactors(List.of("Analysis incomplete"))
            .keyRisks(List.of("Data quality issues"))
            .reasoning(String.format("Fallback conviction (%d/100) for %s strategy: %s",
                conviction, strategy.label(), reason))
            .fallback(true)
            .analysesRun(analysesRun(input))
            .build();
    }

    // ── Components ─────────────────────────────────────────────────────────────

    private double sentimentScore(AnalysisSignals signals, List<String> bull, List<String> bear, List<String> keyRisks) {
        double score = 50;
        SentimentLabel label = signals.getSentimentLabel();
        if (label != null) {
            score = label.score();
            switch (label) {
                case VERY_BULLISH -> bull.add("Very bullish market sentiment");
                case BULLISH -> bull.add("Positive market sentiment");
                case BEARISH -> bear.add("Negative market sentiment");
                case VERY_BEARISH -> {
                    bear.add("Very bearish market sentiment");
                    keyRisks.add("Negative sentiment may persist");
                }
                default -> { }
            }
        }
        if (signals.isStrongBuyMentioned()) {
            score = Math.min(100, score + 10);
            bull.add("Strong analyst buy rating");
        } else if (signals.isSellMentioned()) {
            score = Math.max(0, score - 15);
            bear.add("Analyst sell ratings present");
        }
        if (signals.isInsiderBuyingMentioned()) {
            score = Math.min(100, score + 5);
            bull.add("Recent insider buying");
        }
        return score;
    }

    private double earningsScore(AnalysisSignals signals, List<String> bull, List<String> bear, List<String> keyRisks) {
        double score = 50;
        if (signals.isEarningsBeat()) {
            score += 15;
            bull.add("Recent earnings beat");
        }
        if (signals.isEarningsMiss()) {
            score -= 15;
            bear.add("Recent earnings miss");
        }
        if (signals.getGuidance() == GuidanceChange.RAISED) {
            score += 10;
            bull.add("Raised forward guidance");
        } else if (signals.getGuidance() == GuidanceChange.LOWERED) {
            score -= 10;
            bear.add("Lowered forward guidance");
            keyRisks.add("Management lowered expectations");
        }
        if (signals.isGrowthMentioned()) {
            score += 5;
        }
        return Math.max(0, Math.min(100, score));
    }

    static Double compositeUpside(Double dcf, Double peer) {
        if (dcf != null && peer != null) return dcf * 0.6 + peer * 0.4;
        if (dcf != null) return dcf;
        return peer;
    }

    /** Continuous counterpart of the Tier 1 normalize: clamped to [0, 100], not rounded. */
    static double normalize(double value, double min, double max, boolean invert) {
        double scaled = Math.max(0, Math.min(100, (value - min) / (max - min) * 100));
        return invert ? 100 - scaled : scaled;
    }

    // ── Reasoning ──────────────────────────────────────────────────────────────

    private String reasoning(int conviction, ConvictionLevel level, Strategy strategy, Double composite,
                             double valuation, double sentiment, double risk, double earnings, double quality,
                             List<String> bull, List<String> bear) {
        List<String> parts = new ArrayList<>();
        parts.add(String.format("%s conviction (%d/100) for %s strategy.", level, conviction, strategy.label()));

        if (composite != null) {
            parts.add(String.format("Composite %s: %.1f%%.", composite >= 0 ? "upside" : "downside", Math.abs(composite)));
        }

        List<String> factors = new ArrayList<>();
        band(factors, valuation, "strong valuation", "weak valuation");
        band(factors, sentiment, "positive sentiment", "negative sentiment");
        band(factors, risk, "low risk", "high risk");
        band(factors, earnings, "strong earnings", "weak earnings");
        if (quality >= 70) factors.add("high quality");
        if (!factors.isEmpty()) {
            parts.add("Key factors: " + String.join(", ", factors) + ".");
        }

        if (!bull.isEmpty()) {
            parts.add("Positives: " + String.join("; ", bull.subList(0, Math.min(3, bull.size()))) + ".");
        }
        if (!bear.isEmpty()) {
            parts.add("Concerns: " + String.join("; ", bear.subList(0, Math.min(2, bear.size()))) + ".");
        }
        return String.join(" ", parts);
    }

    private static void band(List<String> factors, double score, String high, String low) {
        if (score >= 70) factors.add(high);
        else if (score <= 30) factors.add(low);
    }

    private static List<String> analysesRun(ConvictionInput input) {
        if (input.texts() == null) return List.of();
        List<String> run = new ArrayList<>();
        for (Map.Entry<AnalysisKind, Boolean> entry : input.texts().presence().entrySet()) {
            if (entry.getValue()) run.add(entry.getKey().name());
        }
        return run;
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
