package com.jay.stfunnel.layer2_scoring;

import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.ScoreResult;
import com.jay.stfunnel.model.ScoringWeights;
import com.jay.stfunnel.model.enums.Strategy;
import org.springframework.stereotype.Component;

/**
 * Layer 2: Tier 1 multi-factor scorer.
 * Five factors, each 0-100, combined with the strategy's weights:
 *   Value: P/E, P/B, dividend yield
 *   Quality: profit margin, ROE, current ratio
 *   Risk: beta (lower is better)
 *   Growth: revenue and earnings growth
 *   Momentum: 52-week price change
 * Missing metrics score a neutral 50, except P/E which is penalised.
 */
@Component
public class StockScorer {

    static final int NEUTRAL = 50;

    public ScoreResult score(Candidate c, Strategy strategy) {
        int value    = valueScore(c.getPeRatio(), c.getPbRatio(), c.getDividendYield());
        int quality  = qualityScore(c.getProfitMargin(), c.getRoe(), c.getCurrentRatio());
        int risk     = riskScore(c.getBeta());
        int growth   = growthScore(c.getRevenueGrowth(), c.getEarningsGrowth());
        int momentum = momentumScore(c.getFiftyTwoWeekChange());

        ScoringWeights w = strategy.scoringWeights();
        double total = (value    * w.value()
                      + quality  * w.quality()
                      + risk     * w.risk()
                      + growth   * w.growth()
                      + momentum * w.momentum()) / 100.0;

        return new ScoreResult(c, value, quality, risk, growth, momentum, (int) Math.round(total));
    }

    /**
     * Clamps to [min, max] and maps linearly onto [0, 100], flipped when lower is better.
     * Null, NaN or a degenerate range gives the neutral 50.
     */
    public static int normalize(Double value, double min, double max, boolean invert) {
        if (value == null || value.isNaN() || max <= min) return NEUTRAL;
        double clamped = Math.max(min, Math.min(max, value));
        double scaled = (clamped - min) / (max - min);
        if (invert) scaled = 1 - scaled;
        return (int) Math.round(scaled * 100);
    }

    public static int normalize(Double value, double min, double max) {
        return normalize(value, min, max, false);
    }

    // ── Value: 50% P/E, 30% P/B, 20% dividend ─────────────────────────────────

    int valueScore(Double pe, Double pb, Double dividendYield) {
        double peScore;
        if (pe == null) peScore = 20;            // no earnings figure
        else if (pe <= 0) peScore = 10;          // loss-making
        else peScore = normalize(pe, 5, 50, true);

        double pbScore = normalize(pb, 0.5, 10, true);
        double divScore = normalize(dividendYield, 0, 6);
        return (int) Math.round(peScore * 0.5 + pbScore * 0.3 + divScore * 0.2);
    }

    // ── Quality: 40% margin, 40% ROE, 20% current ratio ───────────────────────

    int qualityScore(Double profitMargin, Double roe, Double currentRatio) {
        double marginScore = normalize(profitMargin, 0, 30);
        double roeScore = normalize(roe, 0, 30);
        return (int) Math.round(marginScore * 0.4 + roeScore * 0.4 + currentRatioScore(currentRatio) * 0.2);
    }

    double currentRatioScore(Double cr) {
        if (cr == null || cr.isNaN()) return NEUTRAL;
        if (cr >= 1 && cr <= 3) return normalize(cr, 0.5, 2.5);
        if (cr < 1) return normalize(cr, 0, 1) * 0.5;
        return 70; // > 3: liquid but possibly idle capital
    }

    int riskScore(Double beta) {
        return normalize(beta, 0.5, 2.0, true);
    }

    int growthScore(Double revenueGrowth, Double earningsGrowth) {
        return (int) Math.round(normalize(revenueGrowth, -10, 50) * 0.5 + normalize(earningsGrowth, -20, 100) * 0.5);
    }

    int momentumScore(Double fiftyTwoWeekChange) {
        return normalize(fiftyTwoWeekChange, -50, 100);
    }
}
