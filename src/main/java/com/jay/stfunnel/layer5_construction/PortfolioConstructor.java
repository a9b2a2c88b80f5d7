package com.jay.stfunnel.layer5_construction;

import com.jay.stfunnel.model.ConvictionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Layer 5: portfolio admission.
 * Candidates are taken in descending conviction order (ties keep input order). Each one is
 * admitted while the portfolio has room and its conviction meets the minimum; every other
 * candidate gets an explicit rejection reason.
 *
 * Suggested weights are then rescaled to sum to 100 and clamped to each name's own max
 * weight. Clamping happens after rescaling so a strong name is not cut for the excess of others.
 */
@Slf4j
@Component
public class PortfolioConstructor {

    public record Rejection(String ticker, String reason, int convictionScore) {}

    /**
     * @param scaleFactor 100 / sum of suggested weights, or 1 when no rescale was needed
     * @param rescaled    weights after rescaling, before the max-weight clamp
     * @param weights     final weights
     */
    public record WeightNormalization(double scaleFactor, Map<String, Double> rescaled, Map<String, Double> weights) {

        public double totalWeight() {
            return round1(weights.values().stream().mapToDouble(Double::doubleValue).sum());
        }
    }

    public record Construction(List<ConvictionResult> selected,
                               List<Rejection> rejected,
                               WeightNormalization normalization,
                               int averageConviction,
                               Double averageUpside) {

        public Map<String, Double> weights() {
            return normalization.weights();
        }

        public boolean isSelected(String ticker) {
            return selected.stream().anyMatch(c -> c.getTicker().equals(ticker));
        }

        public String rejectionReason(String ticker) {
            return rejected.stream().filter(r -> r.ticker().equals(ticker))
                .map(Rejection::reason).findFirst().orElse(null);
        }
    }

    public Construction construct(List<ConvictionResult> candidates, int maxHoldings, double minConviction) {
        List<ConvictionResult> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt(ConvictionResult::getConvictionScore).reversed());

        List<ConvictionResult> selected = new ArrayList<>();
        List<Rejection> rejected = new ArrayList<>();
        for (ConvictionResult c : sorted) {
            if (c.getConvictionScore() < minConviction) {
                rejected.add(new Rejection(c.getTicker(), String.format("Below minimum conviction (%d < %s)",
                    c.getConvictionScore(), formatNumber(minConviction)), c.getConvictionScore()));
            } else if (selected.size() >= maxHoldings) {
                rejected.add(new Rejection(c.getTicker(),
                    "Portfolio full (" + maxHoldings + " holdings)", c.getConvictionScore()));
            } else {
                selected.add(c);
            }
        }

        WeightNormalization normalization = normalizeWeights(selected);
        log.info("Construction: {} selected, {} rejected, total weight {}%",
            selected.size(), rejected.size(), String.format("%.1f", normalization.totalWeight()));
        return new Construction(selected, rejected, normalization,
            averageConviction(selected), averageUpside(selected));
    }

    public WeightNormalization normalizeWeights(List<ConvictionResult> selected) {
        double total = selected.stream().mapToDouble(ConvictionResult::getSuggestedWeight).sum();
        boolean rescale = total > 0 && total != 100;
        double factor = rescale ? 100 / total : 1;

        Map<String, Double> rescaled = new LinkedHashMap<>();
        for (ConvictionResult c : selected) {
            rescaled.put(c.getTicker(), rescale ? round1(c.getSuggestedWeight() * factor) : c.getSuggestedWeight());
        }
        if (rescale) trimRoundingExcess(rescaled);

        Map<String, Double> weights = new LinkedHashMap<>();
        for (ConvictionResult c : selected) {
            weights.put(c.getTicker(), Math.min(rescaled.get(c.getTicker()), c.getMaxWeight()));
        }
        return new WeightNormalization(factor, rescaled, weights);
    }

    /** One-decimal rounding can push the total past 100; the excess comes off the largest weight. */
    private static void trimRoundingExcess(Map<String, Double> rescaled) {
        double excess = round1(rescaled.values().stream().mapToDouble(Double::doubleValue).sum() - 100);
        if (excess <= 0) return;
        rescaled.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .ifPresent(largest -> largest.setValue(round1(largest.getValue() - excess)));
    }

    // ── Stats ──────────────────────────────────────────────────────────────────

    static int averageConviction(List<ConvictionResult> holdings) {
        if (holdings.isEmpty()) return 0;
        return (int) Math.round(holdings.stream().mapToInt(ConvictionResult::getConvictionScore).average().orElse(0));
    }

    static Double averageUpside(List<ConvictionResult> holdings) {
        List<Double> upsides = holdings.stream()
            .map(ConvictionResult::getCompositeUpside)
            .filter(Objects::nonNull)
            .toList();
        if (upsides.isEmpty()) return null;
        return round1(upsides.stream().mapToDouble(Double::doubleValue).average().orElse(0));
    }

    static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
