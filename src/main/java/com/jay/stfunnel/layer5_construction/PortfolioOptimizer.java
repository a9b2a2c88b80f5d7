package com.jay.stfunnel.layer5_construction;

import com.jay.stfunnel.model.BuildRequest;
import com.jay.stfunnel.model.ConvictionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Layer 5: turns admitted names and their weights into sized positions.
 *
 * Weights are clamped to the position bounds, over-cap sectors are scaled down to the
 * sector limit, and the book is scaled down to (100 - cash reserve) when it exceeds it.
 * Whatever weight is left over stays in cash. Share counts are floored, so invested
 * value never exceeds the target.
 */
@Slf4j
@Component
public class PortfolioOptimizer {

    private static final int MAX_PASSES = 10;
    private static final double EPSILON = 1e-9;

    public record Constraints(double capital,
                              double cashReservePct,
                              double minPositionPct,
                              double maxPositionPct,
                              double maxSectorPct) {

        public static Constraints from(BuildRequest request) {
            return new Constraints(request.getInitialCapital(), request.getCashReservePct(),
                request.getMinPositionPct(), request.getMaxPositionPct(), request.getMaxSectorPct());
        }

        double investablePct() {
            return 100 - cashReservePct;
        }
    }

    public record Allocation(ConvictionResult conviction, double weight, long shares, double price) {

        public String ticker()        { return conviction.getTicker(); }
        public String sector()        { return sectorOf(conviction); }
        public double targetValue(double capital) { return weight / 100 * capital; }
        public double investedValue() { return shares * price; }
    }

    public record SectorExposure(int count, double weight, List<String> tickers) {}

    public record OptimizedPortfolio(List<Allocation> allocations,
                                     double totalWeight,
                                     double cashWeight,
                                     double investedValue,
                                     Map<String, SectorExposure> sectorBreakdown,
                                     int averageConviction,
                                     Double averageUpside) {

        public String summary() {
            return String.format("%d positions, %.1f%% invested, %.1f%% cash, sectors %s",
                allocations.size(), totalWeight, cashWeight, sectorBreakdown.keySet());
        }
    }

    public OptimizedPortfolio optimize(List<ConvictionResult> selected, Map<String, Double> weights, Constraints limits) {
        List<ConvictionResult> priced = new ArrayList<>();
        for (ConvictionResult c : selected) {
            if (c.getPrice() == null || c.getPrice() <= 0) {
                log.warn("No usable price for {}, leaving its weight in cash", c.getTicker());
            } else {
                priced.add(c);
            }
        }

        Map<String, Double> w = new LinkedHashMap<>();
        for (ConvictionResult c : priced) {
            double suggested = weights.getOrDefault(c.getTicker(), c.getSuggestedWeight());
            w.put(c.getTicker(), clamp(suggested, limits.minPositionPct(), limits.maxPositionPct()));
        }

        for (int pass = 0; pass < MAX_PASSES; pass++) {
            boolean changed = applySectorCap(priced, w, limits.maxSectorPct());
            changed |= scaleToInvestable(w, limits.investablePct());
            changed |= capPositions(w, limits.maxPositionPct());
            if (!changed) break;
        }

        List<Allocation> allocations = new ArrayList<>();
        for (ConvictionResult c : priced) {
            double weight = w.get(c.getTicker());
            long shares = (long) Math.floor(weight / 100 * limits.capital() / c.getPrice());
            allocations.add(new Allocation(c, weight, shares, c.getPrice()));
        }

        double totalWeight = w.values().stream().mapToDouble(Double::doubleValue).sum();
        double invested = allocations.stream().mapToDouble(Allocation::investedValue).sum();
        OptimizedPortfolio result = new OptimizedPortfolio(allocations,
            PortfolioConstructor.round1(totalWeight),
            PortfolioConstructor.round1(100 - totalWeight),
            invested,
            sectorBreakdown(allocations),
            PortfolioConstructor.averageConviction(priced),
            PortfolioConstructor.averageUpside(priced));
        log.info("Optimizer: {}", result.summary());
        return result;
    }

    // ── Constraint passes ──────────────────────────────────────────────────────

    /** Scales every sector above the cap by cap / sectorWeight. */
    boolean applySectorCap(List<ConvictionResult> holdings, Map<String, Double> w, double maxSectorPct) {
        Map<String, Double> sectorWeights = new LinkedHashMap<>();
        for (ConvictionResult c : holdings) {
            sectorWeights.merge(sectorOf(c), w.get(c.getTicker()), Double::sum);
        }
        boolean changed = false;
        for (ConvictionResult c : holdings) {
            double sectorWeight = sectorWeights.get(sectorOf(c));
            if (sectorWeight > maxSectorPct + EPSILON) {
                w.put(c.getTicker(), w.get(c.getTicker()) * maxSectorPct / sectorWeight);
                changed = true;
            }
        }
        return changed;
    }

    boolean scaleToInvestable(Map<String, Double> w, double investablePct) {
        double total = w.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= investablePct + EPSILON) return false;
        double factor = investablePct / total;
        w.replaceAll((ticker, weight) -> weight * factor);
        return true;
    }

    private boolean capPositions(Map<String, Double> w, double maxPositionPct) {
        boolean changed = false;
        for (Map.Entry<String, Double> entry : w.entrySet()) {
            if (entry.getValue() > maxPositionPct + EPSILON) {
                entry.setValue(maxPositionPct);
                changed = true;
            }
        }
        return changed;
    }

    static Map<String, SectorExposure> sectorBreakdown(List<Allocation> allocations) {
        Map<String, List<Allocation>> bySector = new TreeMap<>();
        for (Allocation a : allocations) {
            bySector.computeIfAbsent(a.sector(), s -> new ArrayList<>()).add(a);
        }
        Map<String, SectorExposure> breakdown = new LinkedHashMap<>();
        bySector.forEach((sector, list) -> breakdown.put(sector, new SectorExposure(
            list.size(),
            PortfolioConstructor.round1(list.stream().mapToDouble(Allocation::weight).sum()),
            list.stream().map(Allocation::ticker).toList())));
        return breakdown;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String sectorOf(ConvictionResult c) {
        return c.getSector() == null || c.getSector().isBlank() ? "Unknown" : c.getSector();
    }
}
