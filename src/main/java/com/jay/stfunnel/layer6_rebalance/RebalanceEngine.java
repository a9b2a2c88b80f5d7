package com.jay.stfunnel.layer6_rebalance;

import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.entity.Holding;
import com.jay.stfunnel.model.ConvictionResult;
import com.jay.stfunnel.model.enums.ConvictionLevel;
import com.jay.stfunnel.model.enums.HoldingAction;
import com.jay.stfunnel.model.enums.TradeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Layer 6: monthly review logic.
 *
 * Classification of a re-scored holding, first match wins:
 *   conviction below sell threshold                    → SELL
 *   conviction below hold threshold                    → TRIM
 *   weight above max position and conviction below 70  → TRIM
 *   weight below min position and conviction 70+       → ADD
 *   otherwise                                          → HOLD
 *
 * Trades are planned in priority order SELL, TRIM, ADD, BUY. Buys and adds are funded from
 * cash above the target reserve plus sell proceeds, and never exceed the cash remaining at
 * the time they are planned. Turnover is reported, not enforced.
 */
@Slf4j
@Component
public class RebalanceEngine {

    private static final int HIGH_CONVICTION = 70;
    private static final double TRIM_TARGET_OF_MAX = 0.8;
    private static final double ADD_TARGET_OF_MIN = 1.5;

    public record Classification(HoldingAction action, String reasoning) {}

    public record HoldingReview(String ticker,
                                String companyName,
                                String sector,
                                long shares,
                                double price,
                                double marketValue,
                                double weight,
                                Integer previousConviction,
                                ConvictionResult conviction,
                                int convictionDelta,
                                HoldingAction action,
                                String reasoning) {

        public int newConviction() {
            return conviction.getConvictionScore();
        }
    }

    public record RecommendedTrade(int priority,
                                   TradeType type,
                                   String ticker,
                                   String companyName,
                                   String sector,
                                   long shares,
                                   double price,
                                   double value,
                                   String reason,
                                   int conviction,
                                   ConvictionLevel convictionLevel) {}

    public record TradePlan(List<RecommendedTrade> trades,
                            double availableCash,
                            double investableCash,
                            double remainingCash,
                            double turnoverPct,
                            boolean turnoverExceeded) {

        public List<RecommendedTrade> ofType(TradeType type) {
            return trades.stream().filter(t -> t.type() == type).toList();
        }

        public String summary() {
            return String.format("%d trades (%d sell, %d trim, %d add, %d buy), turnover %.1f%%",
                trades.size(), ofType(TradeType.SELL).size(), ofType(TradeType.TRIM).size(),
                ofType(TradeType.ADD).size(), ofType(TradeType.BUY).size(), turnoverPct);
        }
    }

    // ── Classification ─────────────────────────────────────────────────────────

    public Classification classify(int conviction, double weight, FunnelConfig.Rebalance settings) {
        if (conviction < settings.getSellThreshold()) {
            return new Classification(HoldingAction.SELL, String.format("Conviction dropped to %d (below %s threshold)",
                conviction, formatNumber(settings.getSellThreshold())));
        }
        if (conviction < settings.getHoldThreshold()) {
            return new Classification(HoldingAction.TRIM,
                String.format("Low conviction (%d), consider reducing position", conviction));
        }
        if (weight > settings.getMaxPositionPct() && conviction < HIGH_CONVICTION) {
            return new Classification(HoldingAction.TRIM,
                String.format("Position oversized (%.1f%%) with moderate conviction", weight));
        }
        if (weight < settings.getMinPositionPct() && conviction >= HIGH_CONVICTION) {
            return new Classification(HoldingAction.ADD,
                String.format("Undersized position (%.1f%%) with high conviction", weight));
        }
        return new Classification(HoldingAction.HOLD, String.format("Conviction %d/100 - maintain position", conviction));
    }

    /**
     * @param price      fresh price, already resolved by the caller (last price or cost on failure)
     * @param totalValue portfolio value (cash plus holdings at current prices)
     */
    public HoldingReview review(Holding holding, double price, ConvictionResult conviction,
                                double totalValue, FunnelConfig.Rebalance settings) {
        double marketValue = holding.getShares() * price;
        double weight = totalValue > 0 ? marketValue / totalValue * 100 : 0;
        Integer previous = holding.getConvictionScore();
        int delta = previous == null ? 0 : conviction.getConvictionScore() - previous;
        Classification c = classify(conviction.getConvictionScore(), weight, settings);
        return new HoldingReview(holding.getTicker(), holding.getCompanyName(), holding.getSector(),
            holding.getShares(), price, marketValue, weight, previous, conviction, delta, c.action(), c.reasoning());
    }

    // ── Trade plan ─────────────────────────────────────────────────────────────

    public TradePlan buildTrades(List<HoldingReview> reviews,
                                 List<ConvictionResult> newCandidates,
                                 double cash,
                                 double totalValue,
                                 FunnelConfig.Rebalance settings) {
        List<RecommendedTrade> trades = new ArrayList<>();
        int priority = 1;

        // 1. Sells, lowest conviction first
        List<HoldingReview> sells = reviews.stream()
            .filter(r -> r.action() == HoldingAction.SELL)
            .sorted(Comparator.comparingInt(HoldingReview::newConviction))
            .limit(Math.max(0, settings.getMaxSellsPerReview()))
            .toList();
        for (HoldingReview r : sells) {
            trades.add(trade(priority++, TradeType.SELL, r, r.shares(), r.reasoning()));
        }

        // 2. Trims down to a fraction of the max position
        double trimTargetValue = totalValue * settings.getMaxPositionPct() * TRIM_TARGET_OF_MAX / 100;
        List<HoldingReview> trims = reviews.stream()
            .filter(r -> r.action() == HoldingAction.TRIM)
            .sorted(Comparator.comparingInt(HoldingReview::newConviction))
            .toList();
        for (HoldingReview r : trims) {
            if (r.price() <= 0) continue;
            long shares = Math.min(r.shares(), (long) Math.floor((r.marketValue() - trimTargetValue) / r.price()));
            if (shares > 0) {
                trades.add(trade(priority++, TradeType.TRIM, r, shares, r.reasoning()));
            }
        }

        // 3. Cash budget
        double proceeds = trades.stream().mapToDouble(RecommendedTrade::value).sum();
        double available = cash + proceeds;
        double investable = Math.max(0, available - totalValue * settings.getTargetCashPct() / 100);
        double remaining = investable;

        // 4. Adds toward a multiple of the min position, highest conviction first
        double addTargetValue = totalValue * settings.getMinPositionPct() * ADD_TARGET_OF_MIN / 100;
        List<HoldingReview> adds = reviews.stream()
            .filter(r -> r.action() == HoldingAction.ADD)
            .sorted(Comparator.comparingInt(HoldingReview::newConviction).reversed())
            .toList();
        for (HoldingReview r : adds) {
            if (r.price() <= 0) continue;
            double need = addTargetValue - r.marketValue();
            long shares = (long) Math.floor(Math.min(need, remaining) / r.price());
            double value = shares * r.price();
            if (shares > 0 && value <= remaining) {
                trades.add(trade(priority++, TradeType.ADD, r, shares, r.reasoning()));
                remaining -= value;
            }
        }

        // 5. New positions, highest conviction first
        List<ConvictionResult> ranked = new ArrayList<>(newCandidates);
        ranked.sort(Comparator.comparingInt(ConvictionResult::getConvictionScore).reversed());
        double minBuyValue = totalValue * settings.getMinPositionPct() / 100;
        int buys = 0;
        for (ConvictionResult c : ranked) {
            if (buys >= settings.getMaxBuysPerReview() || remaining < minBuyValue || remaining <= 0) break;
            if (c.getConvictionScore() < settings.getBuyThreshold()) {
                log.debug("Skipping {}: conviction {} below buy threshold {}",
                    c.getTicker(), c.getConvictionScore(), settings.getBuyThreshold());
                continue;
            }
            if (c.getPrice() == null || c.getPrice() <= 0) continue;

            double targetWeight = c.getSuggestedWeight() > 0
                ? c.getSuggestedWeight()
                : (settings.getMinPositionPct() + settings.getMaxPositionPct()) / 2;
            double buyValue = Math.min(totalValue * targetWeight / 100, remaining);
            long shares = (long) Math.floor(buyValue / c.getPrice());
            if (shares <= 0) continue;

            double value = shares * c.getPrice();
            trades.add(new RecommendedTrade(priority++, TradeType.BUY, c.getTicker(), c.getCompanyName(), c.getSector(),
                shares, c.getPrice(), value,
                String.format("Full analysis: %s conviction (%d/100), Upside: %s",
                    c.getConvictionLevel(), c.getConvictionScore(), signedUpside(c.getCompositeUpside())),
                c.getConvictionScore(), c.getConvictionLevel()));
            remaining -= value;
            buys++;
        }

        double turnover = totalValue > 0
            ? trades.stream().mapToDouble(RecommendedTrade::value).sum() / totalValue * 100
            : 0;
        boolean exceeded = turnover > settings.getMaxTurnoverPct();
        if (exceeded) {
            log.warn("Planned turnover {}% exceeds the {}% guideline", String.format("%.1f", turnover),
                formatNumber(settings.getMaxTurnoverPct()));
        }
        return new TradePlan(trades, available, investable, remaining, turnover, exceeded);
    }

    private static RecommendedTrade trade(int priority, TradeType type, HoldingReview r, long shares, String reason) {
        return new RecommendedTrade(priority, type, r.ticker(), r.companyName(), r.sector(), shares, r.price(),
            shares * r.price(), reason, r.newConviction(), r.conviction().getConvictionLevel());
    }

    private static String signedUpside(Double upside) {
        if (upside == null) return "N/A";
        return String.format("%s%.1f%%", upside > 0 ? "+" : "", upside);
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
