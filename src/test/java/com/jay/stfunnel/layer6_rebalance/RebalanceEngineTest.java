package com.jay.stfunnel.layer6_rebalance;

import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.entity.Holding;
import com.jay.stfunnel.model.ConvictionResult;
import com.jay.stfunnel.model.enums.ConvictionLevel;
import com.jay.stfunnel.model.enums.HoldingAction;
import com.jay.stfunnel.model.enums.TradeType;
import com.jay.stfunnel.model.enums.TransactionAction;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RebalanceEngineTest {

    private final RebalanceEngine engine = new RebalanceEngine();
    private final FunnelConfig.Rebalance settings = new FunnelConfig.Rebalance();

    private static Holding holding(String ticker, long shares, double price, Integer previousConviction) {
        return Holding.builder()
            .portfolioId(1L).ticker(ticker).companyName(ticker + " Inc").sector("Technology")
            .shares(shares).avgCost(price).currentPrice(price).convictionScore(previousConviction)
            .build();
    }

    private static ConvictionResult conviction(String ticker, int score) {
        return ConvictionResult.builder()
            .ticker(ticker).convictionScore(score).convictionLevel(ConvictionLevel.of(score))
            .suggestedWeight(ConvictionLevel.of(score).suggestedWeight())
            .maxWeight(ConvictionLevel.of(score).maxWeight())
            .build();
    }

    private static ConvictionResult candidate(String ticker, int score, double price, double weight, Double upside) {
        return conviction(ticker, score).toBuilder()
            .companyName(ticker + " Corp").sector("Healthcare").price(price)
            .suggestedWeight(weight).compositeUpside(upside)
            .build();
    }

    private RebalanceEngine.HoldingReview review(Holding h, int newConviction, double totalValue) {
        return engine.review(h, h.getCurrentPrice(), conviction(h.getTicker(), newConviction), totalValue, settings);
    }

    @Test
    void convictionBelowSellThresholdSells() {
        RebalanceEngine.HoldingReview r = review(holding("FALL", 50, 100, 65), 38, 100_000);

        assertThat(r.action()).isEqualTo(HoldingAction.SELL);
        assertThat(r.reasoning()).isEqualTo("Conviction dropped to 38 (below 40 threshold)");
        assertThat(r.previousConviction()).isEqualTo(65);
        assertThat(r.convictionDelta()).isEqualTo(-27);
        assertThat(r.weight()).isEqualTo(5.0);
    }

    @Test
    void classificationTable() {
        assertThat(engine.classify(45, 5, settings).action()).isEqualTo(HoldingAction.TRIM);
        assertThat(engine.classify(45, 5, settings).reasoning()).isEqualTo("Low conviction (45), consider reducing position");

        RebalanceEngine.Classification oversized = engine.classify(65, 12.34, settings);
        assertThat(oversized.action()).isEqualTo(HoldingAction.TRIM);
        assertThat(oversized.reasoning()).isEqualTo("Position oversized (12.3%) with moderate conviction");

        assertThat(engine.classify(75, 12, settings).action()).isEqualTo(HoldingAction.HOLD);

        RebalanceEngine.Classification undersized = engine.classify(70, 1.5, settings);
        assertThat(undersized.action()).isEqualTo(HoldingAction.ADD);
        assertThat(undersized.reasoning()).isEqualTo("Undersized position (1.5%) with high conviction");

        assertThat(engine.classify(60, 5, settings).reasoning()).isEqualTo("Conviction 60/100 - maintain position");
    }

    @Test
    void noPriorConvictionMeansZeroDelta() {
        RebalanceEngine.HoldingReview r = review(holding("NEW", 10, 100, null), 55, 100_000);

        assertThat(r.previousConviction()).isNull();
        assertThat(r.convictionDelta()).isZero();
    }

    @Test
    void planOrdersSellTrimAddBuyAndFundsFromProceeds() {
        double total = 100_000;
        List<RebalanceEngine.HoldingReview> reviews = List.of(
            review(holding("SELLME", 100, 50, 55), 30, total),
            review(holding("BIG", 150, 100, 60), 60, total),
            review(holding("SMALL", 10, 100, 72), 75, total),
            review(holding("OK", 100, 100, 60), 62, total));
        List<ConvictionResult> candidates = List.of(
            candidate("LOWC", 55, 40, 4, 5.0),
            candidate("NEW1", 72, 50, 6, 15.0));

        RebalanceEngine.TradePlan plan = engine.buildTrades(reviews, candidates, 2_000, total, settings);

        assertThat(plan.trades()).extracting(RebalanceEngine.RecommendedTrade::type)
            .containsExactly(TradeType.SELL, TradeType.TRIM, TradeType.ADD, TradeType.BUY);
        assertThat(plan.trades()).extracting(RebalanceEngine.RecommendedTrade::priority).containsExactly(1, 2, 3, 4);

        Map<String, RebalanceEngine.RecommendedTrade> byTicker = plan.trades().stream()
            .collect(Collectors.toMap(RebalanceEngine.RecommendedTrade::ticker, Function.identity()));
        assertThat(byTicker.get("SELLME").shares()).isEqualTo(100);
        assertThat(byTicker.get("BIG").shares()).isEqualTo(70);
        assertThat(byTicker.get("SMALL").shares()).isEqualTo(20);
        assertThat(byTicker.get("NEW1").shares()).isEqualTo(120);
        assertThat(byTicker.get("NEW1").reason()).isEqualTo("Full analysis: HIGH conviction (72/100), Upside: +15.0%");
        assertThat(byTicker).doesNotContainKey("LOWC");

        assertThat(plan.availableCash()).isEqualTo(14_000);
        assertThat(plan.investableCash()).isEqualTo(9_000);
        assertThat(plan.remainingCash()).isEqualTo(1_000);
        assertThat(plan.turnoverPct()).isCloseTo(20.0, within(1e-9));
        assertThat(plan.turnoverExceeded()).isFalse();
    }

    @Test
    void neverOversellsNorOverspends() {
        double total = 50_000;
        List<RebalanceEngine.HoldingReview> reviews = List.of(
            review(holding("A", 3, 1_000, 50), 10, total),
            review(holding("B", 400, 50, 50), 45, total),
            review(holding("C", 1, 300, 90), 95, total));
        List<ConvictionResult> candidates = List.of(
            candidate("X", 90, 7.5, 10, 40.0),
            candidate("Y", 85, 120, 8, null),
            candidate("Z", 80, 33, 0, -2.0));

        RebalanceEngine.TradePlan plan = engine.buildTrades(reviews, candidates, 500, total, settings);

        Map<String, Long> held = Map.of("A", 3L, "B", 400L, "C", 1L);
        plan.trades().stream()
            .filter(t -> t.type().side() == TransactionAction.SELL)
            .forEach(t -> assertThat(t.shares()).isLessThanOrEqualTo(held.get(t.ticker())));

        double spent = plan.trades().stream()
            .filter(t -> t.type().side() == TransactionAction.BUY)
            .mapToDouble(RebalanceEngine.RecommendedTrade::value).sum();
        assertThat(spent).isLessThanOrEqualTo(plan.investableCash() + 1e-6);
        assertThat(plan.remainingCash()).isGreaterThanOrEqualTo(-1e-6);
        assertThat(plan.ofType(TradeType.BUY).size()).isLessThanOrEqualTo(settings.getMaxBuysPerReview());
    }

    @Test
    void sellCountIsCappedLowestConvictionFirst() {
        double total = 100_000;
        List<RebalanceEngine.HoldingReview> reviews = List.of(
            review(holding("S1", 10, 100, 50), 35, total),
            review(holding("S2", 10, 100, 50), 10, total),
            review(holding("S3", 10, 100, 50), 25, total),
            review(holding("S4", 10, 100, 50), 5, total));

        RebalanceEngine.TradePlan plan = engine.buildTrades(reviews, List.of(), 0, total, settings);

        assertThat(plan.ofType(TradeType.SELL)).extracting(RebalanceEngine.RecommendedTrade::ticker)
            .containsExactly("S4", "S2", "S3");
    }

    @Test
    void turnoverAboveGuidelineIsFlaggedNotBlocked() {
        double total = 100_000;
        List<RebalanceEngine.HoldingReview> reviews = List.of(review(holding("BIG", 300, 100, 60), 20, total));

        RebalanceEngine.TradePlan plan = engine.buildTrades(reviews, List.of(), 70_000, total, settings);

        assertThat(plan.ofType(TradeType.SELL)).hasSize(1);
        assertThat(plan.turnoverPct()).isCloseTo(30.0, within(1e-9));
        assertThat(plan.turnoverExceeded()).isTrue();
        assertThat(plan.summary()).startsWith("1 trades (1 sell, 0 trim, 0 add, 0 buy)");
    }
}
