package com.jay.stfunnel.pipeline;

import com.jay.stfunnel.config.ConfigValidator;
import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.entity.Holding;
import com.jay.stfunnel.entity.Portfolio;
import com.jay.stfunnel.layer1_data.MarketDataProvider;
import com.jay.stfunnel.layer1_data.UniverseService;
import com.jay.stfunnel.layer2_scoring.BatchScreener;
import com.jay.stfunnel.layer3_triage.TriageWorkflow;
import com.jay.stfunnel.layer4_conviction.ConvictionSynthesizer;
import com.jay.stfunnel.layer4_conviction.DeepResearchService;
import com.jay.stfunnel.layer4_conviction.DeepResearchService.ResearchTarget;
import com.jay.stfunnel.layer5_construction.PortfolioConstructor;
import com.jay.stfunnel.layer6_rebalance.RebalanceEngine;
import com.jay.stfunnel.layer6_rebalance.RebalanceEngine.HoldingReview;
import com.jay.stfunnel.layer6_rebalance.RebalanceExecutor;
import com.jay.stfunnel.layer7_ledger.AnalysisLedger;
import com.jay.stfunnel.layer7_ledger.PipelineRunLedger;
import com.jay.stfunnel.layer7_ledger.PortfolioLedger;
import com.jay.stfunnel.model.AnalysisTexts;
import com.jay.stfunnel.model.BuildRequest;
import com.jay.stfunnel.model.ConvictionInput;
import com.jay.stfunnel.model.ConvictionResult;
import com.jay.stfunnel.model.ScoreResult;
import com.jay.stfunnel.model.enums.RunType;
import com.jay.stfunnel.model.enums.Strategy;
import com.jay.stfunnel.model.enums.TriageDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monthly review pipeline: re-price and re-score every holding, optionally screen the rest
 * of the universe for replacements, plan trades, and optionally apply them to the ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RebalancePipeline {

    static final double NEW_CANDIDATE_MIN_SCORE = 55;
    static final int NEW_CANDIDATE_TIER1_MAX = 50;
    static final int NEW_CANDIDATE_TIER2_INPUT = 30;
    private static final double DEFAULT_PRIOR_CONVICTION = 50;

    private final ConfigValidator validator;
    private final FunnelConfig config;
    private final MarketDataProvider marketData;
    private final UniverseService universe;
    private final BatchScreener screener;
    private final TriageWorkflow triage;
    private final DeepResearchService research;
    private final ConvictionSynthesizer synthesizer;
    private final PortfolioConstructor constructor;
    private final RebalanceEngine engine;
    private final RebalanceExecutor executor;
    private final PipelineRunLedger runLedger;
    private final AnalysisLedger analysisLedger;
    private final PortfolioLedger portfolioLedger;

    public record ReviewResult(String runId,
                               Long portfolioId,
                               Strategy strategy,
                               double totalValue,
                               List<HoldingReview> reviews,
                               List<ConvictionResult> newCandidates,
                               RebalanceEngine.TradePlan plan,
                               RebalanceExecutor.ExecutionResult execution,
                               PortfolioLedger.PortfolioSummary after) {}

    /**
     * @param strategyOverride null keeps the portfolio's own strategy
     * @param settings         null uses the configured rebalance defaults
     */
    public ReviewResult review(Long portfolioId, Strategy strategyOverride, FunnelConfig.Rebalance settings) {
        Portfolio portfolio = portfolioLedger.getPortfolio(portfolioId);
        Strategy strategy = strategyOverride != null ? strategyOverride : portfolio.getStrategy();
        FunnelConfig.Rebalance s = settings != null ? settings : config.rebalance().copy();

        String runId = runLedger.start(RunType.MONTHLY_REVIEW, strategy, portfolioId, s);
        try {
            validator.validate(s);
            log.info("=== MONTHLY REVIEW {} of portfolio {} ({}) ===", runId, portfolioId, strategy.label());

            // ── Re-price ───────────────────────────────────────────────────
            List<Holding> holdings = portfolioLedger.holdings(portfolioId);
            Map<String, Double> prices = new LinkedHashMap<>();
            for (Holding h : holdings) prices.put(h.getTicker(), currentPrice(h));
            double holdingsValue = holdings.stream().mapToDouble(h -> h.getShares() * prices.get(h.getTicker())).sum();
            double cash = portfolio.getCurrentCash();
            double totalValue = cash + holdingsValue;

            // ── Re-score holdings ──────────────────────────────────────────
            List<ResearchTarget> targets = holdings.stream()
                .map(h -> new ResearchTarget(h.getTicker(), h.getCompanyName(), h.getSector(), prices.get(h.getTicker()),
                    h.getConvictionScore() != null ? h.getConvictionScore() : DEFAULT_PRIOR_CONVICTION,
                    TriageDecision.PASS))
                .toList();
            List<ConvictionResult> convictions = s.isRunFullAnalysis()
                ? research.researchAll(targets, strategy)
                : targets.stream().map(t -> neutralConviction(t, strategy)).toList();

            List<HoldingReview> reviews = new ArrayList<>();
            for (int i = 0; i < holdings.size(); i++) {
                Holding h = holdings.get(i);
                HoldingReview review = engine.review(h, prices.get(h.getTicker()), convictions.get(i), totalValue, s);
                reviews.add(review);
                portfolioLedger.updateReview(portfolioId, h.getTicker(), review.price(),
                    review.newConviction(), review.conviction().getConvictionLevel());
                analysisLedger.saveAnalysis(runId, review.conviction(), true, null,
                    "Rebalance Review: " + review.action() + " - " + review.reasoning());
                log.info("  {} {} -> {} ({}{}): {}", h.getTicker(), review.previousConviction(), review.newConviction(),
                    review.convictionDelta() >= 0 ? "+" : "", review.convictionDelta(), review.action());
            }
            runLedger.recordTier3(runId, holdings.size(), reviews.size());

            // ── Replacement candidates ─────────────────────────────────────
            List<ConvictionResult> newCandidates = s.isScreenNewCandidates() && s.getNewCandidateLimit() > 0
                ? screenNewCandidates(runId, strategy, holdings, s)
                : List.of();

            // ── Plan & execute ─────────────────────────────────────────────
            RebalanceEngine.TradePlan plan = engine.buildTrades(reviews, newCandidates, cash, totalValue, s);
            log.info("Plan: {}", plan.summary());

            RebalanceExecutor.ExecutionResult execution = null;
            if (s.isExecuteRecommendations() && !plan.trades().isEmpty()) {
                execution = executor.execute(portfolioId, runId, plan.trades(), cash);
            }
            portfolioLedger.takeSnapshot(portfolioId);
            PortfolioLedger.PortfolioSummary after = portfolioLedger.summary(portfolioId);

            runLedger.complete(runId, after.holdingsCount());
            return new ReviewResult(runId, portfolioId, strategy, totalValue, reviews, newCandidates, plan, execution, after);
        } catch (RuntimeException e) {
            runLedger.fail(runId, e.getMessage());
            throw e;
        }
    }

    private List<ConvictionResult> screenNewCandidates(String runId, Strategy strategy, List<Holding> holdings,
                                                       FunnelConfig.Rebalance s) {
        String newRunId = runId + "-NEW";
        int limit = s.getNewCandidateLimit();
        List<String> tickers = universe.tickersExcluding(holdings.stream().map(Holding::getTicker).toList());
        log.info("Screening {} tickers for up to {} replacement candidates", tickers.size(), limit);

        BatchScreener.Tier1Criteria criteria = BatchScreener.Tier1Criteria
            .from(config, BuildRequest.defaults(config, strategy))
            .withLimits(NEW_CANDIDATE_MIN_SCORE, NEW_CANDIDATE_TIER1_MAX);
        BatchScreener.Tier1Result tier1 = screener.screen(tickers, strategy, criteria);
        runLedger.recordTier1(runId, tier1.totalScreened(), tier1.candidates().size());
        analysisLedger.saveScores(newRunId, strategy, tier1.allScores());

        List<ScoreResult> triageInput =
            tier1.candidates().subList(0, Math.min(NEW_CANDIDATE_TIER2_INPUT, tier1.candidates().size()));
        TriageWorkflow.Tier2Result tier2 = triage.run(triageInput, limit * 2);
        runLedger.recordTier2(runId, triageInput.size(), tier2.finalists().size());
        analysisLedger.saveTriageDecisions(newRunId, tier2);

        DeepResearchService.Tier3Result tier3 = research.run(
            tier2.finalists().subList(0, Math.min(limit, tier2.finalists().size())), strategy);
        PortfolioConstructor.Construction selection =
            constructor.construct(tier3.results(), s.getMaxBuysPerReview(), s.getBuyThreshold());
        for (ConvictionResult c : tier3.results()) {
            analysisLedger.saveAnalysis(newRunId, c, selection.isSelected(c.getTicker()),
                selection.rejectionReason(c.getTicker()), c.getReasoning());
        }
        return selection.selected();
    }

    private ConvictionResult neutralConviction(ResearchTarget target, Strategy strategy) {
        return synthesizer.synthesize(new ConvictionInput(target.ticker(), target.companyName(), target.sector(),
            target.price(), target.tier1Score(), target.tier2Decision(), AnalysisTexts.empty()), strategy);
    }

    /** Fresh quote, else the last stored price, else the cost basis. */
    double currentPrice(Holding holding) {
        try {
            Double price = marketData.fetchPrice(holding.getTicker());
            if (price != null && price > 0) return price;
        } catch (Exception e) {
            log.warn("Price fetch failed for {}: {}", holding.getTicker(), e.getMessage());
        }
        if (holding.getCurrentPrice() != null && holding.getCurrentPrice() > 0) return holding.getCurrentPrice();
        return holding.getAvgCost();
    }
}
