package com.jay.stfunnel.pipeline;

import com.jay.stfunnel.config.ConfigValidator;
import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.entity.Portfolio;
import com.jay.stfunnel.layer1_data.UniverseService;
import com.jay.stfunnel.layer2_scoring.BatchScreener;
import com.jay.stfunnel.layer3_triage.TriageWorkflow;
import com.jay.stfunnel.layer4_conviction.DeepResearchService;
import com.jay.stfunnel.layer5_construction.PortfolioConstructor;
import com.jay.stfunnel.layer5_construction.PortfolioOptimizer;
import com.jay.stfunnel.layer7_ledger.AnalysisLedger;
import com.jay.stfunnel.layer7_ledger.PipelineRunLedger;
import com.jay.stfunnel.layer7_ledger.PortfolioLedger;
import com.jay.stfunnel.model.BuildRequest;
import com.jay.stfunnel.model.ConvictionResult;
import com.jay.stfunnel.model.enums.RunType;
import com.jay.stfunnel.model.enums.Strategy;
import com.jay.stfunnel.model.enums.TransactionAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Construction pipeline: Tier 1 screen → Tier 2 triage → Tier 3 research → construction.
 *
 * Each stage is a pure call on its layer followed by a separate ledger write. The run
 * record is opened first, so an invalid request still leaves a FAILED run behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioPipeline {

    private final ConfigValidator validator;
    private final FunnelConfig config;
    private final UniverseService universe;
    private final BatchScreener screener;
    private final TriageWorkflow triage;
    private final DeepResearchService research;
    private final PortfolioConstructor constructor;
    private final PortfolioOptimizer optimizer;
    private final PipelineRunLedger runLedger;
    private final AnalysisLedger analysisLedger;
    private final PortfolioLedger portfolioLedger;

    public record BuildResult(String runId,
                              Strategy strategy,
                              Long portfolioId,
                              BatchScreener.Tier1Result tier1,
                              TriageWorkflow.Tier2Result tier2,
                              DeepResearchService.Tier3Result tier3,
                              PortfolioConstructor.Construction construction,
                              PortfolioOptimizer.OptimizedPortfolio optimized,
                              PortfolioLedger.PortfolioSummary summary) {}

    public BuildResult build(BuildRequest request) {
        String runId = runLedger.start(RunType.CONSTRUCTION, request == null ? null : request.getStrategy(), null, request);
        try {
            validator.validate(request);
            Strategy strategy = request.getStrategy();
            log.info("=== PORTFOLIO BUILD {} ({}, ${} capital, {} holdings) ===", runId, strategy.label(),
                String.format("%.0f", request.getInitialCapital()), request.getTargetHoldings());

            // ── Tier 1 ─────────────────────────────────────────────────────
            List<String> tickers = request.getTickers() != null ? request.getTickers() : universe.tickers();
            BatchScreener.Tier1Result tier1 =
                screener.screen(tickers, strategy, BatchScreener.Tier1Criteria.from(config, request));
            runLedger.recordTier1(runId, tier1.totalScreened(), tier1.candidates().size());
            analysisLedger.saveScores(runId, strategy, tier1.allScores());

            // ── Tier 2 ─────────────────────────────────────────────────────
            TriageWorkflow.Tier2Result tier2 = triage.run(tier1.candidates(), request.getTier2MaxFinalists());
            runLedger.recordTier2(runId, tier1.candidates().size(), tier2.finalists().size());
            analysisLedger.saveTriageDecisions(runId, tier2);

            // ── Tier 3 + construction ──────────────────────────────────────
            DeepResearchService.Tier3Result tier3 = research.run(tier2.finalists(), strategy);
            PortfolioConstructor.Construction construction = constructor.construct(
                tier3.results(), request.getTargetHoldings(), request.getTier3MinConviction());
            runLedger.recordTier3(runId, tier2.finalists().size(), construction.selected().size());

            PortfolioOptimizer.OptimizedPortfolio optimized = optimizer.optimize(
                construction.selected(), construction.weights(), PortfolioOptimizer.Constraints.from(request));

            // ── Persistence ────────────────────────────────────────────────
            Long portfolioId = persistPortfolio(runId, request, optimized);
            persistAnalyses(runId, tier3.results(), construction, optimized);

            PortfolioLedger.PortfolioSummary summary = portfolioId == null ? null : portfolioLedger.summary(portfolioId);
            int holdings = summary == null ? 0 : summary.holdingsCount();
            runLedger.complete(runId, holdings);
            log.info("=== BUILD {} COMPLETE: {} holdings, portfolio {} ===", runId, holdings, portfolioId);
            return new BuildResult(runId, strategy, portfolioId, tier1, tier2, tier3, construction, optimized, summary);
        } catch (RuntimeException e) {
            runLedger.fail(runId, e.getMessage());
            throw e;
        }
    }

    private Long persistPortfolio(String runId, BuildRequest request, PortfolioOptimizer.OptimizedPortfolio optimized) {
        List<PortfolioOptimizer.Allocation> funded = optimized.allocations().stream()
            .filter(a -> a.shares() > 0)
            .toList();
        if (funded.isEmpty()) {
            log.warn("Run {} produced no fundable positions, no portfolio created", runId);
            return null;
        }

        double invested = funded.stream().mapToDouble(PortfolioOptimizer.Allocation::investedValue).sum();
        Portfolio portfolio = portfolioLedger.createPortfolio(request, request.getInitialCapital() - invested);
        for (PortfolioOptimizer.Allocation a : funded) {
            ConvictionResult c = a.conviction();
            portfolioLedger.addHolding(portfolio.getId(), a.ticker(), c.getCompanyName(), a.sector(),
                a.shares(), a.price(), c.getConvictionScore(), c.getConvictionLevel());
            portfolioLedger.recordTransaction(portfolio.getId(), a.ticker(), TransactionAction.BUY, a.shares(), a.price(),
                String.format("Initial build: %s conviction (%d/100), weight %.1f%%",
                    c.getConvictionLevel(), c.getConvictionScore(), a.weight()), runId);
        }
        portfolioLedger.takeSnapshot(portfolio.getId());
        return portfolio.getId();
    }

    private void persistAnalyses(String runId, List<ConvictionResult> results,
                                 PortfolioConstructor.Construction construction,
                                 PortfolioOptimizer.OptimizedPortfolio optimized) {
        Map<String, Long> shares = new HashMap<>();
        optimized.allocations().forEach(a -> shares.put(a.ticker(), a.shares()));

        for (ConvictionResult c : results) {
            boolean selected = construction.isSelected(c.getTicker());
            String reason = construction.rejectionReason(c.getTicker());
            if (selected && shares.getOrDefault(c.getTicker(), 0L) == 0) {
                selected = false;
                reason = "Allocation too small for one share";
            }
            analysisLedger.saveAnalysis(runId, c, selected, reason, c.getReasoning());
        }
    }
}
