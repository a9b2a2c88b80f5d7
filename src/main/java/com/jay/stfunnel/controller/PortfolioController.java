package com.jay.stfunnel.controller;

import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.entity.Portfolio;
import com.jay.stfunnel.entity.PortfolioSnapshot;
import com.jay.stfunnel.entity.ScreeningRun;
import com.jay.stfunnel.entity.StockAnalysisRecord;
import com.jay.stfunnel.entity.TransactionRecord;
import com.jay.stfunnel.layer2_scoring.BatchScreener;
import com.jay.stfunnel.layer7_ledger.AnalysisLedger;
import com.jay.stfunnel.layer7_ledger.PipelineRunLedger;
import com.jay.stfunnel.layer7_ledger.PortfolioLedger;
import com.jay.stfunnel.model.BuildRequest;
import com.jay.stfunnel.model.ScoreResult;
import com.jay.stfunnel.model.enums.Strategy;
import com.jay.stfunnel.pipeline.PortfolioPipeline;
import com.jay.stfunnel.pipeline.RebalancePipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for building and reviewing portfolios.
 *
 * Endpoints:
 *   POST /api/portfolios/build              Run the full funnel and persist a new portfolio
 *   POST /api/portfolios/{id}/review        Monthly review of an existing portfolio
 *   GET  /api/portfolios                    All portfolios
 *   GET  /api/portfolios/{id}               Holdings, cash and sector weights
 *   GET  /api/portfolios/{id}/transactions  Trade log
 *   GET  /api/portfolios/{id}/snapshots     Valuation history
 *   GET  /api/portfolios/{id}/runs          Review runs of a portfolio
 *   GET  /api/runs                          Recent pipeline runs
 *   GET  /api/runs/{runId}                  One run with its stage counts
 *   GET  /api/runs/{runId}/analyses         Tier 3 analyses of a run
 *   GET  /api/score/{ticker}                Tier 1 score for a single ticker
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PortfolioController {

    private final FunnelConfig config;
    private final PortfolioPipeline portfolioPipeline;
    private final RebalancePipeline rebalancePipeline;
    private final PortfolioLedger portfolioLedger;
    private final PipelineRunLedger runLedger;
    private final AnalysisLedger analysisLedger;
    private final BatchScreener screener;

    // ── POST /api/portfolios/build ─────────────────────────────────────────────

    @PostMapping("/portfolios/build")
    public ResponseEntity<Map<String, Object>> build(@RequestBody BuildRequest request) {
        PortfolioPipeline.BuildResult result = portfolioPipeline.build(request.withDefaults(config));
        return ResponseEntity.ok(Map.of(
            "runId", result.runId(),
            "strategy", result.strategy().label(),
            "portfolioId", result.portfolioId() == null ? "none" : result.portfolioId(),
            "tier1", result.tier1().summary(),
            "tier2", result.tier2().summary(),
            "tier3", result.tier3().summary(),
            "portfolio", result.optimized().summary(),
            "rejected", result.construction().rejected()
        ));
    }

    // ── POST /api/portfolios/{id}/review ───────────────────────────────────────

    @PostMapping("/portfolios/{id}/review")
    public ResponseEntity<Map<String, Object>> review(@PathVariable Long id,
                                                      @RequestParam(required = false) String strategy,
                                                      @RequestBody(required = false) FunnelConfig.Rebalance settings) {
        RebalancePipeline.ReviewResult result = rebalancePipeline.review(id, Strategy.parse(strategy), settings);
        return ResponseEntity.ok(Map.of(
            "runId", result.runId(),
            "strategy", result.strategy().label(),
            "totalValue", result.totalValue(),
            "reviews", result.reviews(),
            "trades", result.plan().trades(),
            "plan", result.plan().summary(),
            "executed", result.execution() == null ? List.of() : result.execution().executed(),
            "portfolio", result.after()
        ));
    }

    // ── GET /api/portfolios ────────────────────────────────────────────────────

    @GetMapping("/portfolios")
    public ResponseEntity<List<Portfolio>> portfolios() {
        return ResponseEntity.ok(portfolioLedger.allPortfolios());
    }

    // ── GET /api/portfolios/{id} ───────────────────────────────────────────────

    @GetMapping("/portfolios/{id}")
    public ResponseEntity<PortfolioLedger.PortfolioSummary> portfolio(@PathVariable Long id) {
        return ResponseEntity.ok(portfolioLedger.summary(id));
    }

    @GetMapping("/portfolios/{id}/transactions")
    public ResponseEntity<List<TransactionRecord>> transactions(@PathVariable Long id) {
        portfolioLedger.getPortfolio(id);
        return ResponseEntity.ok(portfolioLedger.transactions(id));
    }

    @GetMapping("/portfolios/{id}/snapshots")
    public ResponseEntity<List<PortfolioSnapshot>> snapshots(@PathVariable Long id) {
        portfolioLedger.getPortfolio(id);
        return ResponseEntity.ok(portfolioLedger.snapshots(id));
    }

    @GetMapping("/portfolios/{id}/runs")
    public ResponseEntity<List<ScreeningRun>> portfolioRuns(@PathVariable Long id) {
        portfolioLedger.getPortfolio(id);
        return ResponseEntity.ok(runLedger.forPortfolio(id));
    }

    // ── GET /api/runs ──────────────────────────────────────────────────────────

    @GetMapping("/runs")
    public ResponseEntity<List<ScreeningRun>> runs(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(runLedger.recent(limit));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<ScreeningRun> run(@PathVariable String runId) {
        return runLedger.find(runId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/runs/{runId}/analyses")
    public ResponseEntity<List<StockAnalysisRecord>> analyses(@PathVariable String runId) {
        return ResponseEntity.ok(analysisLedger.analyses(runId));
    }

    // ── GET /api/score/{ticker} ────────────────────────────────────────────────

    @GetMapping("/score/{ticker}")
    public ResponseEntity<ScoreResult> score(@PathVariable String ticker,
                                             @RequestParam(defaultValue = "balanced") String strategy) {
        return ResponseEntity.ok(screener.scoreTicker(ticker, Strategy.parse(strategy)));
    }
}
