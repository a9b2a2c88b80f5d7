package com.jay.stfunnel.layer2_scoring;

import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.layer1_data.MarketDataProvider;
import com.jay.stfunnel.model.BuildRequest;
import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.ScoreResult;
import com.jay.stfunnel.model.enums.Strategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Layer 2: Tier 1 screen.
 * Fetches and scores every ticker on a fixed worker pool (provider calls are paced by the
 * shared rate limiter), then applies the Tier 1 filters and the sector-capped ranking.
 * A ticker whose fetch fails is reported as failed; the batch always completes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchScreener {

    private final MarketDataProvider marketData;
    private final StockScorer scorer;
    private final StockRanker ranker;
    private final FunnelConfig config;

    @FunctionalInterface
    public interface ProgressListener {
        ProgressListener NONE = (completed, total, ticker) -> { };

        void onProgress(int completed, int total, String ticker);
    }

    public record FailedTicker(String ticker, String reason) {}

    public record BatchScoreResult(List<ScoreResult> scores, List<FailedTicker> failed) {}

    public record Tier1Criteria(double minScore,
                                int maxCandidates,
                                double maxPe,
                                double minMarketCap,
                                boolean requirePositiveFcf,
                                double maxSectorPct) {

        public static Tier1Criteria from(FunnelConfig config, BuildRequest request) {
            FunnelConfig.Tier1 t1 = config.tier1();
            return new Tier1Criteria(request.getTier1MinScore(), request.getTier1MaxCandidates(),
                t1.getMaxPe(), t1.getMinMarketCap(), t1.isRequirePositiveFcf(), request.getMaxSectorPct());
        }

        public Tier1Criteria withLimits(double newMinScore, int newMaxCandidates) {
            return new Tier1Criteria(newMinScore, newMaxCandidates, maxPe, minMarketCap, requirePositiveFcf, maxSectorPct);
        }
    }

    public record Tier1Result(Strategy strategy,
                              List<ScoreResult> candidates,
                              Map<String, Double> suggestedWeights,
                              List<ScoreResult> allScores,
                              List<FailedTicker> failed,
                              int totalScreened,
                              Map<String, Integer> rejectionBreakdown,
                              Map<String, Integer> sectorBreakdown) {

        public String summary() {
            return String.format("Tier 1 (%s): %d screened, %d scored, %d failed, %d passed. Rejections: %s",
                strategy.label(), totalScreened, allScores.size(), failed.size(), candidates.size(), rejectionBreakdown);
        }
    }

    // ── Single ticker ──────────────────────────────────────────────────────────

    public ScoreResult scoreTicker(String ticker, Strategy strategy) {
        return scorer.score(marketData.fetchCandidate(ticker), strategy);
    }

    // ── Batch scoring ──────────────────────────────────────────────────────────

    public BatchScoreResult scoreBatch(List<String> tickers, Strategy strategy, ProgressListener listener) {
        int total = tickers.size();
        int workers = Math.max(1, Math.min(config.tier1().getConcurrency(), Math.max(1, total)));
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        AtomicInteger completed = new AtomicInteger();
        log.info("Scoring {} tickers ({} strategy) on {} workers", total, strategy.label(), workers);

        try {
            List<CompletableFuture<ScoreResult>> futures = tickers.stream()
                .map(ticker -> CompletableFuture.supplyAsync(() -> {
                    try {
                        Candidate candidate = marketData.fetchCandidate(ticker);
                        return scorer.score(candidate, strategy);
                    } finally {
                        listener.onProgress(completed.incrementAndGet(), total, ticker);
                    }
                }, executor))
                .toList();

            List<ScoreResult> scores = new ArrayList<>();
            List<FailedTicker> failed = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                String ticker = tickers.get(i);
                try {
                    scores.add(futures.get(i).get());
                } catch (ExecutionException | CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Scoring failed for {}: {}", ticker, cause.getMessage());
                    failed.add(new FailedTicker(ticker, String.valueOf(cause.getMessage())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failed.add(new FailedTicker(ticker, "Interrupted"));
                }
            }

            // Stable sort: ties keep universe order
            scores.sort(Comparator.comparingInt(ScoreResult::totalScore).reversed());
            log.info("Scored {}/{} tickers, {} failed", scores.size(), total, failed.size());
            return new BatchScoreResult(scores, failed);
        } finally {
            executor.shutdown();
        }
    }

    // ── Tier 1 screen ──────────────────────────────────────────────────────────

    public Tier1Result screen(List<String> tickers, Strategy strategy, Tier1Criteria criteria) {
        log.info("=== TIER 1: screening {} tickers ({}) ===", tickers.size(), strategy.label());
        BatchScoreResult batch = scoreBatch(tickers, strategy, (done, total, ticker) -> {
            if (done % 25 == 0 || done == total) log.info("Tier 1 progress: {}/{}", done, total);
        });
        Tier1Result result = applyFilters(batch, strategy, criteria);
        log.info(result.summary());
        return result;
    }

    /**
     * Pure filter step. Order of checks per score: lowScore, negativeFCF, highPE, lowMarketCap;
     * survivors then pass through the sector-capped ranking truncated to maxCandidates.
     */
    Tier1Result applyFilters(BatchScoreResult batch, Strategy strategy, Tier1Criteria criteria) {
        Map<String, Integer> rejections = new LinkedHashMap<>();
        rejections.put("lowScore", 0);
        rejections.put("negativeFCF", 0);
        rejections.put("highPE", 0);
        rejections.put("lowMarketCap", 0);

        List<ScoreResult> survivors = new ArrayList<>();
        for (ScoreResult s : batch.scores()) {
            Candidate c = s.candidate();
            if (s.totalScore() < criteria.minScore()) {
                rejections.merge("lowScore", 1, Integer::sum);
            } else if (criteria.requirePositiveFcf() && c.getProfitMargin() != null && c.getProfitMargin() < 0) {
                // margin is the free-cash-flow proxy available at Tier 1
                rejections.merge("negativeFCF", 1, Integer::sum);
            } else if (c.getPeRatio() != null && c.getPeRatio() > 0 && c.getPeRatio() > criteria.maxPe()) {
                rejections.merge("highPE", 1, Integer::sum);
            } else if (c.getMarketCap() != null && c.getMarketCap() < criteria.minMarketCap()) {
                rejections.merge("lowMarketCap", 1, Integer::sum);
            } else {
                survivors.add(s);
            }
        }

        StockRanker.RankingResult ranking =
            ranker.rank(survivors, criteria.maxCandidates(), criteria.maxSectorPct() / 100.0, criteria.minScore());
        rejections.put("sectorLimit", ranking.excludedReasons().getOrDefault("sectorLimit", 0));
        rejections.put("dataError", batch.failed().size());

        List<ScoreResult> candidates = new ArrayList<>();
        Map<String, Double> weights = new LinkedHashMap<>();
        for (StockRanker.RankedStock ranked : ranking.selected()) {
            candidates.add(ranked.score());
            weights.put(ranked.score().ticker(), ranked.weight());
        }

        return new Tier1Result(strategy, candidates, weights, batch.scores(), batch.failed(),
            batch.scores().size() + batch.failed().size(), rejections, ranking.sectorBreakdown());
    }
}
