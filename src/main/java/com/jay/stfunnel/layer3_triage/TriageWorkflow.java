package com.jay.stfunnel.layer3_triage;

import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.layer1_data.MarketDataProvider;
import com.jay.stfunnel.model.ScoreResult;
import com.jay.stfunnel.model.TriageVerdict;
import com.jay.stfunnel.model.enums.TriageDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Layer 3: Tier 2 triage run.
 * Fetches the check bundle for each Tier 1 candidate in small concurrent batches,
 * classifies it, and selects the finalists for deep research.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriageWorkflow {

    private final MarketDataProvider marketData;
    private final TriageEngine engine;
    private final FunnelConfig config;

    /**
     * @param allVerdicts rule-table verdicts in input order
     * @param overflow    tickers that qualified but were cut by the finalist limit
     */
    public record Tier2Result(List<TriageVerdict> finalists,
                              List<TriageVerdict> rejected,
                              List<TriageVerdict> needsReview,
                              List<TriageVerdict> allVerdicts,
                              Set<String> overflow) {

        public TriageDecision finalDecision(TriageVerdict verdict) {
            return overflow.contains(verdict.getTicker()) ? TriageDecision.REJECT : verdict.getDecision();
        }

        public long count(TriageDecision decision) {
            return allVerdicts.stream().filter(v -> v.getDecision() == decision).count();
        }

        public String summary() {
            return String.format("Tier 2: %d triaged, %d finalists (%d fast-track), %d rejected, %d for review",
                allVerdicts.size(), finalists.size(), count(TriageDecision.FAST_TRACK), rejected.size(), needsReview.size());
        }
    }

    public Tier2Result run(List<ScoreResult> candidates, int maxFinalists) {
        log.info("=== TIER 2: triaging {} candidates (max {} finalists) ===", candidates.size(), maxFinalists);
        List<TriageVerdict> verdicts = triageAll(candidates);
        Tier2Result result = selectFinalists(verdicts, maxFinalists);
        log.info(result.summary());
        return result;
    }

    /** Verdicts in candidate order. Never throws for a single ticker. */
    public List<TriageVerdict> triageAll(List<ScoreResult> candidates) {
        int batchSize = Math.max(1, config.tier2().getBatchSize());
        ExecutorService executor = Executors.newFixedThreadPool(batchSize);
        List<TriageVerdict> verdicts = new ArrayList<>();
        try {
            for (int start = 0; start < candidates.size(); start += batchSize) {
                List<ScoreResult> batch = candidates.subList(start, Math.min(start + batchSize, candidates.size()));
                List<CompletableFuture<TriageVerdict>> futures = batch.stream()
                    .map(s -> CompletableFuture.supplyAsync(() -> triageOne(s), executor))
                    .toList();
                for (int i = 0; i < futures.size(); i++) {
                    verdicts.add(join(futures.get(i), batch.get(i)));
                }
                log.debug("Tier 2 progress: {}/{}", verdicts.size(), candidates.size());
            }
        } finally {
            executor.shutdown();
        }
        return verdicts;
    }

    TriageVerdict triageOne(ScoreResult score) {
        try {
            return engine.evaluate(score.sector(), score.totalScore(), marketData.fetchTriageChecks(score.ticker()));
        } catch (Exception e) {
            log.warn("Triage checks failed for {}: {}", score.ticker(), e.getMessage());
            return engine.providerFailure(score.ticker(), score.companyName(), score.sector(),
                score.totalScore(), String.valueOf(e.getMessage()));
        }
    }

    private TriageVerdict join(CompletableFuture<TriageVerdict> future, ScoreResult score) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return engine.providerFailure(score.ticker(), score.companyName(), score.sector(), score.totalScore(), "Interrupted");
        } catch (Exception e) {
            return engine.providerFailure(score.ticker(), score.companyName(), score.sector(),
                score.totalScore(), String.valueOf(e.getMessage()));
        }
    }

    /**
     * FAST_TRACK first, then descending Tier 1 score, ties in input order; truncated to maxFinalists.
     * Qualified names beyond the limit are reclassified REJECT with an explicit reason.
     */
    public Tier2Result selectFinalists(List<TriageVerdict> verdicts, int maxFinalists) {
        List<TriageVerdict> qualified = new ArrayList<>(verdicts.stream()
            .filter(v -> v.getDecision().isFinalist())
            .toList());
        qualified.sort(Comparator
            .comparing((TriageVerdict v) -> v.getDecision() == TriageDecision.FAST_TRACK ? 0 : 1)
            .thenComparing(Comparator.comparingInt(TriageVerdict::getTier1Score).reversed()));

        List<TriageVerdict> finalists = new ArrayList<>();
        List<TriageVerdict> overflow = new ArrayList<>();
        Set<String> overflowTickers = new LinkedHashSet<>();
        for (TriageVerdict v : qualified) {
            if (finalists.size() < maxFinalists) {
                finalists.add(v);
            } else {
                overflow.add(v.withDecision(TriageDecision.REJECT,
                    "Exceeded max finalists limit (" + maxFinalists + ")"));
                overflowTickers.add(v.getTicker());
            }
        }

        List<TriageVerdict> rejected = new ArrayList<>(verdicts.stream()
            .filter(v -> v.getDecision() == TriageDecision.REJECT)
            .toList());
        rejected.addAll(overflow);
        List<TriageVerdict> needsReview = verdicts.stream()
            .filter(v -> v.getDecision() == TriageDecision.NEEDS_REVIEW)
            .toList();
        return new Tier2Result(finalists, rejected, needsReview, List.copyOf(verdicts), overflowTickers);
    }
}
