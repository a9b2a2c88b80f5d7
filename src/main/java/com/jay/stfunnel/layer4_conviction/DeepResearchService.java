package com.jay.stfunnel.layer4_conviction;

import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.layer1_data.QualitativeAnalysisProvider;
import com.jay.stfunnel.model.AnalysisTexts;
import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.ConvictionInput;
import com.jay.stfunnel.model.ConvictionResult;
import com.jay.stfunnel.model.TriageVerdict;
import com.jay.stfunnel.model.enums.AnalysisKind;
import com.jay.stfunnel.model.enums.Strategy;
import com.jay.stfunnel.model.enums.TriageDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Layer 4: Tier 3 deep research.
 * For each ticker the five qualitative analyses are requested concurrently and joined,
 * then handed to the {@link ConvictionSynthesizer}. Tickers are processed in small
 * concurrent batches to bound the number of outstanding provider calls.
 *
 * An analysis that errors or exceeds the timeout is treated as absent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeepResearchService {

    private final QualitativeAnalysisProvider analyst;
    private final ConvictionSynthesizer synthesizer;
    private final FunnelConfig config;

    /** One ticker to research, from a triage verdict or an existing holding. */
    public record ResearchTarget(String ticker,
                                 String companyName,
                                 String sector,
                                 Double price,
                                 double tier1Score,
                                 TriageDecision tier2Decision) {

        public static ResearchTarget from(TriageVerdict verdict) {
            return new ResearchTarget(verdict.getTicker(), verdict.getCompanyName(), verdict.getSector(),
                verdict.getPrice(), verdict.getTier1Score(), verdict.getDecision());
        }

        Candidate toCandidate() {
            return Candidate.builder().ticker(ticker).companyName(companyName).sector(sector).price(price).build();
        }
    }

    public record Tier3Result(List<ConvictionResult> results, int fallbackCount) {

        /** Highest conviction first; ties keep input order. */
        public List<ConvictionResult> ranked() {
            List<ConvictionResult> sorted = new ArrayList<>(results);
            sorted.sort(Comparator.comparingInt(ConvictionResult::getConvictionScore).reversed());
            return sorted;
        }

        public String summary() {
            return String.format("Tier 3: %d analysed, %d fell back to Tier 1 score", results.size(), fallbackCount);
        }
    }

    public Tier3Result run(List<TriageVerdict> finalists, Strategy strategy) {
        log.info("=== TIER 3: deep research on {} finalists ({}) ===", finalists.size(), strategy.label());
        List<ConvictionResult> results = researchAll(finalists.stream().map(ResearchTarget::from).toList(), strategy);
        Tier3Result result = new Tier3Result(results, (int) results.stream().filter(ConvictionResult::isFallback).count());
        log.info(result.summary());
        return result;
    }

    /** Results in input order. Never throws for a single ticker. */
    public List<ConvictionResult> researchAll(List<ResearchTarget> targets, Strategy strategy) {
        int batchSize = Math.max(1, config.tier3().getBatchSize());
        ExecutorService tickerPool = Executors.newFixedThreadPool(batchSize);
        ExecutorService analysisPool = Executors.newFixedThreadPool(batchSize * AnalysisKind.values().length);
        List<ConvictionResult> results = new ArrayList<>();
        try {
            for (int start = 0; start < targets.size(); start += batchSize) {
                List<ResearchTarget> batch = targets.subList(start, Math.min(start + batchSize, targets.size()));
                List<CompletableFuture<ConvictionResult>> futures = batch.stream()
                    .map(t -> CompletableFuture.supplyAsync(() -> research(t, strategy, analysisPool), tickerPool))
                    .toList();
                for (int i = 0; i < futures.size(); i++) {
                    results.add(join(futures.get(i), batch.get(i), strategy));
                }
                log.info("Tier 3 progress: {}/{}", results.size(), targets.size());
            }
        } finally {
            tickerPool.shutdown();
            analysisPool.shutdownNow();
        }
        return results;
    }

    public ConvictionResult research(ResearchTarget target, Strategy strategy) {
        ExecutorService pool = Executors.newFixedThreadPool(AnalysisKind.values().length);
        try {
            return research(target, strategy, pool);
        } finally {
            pool.shutdownNow();
        }
    }

    ConvictionResult research(ResearchTarget target, Strategy strategy, ExecutorService pool) {
        ConvictionInput input = toInput(target, AnalysisTexts.empty());
        try {
            AnalysisTexts texts = gatherTexts(target, pool);
            log.debug("{}: {}/5 analyses available", target.ticker(), texts.availableCount());
            return synthesizer.synthesize(toInput(target, texts), strategy);
        } catch (Exception e) {
            log.warn("Deep research failed for {}: {}", target.ticker(), e.getMessage());
            return synthesizer.fallback(input, strategy, String.valueOf(e.getMessage()));
        }
    }

    // ── Analysis fan-out ───────────────────────────────────────────────────────

    AnalysisTexts gatherTexts(ResearchTarget target, ExecutorService pool) {
        Candidate candidate = target.toCandidate();
        Map<AnalysisKind, CompletableFuture<String>> futures = new EnumMap<>(AnalysisKind.class);
        for (AnalysisKind kind : AnalysisKind.values()) {
            futures.put(kind, CompletableFuture.supplyAsync(() -> analyst.analyse(candidate, kind).orElse(null), pool));
        }

        long timeout = config.tier3().getAnalysisTimeoutSeconds();
        Map<AnalysisKind, String> texts = new EnumMap<>(AnalysisKind.class);
        for (Map.Entry<AnalysisKind, CompletableFuture<String>> entry : futures.entrySet()) {
            texts.put(entry.getKey(), await(entry.getValue(), timeout, target.ticker(), entry.getKey()));
        }
        return AnalysisTexts.of(texts);
    }

    private String await(CompletableFuture<String> future, long timeoutSeconds, String ticker, AnalysisKind kind) {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} analysis for {} timed out after {}s", kind, ticker, timeoutSeconds);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (Exception e) {
            log.warn("{} analysis for {} failed: {}", kind, ticker, e.getMessage());
            return null;
        }
    }

    private ConvictionResult join(CompletableFuture<ConvictionResult> future, ResearchTarget target, Strategy strategy) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return synthesizer.fallback(toInput(target, AnalysisTexts.empty()), strategy, "Interrupted");
        } catch (Exception e) {
            return synthesizer.fallback(toInput(target, AnalysisTexts.empty()), strategy, String.valueOf(e.getMessage()));
        }
    }

    private static ConvictionInput toInput(ResearchTarget target, AnalysisTexts texts) {
        return new ConvictionInput(target.ticker(), target.companyName(), target.sector(), target.price(),
            target.tier1Score(), target.tier2Decision(), texts);
    }
}
