package com.jay.stfunnel.pipeline;

import com.jay.stfunnel.config.ConfigValidator;
import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.entity.Holding;
import com.jay.stfunnel.entity.Portfolio;
import com.jay.stfunnel.exception.MarketDataException;
import com.jay.stfunnel.exception.PipelineValidationException;
import com.jay.stfunnel.layer1_data.MarketDataProvider;
import com.jay.stfunnel.layer1_data.UniverseService;
import com.jay.stfunnel.layer2_scoring.BatchScreener;
import com.jay.stfunnel.layer3_triage.TriageWorkflow;
import com.jay.stfunnel.layer4_conviction.ConvictionSynthesizer;
import com.jay.stfunnel.layer4_conviction.DeepResearchService;
import com.jay.stfunnel.layer4_conviction.RegexSignalExtractor;
import com.jay.stfunnel.layer5_construction.PortfolioConstructor;
import com.jay.stfunnel.layer6_rebalance.RebalanceEngine;
import com.jay.stfunnel.layer6_rebalance.RebalanceExecutor;
import com.jay.stfunnel.layer7_ledger.AnalysisLedger;
import com.jay.stfunnel.layer7_ledger.PipelineRunLedger;
import com.jay.stfunnel.layer7_ledger.PortfolioLedger;
import com.jay.stfunnel.model.ConvictionResult;
import com.jay.stfunnel.model.enums.ConvictionLevel;
import com.jay.stfunnel.model.enums.HoldingAction;
import com.jay.stfunnel.model.enums.RunType;
import com.jay.stfunnel.model.enums.Strategy;
import com.jay.stfunnel.model.enums.TradeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RebalancePipelineTest {

    private static final String RUN = "REB-3-1";

    @Mock private MarketDataProvider marketData;
    @Mock private UniverseService universe;
    @Mock private BatchScreener screener;
    @Mock private TriageWorkflow triage;
    @Mock private DeepResearchService research;
    @Mock private RebalanceExecutor executor;
    @Mock private PipelineRunLedger runLedger;
    @Mock private AnalysisLedger analysisLedger;
    @Mock private PortfolioLedger portfolioLedger;

    private final FunnelConfig config = new FunnelConfig();
    private RebalancePipeline pipeline;
    private Holding acme;

    @BeforeEach
    void setUp() {
        pipeline = new RebalancePipeline(new ConfigValidator(), config, marketData, universe, screener, triage, research,
            new ConvictionSynthesizer(new RegexSignalExtractor()), new PortfolioConstructor(), new RebalanceEngine(),
            executor, runLedger, analysisLedger, portfolioLedger);
        acme = Holding.builder().portfolioId(3L).ticker("ACME").companyName("Acme Corp").sector("Industrials")
            .shares(10).avgCost(80).currentPrice(90.0).convictionScore(70).convictionLevel(ConvictionLevel.HIGH).build();
    }

    private FunnelConfig.Rebalance settings(boolean fullAnalysis, boolean execute) {
        FunnelConfig.Rebalance s = config.rebalance().copy();
        s.setRunFullAnalysis(fullAnalysis);
        s.setScreenNewCandidates(false);
        s.setExecuteRecommendations(execute);
        return s;
    }

    private void stubPortfolio() {
        when(portfolioLedger.getPortfolio(3L)).thenReturn(
            Portfolio.builder().id(3L).strategy(Strategy.BALANCED).currentCash(1_000).build());
    }

    private void stubHoldingsAndSummary() {
        when(runLedger.start(eq(RunType.MONTHLY_REVIEW), eq(Strategy.BALANCED), eq(3L), any())).thenReturn(RUN);
        when(portfolioLedger.holdings(3L)).thenReturn(List.of(acme));
        when(portfolioLedger.summary(3L)).thenReturn(new PortfolioLedger.PortfolioSummary(
            null, List.of(acme), 900, 1_000, 1_900, 1, 50, Map.of(), 0));
    }

    @Test
    void neutralReviewPlansATrimWithoutTrading() {
        stubPortfolio();
        stubHoldingsAndSummary();
        when(marketData.fetchPrice("ACME")).thenThrow(new MarketDataException("ACME", "timeout"));

        RebalancePipeline.ReviewResult result = pipeline.review(3L, null, settings(false, false));

        assertThat(result.totalValue()).isEqualTo(1_900);
        assertThat(result.reviews()).singleElement().satisfies(r -> {
            assertThat(r.price()).isEqualTo(90);
            assertThat(r.previousConviction()).isEqualTo(70);
            assertThat(r.action()).isEqualTo(HoldingAction.TRIM);
        });
        assertThat(result.plan().trades()).singleElement().satisfies(t -> {
            assertThat(t.type()).isEqualTo(TradeType.TRIM);
            assertThat(t.shares()).isEqualTo(8);
        });
        assertThat(result.execution()).isNull();
        verifyNoInteractions(research, screener, executor);
        verify(portfolioLedger).updateReview(eq(3L), eq("ACME"), eq(90.0), anyInt(), any());
        verify(analysisLedger).saveAnalysis(eq(RUN), any(), eq(true), isNull(), startsWith("Rebalance Review: TRIM - "));
        verify(portfolioLedger).takeSnapshot(3L);
        verify(runLedger).recordTier3(RUN, 1, 1);
        verify(runLedger).complete(RUN, 1);
    }

    @Test
    void fullAnalysisSellIsExecuted() {
        stubPortfolio();
        stubHoldingsAndSummary();
        when(marketData.fetchPrice("ACME")).thenReturn(95.0);
        ConvictionResult weak = ConvictionResult.builder().ticker("ACME").companyName("Acme Corp").sector("Industrials")
            .price(95.0).convictionScore(30).convictionLevel(ConvictionLevel.VERY_LOW).build();
        when(research.researchAll(any(), eq(Strategy.BALANCED))).thenReturn(List.of(weak));
        RebalanceExecutor.ExecutionResult execution = new RebalanceExecutor.ExecutionResult(List.of(), List.of(), 1_950);
        when(executor.execute(eq(3L), eq(RUN), any(), eq(1_000.0))).thenReturn(execution);

        RebalancePipeline.ReviewResult result = pipeline.review(3L, null, settings(true, true));

        assertThat(result.totalValue()).isEqualTo(1_950);
        assertThat(result.reviews().get(0).convictionDelta()).isEqualTo(-40);
        assertThat(result.reviews().get(0).reasoning()).isEqualTo("Conviction dropped to 30 (below 40 threshold)");
        assertThat(result.execution()).isSameAs(execution);
        verify(executor).execute(eq(3L), eq(RUN),
            argThat(trades -> trades.size() == 1 && trades.get(0).type() == TradeType.SELL && trades.get(0).shares() == 10),
            eq(1_000.0));
    }

    @Test
    void strategyOverrideIsPassedToTheRun() {
        stubPortfolio();
        when(runLedger.start(eq(RunType.MONTHLY_REVIEW), eq(Strategy.GROWTH), eq(3L), any())).thenReturn(RUN);
        when(portfolioLedger.holdings(3L)).thenReturn(List.of());
        when(portfolioLedger.summary(3L)).thenReturn(new PortfolioLedger.PortfolioSummary(
            null, List.of(), 0, 1_000, 1_000, 0, 0, Map.of(), 0));

        RebalancePipeline.ReviewResult result = pipeline.review(3L, Strategy.GROWTH, settings(true, true));

        assertThat(result.strategy()).isEqualTo(Strategy.GROWTH);
        assertThat(result.plan().trades()).isEmpty();
        verify(executor, never()).execute(any(), any(), any(), anyDouble());
    }

    @Test
    void invalidSettingsFailTheRun() {
        stubPortfolio();
        when(runLedger.start(eq(RunType.MONTHLY_REVIEW), eq(Strategy.BALANCED), eq(3L), any())).thenReturn(RUN);
        FunnelConfig.Rebalance bad = settings(true, false);
        bad.setSellThreshold(60);

        assertThatThrownBy(() -> pipeline.review(3L, null, bad)).isInstanceOf(PipelineValidationException.class);

        verify(runLedger).fail(eq(RUN), startsWith("Invalid pipeline configuration"));
        verify(portfolioLedger, never()).holdings(any());
    }

    @Test
    void priceFallsBackToLastPriceThenCost() {
        when(marketData.fetchPrice("ACME")).thenReturn(null);
        assertThat(pipeline.currentPrice(acme)).isEqualTo(90);

        Holding unpriced = Holding.builder().ticker("ACME").shares(10).avgCost(80).build();
        assertThat(pipeline.currentPrice(unpriced)).isEqualTo(80);
    }
}
