package com.jay.stfunnel.layer2_scoring;

import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.exception.MarketDataException;
import com.jay.stfunnel.layer1_data.MarketDataProvider;
import com.jay.stfunnel.model.BuildRequest;
import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.enums.Strategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchScreenerTest {

    private MarketDataProvider marketData;
    private BatchScreener screener;
    private FunnelConfig config;

    @BeforeEach
    void setUp() {
        marketData = mock(MarketDataProvider.class);
        config = new FunnelConfig();
        screener = new BatchScreener(marketData, new StockScorer(), new StockRanker(), config);
    }

    private static Candidate strong(String ticker, String sector) {
        return Candidate.builder()
            .ticker(ticker).companyName(ticker + " Corp").sector(sector).price(100.0).marketCap(5e10)
            .peRatio(12.0).pbRatio(2.0).dividendYield(3.0)
            .profitMargin(25.0).roe(25.0).currentRatio(2.0)
            .beta(0.9).revenueGrowth(15.0).earningsGrowth(20.0).fiftyTwoWeekChange(30.0)
            .build();
    }

    private BatchScreener.Tier1Criteria criteria(double minScore, int maxCandidates, double maxSectorPct) {
        BuildRequest request = BuildRequest.defaults(config, Strategy.BALANCED).toBuilder()
            .tier1MinScore(minScore).tier1MaxCandidates(maxCandidates).maxSectorPct(maxSectorPct).build();
        return BatchScreener.Tier1Criteria.from(config, request);
    }

    @Test
    void failedFetchIsReportedAndBatchCompletes() {
        when(marketData.fetchCandidate("AAA")).thenReturn(strong("AAA", "Technology"));
        when(marketData.fetchCandidate("BAD")).thenThrow(new MarketDataException("BAD", "HTTP 404"));
        when(marketData.fetchCandidate("CCC")).thenReturn(strong("CCC", "Energy"));

        BatchScreener.BatchScoreResult result =
            screener.scoreBatch(List.of("AAA", "BAD", "CCC"), Strategy.BALANCED, BatchScreener.ProgressListener.NONE);

        assertThat(result.scores()).extracting(s -> s.ticker()).containsExactlyInAnyOrder("AAA", "CCC");
        assertThat(result.failed()).singleElement()
            .satisfies(f -> {
                assertThat(f.ticker()).isEqualTo("BAD");
                assertThat(f.reason()).contains("HTTP 404");
            });
    }

    @Test
    void filtersAreAppliedInOrderAndCounted() {
        when(marketData.fetchCandidate("GOOD")).thenReturn(strong("GOOD", "Technology"));
        when(marketData.fetchCandidate("BURN")).thenReturn(strong("BURN", "Technology").toBuilder().profitMargin(-5.0).build());
        when(marketData.fetchCandidate("PRICY")).thenReturn(strong("PRICY", "Energy").toBuilder().peRatio(150.0).build());
        when(marketData.fetchCandidate("TINY")).thenReturn(strong("TINY", "Utilities").toBuilder().marketCap(2e8).build());
        when(marketData.fetchCandidate("WEAK")).thenReturn(Candidate.builder().ticker("WEAK").beta(3.0).build());

        BatchScreener.Tier1Result result = screener.screen(
            List.of("GOOD", "BURN", "PRICY", "TINY", "WEAK"), Strategy.BALANCED, criteria(40, 10, 100));

        assertThat(result.candidates()).extracting(s -> s.ticker()).containsExactly("GOOD");
        assertThat(result.rejectionBreakdown())
            .containsEntry("negativeFCF", 1)
            .containsEntry("highPE", 1)
            .containsEntry("lowMarketCap", 1)
            .containsEntry("lowScore", 1)
            .containsEntry("dataError", 0);
        assertThat(result.totalScreened()).isEqualTo(5);
        assertThat(result.suggestedWeights()).containsOnlyKeys("GOOD");
    }

    @Test
    void sectorCapLimitsCandidates() {
        for (String t : List.of("T1", "T2", "T3", "T4")) {
            when(marketData.fetchCandidate(t)).thenReturn(strong(t, "Technology"));
        }
        when(marketData.fetchCandidate("E1")).thenReturn(strong("E1", "Energy"));

        BatchScreener.Tier1Result result = screener.screen(
            List.of("T1", "T2", "T3", "T4", "E1"), Strategy.GROWTH, criteria(0, 4, 50));

        assertThat(result.sectorBreakdown()).containsEntry("Technology", 2).containsEntry("Energy", 1);
        assertThat(result.rejectionBreakdown()).containsEntry("sectorLimit", 2);
        assertThat(result.candidates()).hasSize(3);
    }

    @Test
    void withLimitsKeepsOtherCriteria() {
        BatchScreener.Tier1Criteria base = criteria(50, 80, 25);
        BatchScreener.Tier1Criteria narrowed = base.withLimits(55, 50);

        assertThat(narrowed.minScore()).isEqualTo(55);
        assertThat(narrowed.maxCandidates()).isEqualTo(50);
        assertThat(narrowed.maxPe()).isEqualTo(base.maxPe());
        assertThat(narrowed.maxSectorPct()).isEqualTo(25);
    }
}
