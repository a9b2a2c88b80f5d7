package com.jay.stfunnel.scheduler;

import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.entity.Portfolio;
import com.jay.stfunnel.layer6_rebalance.RebalanceEngine;
import com.jay.stfunnel.layer7_ledger.PortfolioLedger;
import com.jay.stfunnel.pipeline.RebalancePipeline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewSchedulerTest {

    @Mock private RebalancePipeline rebalancePipeline;
    @Mock private PortfolioLedger portfolioLedger;

    private final FunnelConfig config = new FunnelConfig();

    @Test
    void disabledByDefault() {
        new ReviewScheduler(rebalancePipeline, portfolioLedger, config).monthlyReview();

        verifyNoInteractions(rebalancePipeline, portfolioLedger);
    }

    @Test
    void oneFailingPortfolioDoesNotStopTheRest() {
        config.scheduler().setMonthlyReviewEnabled(true);
        when(portfolioLedger.allPortfolios()).thenReturn(List.of(
            Portfolio.builder().id(1L).build(), Portfolio.builder().id(2L).build()));
        when(rebalancePipeline.review(1L, null, null)).thenThrow(new IllegalStateException("provider down"));
        RebalanceEngine.TradePlan plan = new RebalanceEngine.TradePlan(List.of(), 0, 0, 0, 0, false);
        when(rebalancePipeline.review(2L, null, null)).thenReturn(new RebalancePipeline.ReviewResult(
            "REB-2-1", 2L, null, 0, List.of(), List.of(), plan, null, null));

        new ReviewScheduler(rebalancePipeline, portfolioLedger, config).monthlyReview();

        verify(rebalancePipeline).review(1L, null, null);
        verify(rebalancePipeline).review(2L, null, null);
    }
}
