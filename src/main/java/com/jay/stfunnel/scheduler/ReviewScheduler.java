package com.jay.stfunnel.scheduler;

import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.entity.Portfolio;
import com.jay.stfunnel.layer7_ledger.PortfolioLedger;
import com.jay.stfunnel.pipeline.RebalancePipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Monthly review of every stored portfolio, first trading day of the month at 07:00.
 * Disabled unless scheduler.monthly_review_enabled is set; a failing portfolio does not
 * stop the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReviewScheduler {

    private final RebalancePipeline rebalancePipeline;
    private final PortfolioLedger portfolioLedger;
    private final FunnelConfig config;

    @Scheduled(cron = "${funnel.review-cron:0 0 7 1 * *}")
    public void monthlyReview() {
        if (!config.scheduler().isMonthlyReviewEnabled()) {
            log.debug("Monthly review disabled, skipping");
            return;
        }
        List<Portfolio> portfolios = portfolioLedger.allPortfolios();
        log.info("=== MONTHLY REVIEW: {} portfolios ===", portfolios.size());
        int reviewed = 0;
        for (Portfolio portfolio : portfolios) {
            try {
                RebalancePipeline.ReviewResult result = rebalancePipeline.review(portfolio.getId(), null, null);
                log.info("Portfolio {} reviewed in run {}: {}", portfolio.getId(), result.runId(), result.plan().summary());
                reviewed++;
            } catch (Exception e) {
                log.error("Monthly review failed for portfolio {}: {}", portfolio.getId(), e.getMessage());
            }
        }
        log.info("Monthly review complete: {}/{} portfolios", reviewed, portfolios.size());
    }
}
