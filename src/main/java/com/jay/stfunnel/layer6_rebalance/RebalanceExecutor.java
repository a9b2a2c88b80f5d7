package com.jay.stfunnel.layer6_rebalance;

import com.jay.stfunnel.layer6_rebalance.RebalanceEngine.RecommendedTrade;
import com.jay.stfunnel.layer7_ledger.PortfolioLedger;
import com.jay.stfunnel.model.enums.TradeType;
import com.jay.stfunnel.model.enums.TransactionAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 6: applies a trade plan to the portfolio ledger.
 * Each trade is applied on its own with its own transaction row. A trade whose holding change
 * fails is logged and skipped; earlier trades are not rolled back. A trade whose holding change
 * succeeded counts as executed even if its transaction row fails. No broker is involved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RebalanceExecutor {

    private final PortfolioLedger ledger;

    /** {@code recorded} is false when the holding changed but its transaction row could not be written. */
    public record ExecutedTrade(TradeType type, String ticker, long shares, double price, double value,
                                boolean recorded) {}

    public record SkippedTrade(RecommendedTrade trade, String reason) {}

    public record ExecutionResult(List<ExecutedTrade> executed, List<SkippedTrade> skipped, double cashAfter) {}

    public ExecutionResult execute(Long portfolioId, String runId, List<RecommendedTrade> trades, double startingCash) {
        log.info("=== EXECUTING {} rebalance trades for portfolio {} ===", trades.size(), portfolioId);
        List<ExecutedTrade> executed = new ArrayList<>();
        List<SkippedTrade> skipped = new ArrayList<>();
        double cash = startingCash;

        for (RecommendedTrade trade : trades) {
            boolean sell = trade.type().side() == TransactionAction.SELL;
            if (!sell && cash < trade.value()) {
                log.warn("Skipping {} {}: needs ${} but only ${} cash", trade.type(), trade.ticker(),
                    String.format("%.2f", trade.value()), String.format("%.2f", cash));
                skipped.add(new SkippedTrade(trade, "Insufficient cash"));
                continue;
            }
            try {
                if (sell) {
                    ledger.reduceHolding(portfolioId, trade.ticker(), trade.shares());
                } else {
                    ledger.addHolding(portfolioId, trade.ticker(), trade.companyName(), trade.sector(),
                        trade.shares(), trade.price(), trade.conviction(), trade.convictionLevel());
                }
            } catch (Exception e) {
                log.warn("Failed to execute {} for {}: {}", trade.type(), trade.ticker(), e.getMessage());
                skipped.add(new SkippedTrade(trade, String.valueOf(e.getMessage())));
                continue;
            }

            // The holding has changed, so cash follows it whether or not the audit row lands.
            cash += sell ? trade.value() : -trade.value();
            boolean recorded = recordTransaction(portfolioId, runId, trade);
            executed.add(new ExecutedTrade(trade.type(), trade.ticker(), trade.shares(), trade.price(),
                trade.value(), recorded));
            log.info("  {} {}: {} shares @ ${}", trade.type(), trade.ticker(), trade.shares(),
                String.format("%.2f", trade.price()));
        }

        ledger.updateCash(portfolioId, cash);
        log.info("Executed {}/{} trades, cash now ${}", executed.size(), trades.size(), String.format("%.2f", cash));
        return new ExecutionResult(executed, skipped, cash);
    }

    private boolean recordTransaction(Long portfolioId, String runId, RecommendedTrade trade) {
        try {
            ledger.recordTransaction(portfolioId, trade.ticker(), trade.type().side(), trade.shares(),
                trade.price(), "Rebalance " + trade.type() + ": " + trade.reason(), runId);
            return true;
        } catch (Exception e) {
            log.error("{} {} was applied to portfolio {} but its transaction row was not written: {}",
                trade.type(), trade.ticker(), portfolioId, e.getMessage(), e);
            return false;
        }
    }
}
